package com.ragsync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragsync.ingest.Chunk;
import com.ragsync.ingest.ContentHasher;
import com.ragsync.ingest.NormalizedDocument;
import com.ragsync.store.ChunkRecord;
import com.ragsync.store.DocumentRecord;
import com.ragsync.store.DocumentStore;
import com.ragsync.store.LocalJsonDocumentStore;
import com.ragsync.store.StoreException;
import com.ragsync.store.StoreTransaction;
import com.ragsync.store.TransactionWork;

class SynchronizerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private RecordingDocumentStore store;
    private Synchronizer synchronizer;

    @BeforeEach
    void setUp() {
        store = new RecordingDocumentStore(LocalJsonDocumentStore.open(tempDir.resolve("store.json")));
        synchronizer = new Synchronizer(store, 2, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldWriteDocumentsInTransactionalBatches() {
        List<PreparedDocument> workSet = List.of(prepared("a", "alpha", 2), prepared("b", "beta", 1), prepared("c", "gamma", 3));

        WriteSummary summary = synchronizer.write(workSet, false);

        assertEquals(new WriteSummary(3, 0, 0, 6), summary);
        assertEquals(2, store.transactions);
        assertEquals(3, store.loadChunks(id("c")).size());
        assertEquals(NOW, store.findDocument(id("a")).orElseThrow().retrievedAt());
    }

    @Test
    void shouldReplaceWholeChunkSetWhenContentChanges() {
        synchronizer.write(List.of(prepared("a", "alpha", 3)), false);

        WriteSummary summary = synchronizer.write(List.of(prepared("a", "alpha v2", 1)), false);

        assertEquals(new WriteSummary(1, 0, 3, 1), summary);
        assertEquals(1, store.loadChunks(id("a")).size());
        assertEquals(ContentHasher.sha1("alpha v2"), store.findDocument(id("a")).orElseThrow().contentHash());
    }

    @Test
    void shouldLeaveChunksAloneWhenStoredHashAlreadyMatches() {
        synchronizer.write(List.of(prepared("a", "alpha", 2)), false);
        store.writes.clear();

        WriteSummary summary = synchronizer.write(List.of(prepared("a", "alpha", 2)), false);

        assertEquals(new WriteSummary(0, 1, 0, 0), summary);
        assertTrue(store.writes.isEmpty());
    }

    @Test
    void shouldRewriteUnchangedDocumentsWhenForced() {
        synchronizer.write(List.of(prepared("a", "alpha", 2)), false);

        WriteSummary summary = synchronizer.write(List.of(prepared("a", "alpha", 2)), true);

        assertEquals(new WriteSummary(1, 0, 2, 2), summary);
    }

    @Test
    void shouldKeepEarlierBatchesWhenLaterBatchFails() {
        List<PreparedDocument> workSet = List.of(
                prepared("a", "alpha", 1), prepared("b", "beta", 1), prepared("c", "gamma", 1), prepared("d", "delta", 1));
        Synchronizer failing = new Synchronizer(new FailingInsertStore(store, id("d")), 2, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(StoreException.class, () -> failing.write(workSet, false));

        assertTrue(store.findDocument(id("a")).isPresent());
        assertTrue(store.findDocument(id("b")).isPresent());
        assertFalse(store.findDocument(id("c")).isPresent());
        assertFalse(store.findDocument(id("d")).isPresent());
    }

    @Test
    void shouldDeactivateOnlyDocumentsNotSeen() {
        synchronizer.write(List.of(prepared("a", "alpha", 1), prepared("b", "beta", 1)), false);

        int deactivated = synchronizer.deactivateMissing("test", Set.of(id("a")));

        assertEquals(1, deactivated);
        assertEquals(Map.of(id("a"), "https://example.org/a"), store.loadActiveDocuments("test"));
        assertEquals(0, synchronizer.deactivateMissing("test", Set.of(id("a"))));
    }

    static String id(String name) {
        return ContentHasher.documentId("test", "https://example.org/" + name);
    }

    static NormalizedDocument document(String name, String content) {
        String url = "https://example.org/" + name;
        return new NormalizedDocument(id(name), "test", name, url, content, ContentHasher.sha1(content), Map.of());
    }

    static PreparedDocument prepared(String name, String content, int chunkCount) {
        List<Chunk> chunks = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < chunkCount; i++) {
            String text = content + " part " + i;
            chunks.add(new Chunk(i, text, ContentHasher.sha1(text)));
            vectors.add(new float[] { i, 1f });
        }
        return new PreparedDocument(document(name, content), chunks, vectors);
    }

    private static final class FailingInsertStore extends RecordingDocumentStore {
        private final String failingDocumentId;

        private FailingInsertStore(DocumentStore delegate, String failingDocumentId) {
            super(delegate);
            this.failingDocumentId = failingDocumentId;
        }

        @Override
        public <T> T inTransaction(TransactionWork<T> work) {
            return super.inTransaction(transaction -> work.execute(new StoreTransaction() {
                @Override
                public boolean upsertDocument(DocumentRecord document, boolean force) {
                    return transaction.upsertDocument(document, force);
                }

                @Override
                public int deleteChunks(String documentId) {
                    return transaction.deleteChunks(documentId);
                }

                @Override
                public int insertChunks(List<ChunkRecord> chunks) {
                    if (chunks.get(0).documentId().equals(failingDocumentId)) {
                        throw new StoreException("insert rejected");
                    }
                    return transaction.insertChunks(chunks);
                }

                @Override
                public int deactivate(Collection<String> documentIds) {
                    return transaction.deactivate(documentIds);
                }
            }));
        }
    }
}
