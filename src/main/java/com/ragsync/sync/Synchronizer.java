package com.ragsync.sync;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragsync.ingest.Chunk;
import com.ragsync.ingest.NormalizedDocument;
import com.ragsync.store.ChunkRecord;
import com.ragsync.store.DocumentRecord;
import com.ragsync.store.DocumentStore;
import com.ragsync.store.StoreTransaction;

public class Synchronizer {
    private static final Logger log = LoggerFactory.getLogger(Synchronizer.class);

    private final DocumentStore store;
    private final int writeBatchSize;
    private final Clock clock;

    public Synchronizer(DocumentStore store, int writeBatchSize, Clock clock) {
        if (writeBatchSize <= 0) {
            throw new IllegalArgumentException("writeBatchSize must be positive");
        }
        this.store = store;
        this.writeBatchSize = writeBatchSize;
        this.clock = clock;
    }

    public WriteSummary write(List<PreparedDocument> workSet, boolean force) {
        WriteSummary total = WriteSummary.empty();
        for (int start = 0; start < workSet.size(); start += writeBatchSize) {
            List<PreparedDocument> batch = workSet.subList(start, Math.min(workSet.size(), start + writeBatchSize));
            Instant retrievedAt = clock.instant();
            WriteSummary batchSummary = store.inTransaction(transaction -> writeBatch(transaction, batch, retrievedAt, force));
            log.debug("Committed batch offset={} documents={} written={} chunksDeleted={} chunksInserted={}",
                    start,
                    batch.size(),
                    batchSummary.documentsWritten(),
                    batchSummary.chunksDeleted(),
                    batchSummary.chunksInserted());
            total = total.plus(batchSummary);
        }
        return total;
    }

    public int deactivateMissing(String source, Set<String> seenDocumentIds) {
        Map<String, String> active = store.loadActiveDocuments(source);
        List<String> missing = active.keySet().stream()
                .filter(id -> !seenDocumentIds.contains(id))
                .sorted()
                .toList();
        if (missing.isEmpty()) {
            return 0;
        }
        int deactivated = store.inTransaction(transaction -> transaction.deactivate(missing));
        log.info("Deactivated {} documents of source {} that were not collected", deactivated, source);
        return deactivated;
    }

    private WriteSummary writeBatch(StoreTransaction transaction, Collection<PreparedDocument> batch, Instant retrievedAt, boolean force) {
        int written = 0;
        int skipped = 0;
        int deleted = 0;
        int inserted = 0;
        for (PreparedDocument prepared : batch) {
            NormalizedDocument document = prepared.document();
            boolean upserted = transaction.upsertDocument(toRecord(document, retrievedAt), force);
            if (!upserted) {
                // stored hash already matches, another run got here first
                skipped++;
                continue;
            }
            deleted += transaction.deleteChunks(document.id());
            inserted += transaction.insertChunks(toChunkRecords(prepared));
            written++;
        }
        return new WriteSummary(written, skipped, deleted, inserted);
    }

    private static DocumentRecord toRecord(NormalizedDocument document, Instant retrievedAt) {
        return new DocumentRecord(
                document.id(),
                document.source(),
                document.title(),
                document.url(),
                document.contentHash(),
                retrievedAt,
                true);
    }

    private static List<ChunkRecord> toChunkRecords(PreparedDocument prepared) {
        List<ChunkRecord> records = new ArrayList<>(prepared.chunks().size());
        for (int i = 0; i < prepared.chunks().size(); i++) {
            Chunk chunk = prepared.chunks().get(i);
            records.add(new ChunkRecord(
                    prepared.document().id(),
                    chunk.index(),
                    chunk.content(),
                    chunk.contentHash(),
                    prepared.embeddings().get(i)));
        }
        return records;
    }
}
