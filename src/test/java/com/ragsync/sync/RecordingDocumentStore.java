package com.ragsync.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.ragsync.store.ChunkRecord;
import com.ragsync.store.DocumentRecord;
import com.ragsync.store.DocumentStore;
import com.ragsync.store.StoreTransaction;
import com.ragsync.store.TransactionWork;

/** Delegating store that records every write issued through a transaction. */
class RecordingDocumentStore implements DocumentStore {
    final List<String> writes = new ArrayList<>();
    int transactions;
    private final DocumentStore delegate;

    RecordingDocumentStore(DocumentStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Map<String, String> loadContentHashes(Collection<String> documentIds) {
        return delegate.loadContentHashes(documentIds);
    }

    @Override
    public Map<String, String> loadActiveDocuments(String source) {
        return delegate.loadActiveDocuments(source);
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        transactions++;
        return delegate.inTransaction(transaction -> work.execute(new RecordingTransaction(transaction)));
    }

    @Override
    public Optional<DocumentRecord> findDocument(String documentId) {
        return delegate.findDocument(documentId);
    }

    @Override
    public List<ChunkRecord> loadChunks(String documentId) {
        return delegate.loadChunks(documentId);
    }

    @Override
    public void close() {
        delegate.close();
    }

    private final class RecordingTransaction implements StoreTransaction {
        private final StoreTransaction transaction;

        private RecordingTransaction(StoreTransaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public boolean upsertDocument(DocumentRecord document, boolean force) {
            boolean written = transaction.upsertDocument(document, force);
            if (written) {
                writes.add("upsert:" + document.id());
            }
            return written;
        }

        @Override
        public int deleteChunks(String documentId) {
            writes.add("delete:" + documentId);
            return transaction.deleteChunks(documentId);
        }

        @Override
        public int insertChunks(List<ChunkRecord> chunks) {
            if (!chunks.isEmpty()) {
                writes.add("insert:" + chunks.get(0).documentId() + "x" + chunks.size());
            }
            return transaction.insertChunks(chunks);
        }

        @Override
        public int deactivate(Collection<String> documentIds) {
            writes.add("deactivate:" + documentIds.size());
            return transaction.deactivate(documentIds);
        }
    }
}
