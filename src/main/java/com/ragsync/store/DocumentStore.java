package com.ragsync.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface DocumentStore extends AutoCloseable {

    // inactive rows count as absent
    Map<String, String> loadContentHashes(Collection<String> documentIds);

    Map<String, String> loadActiveDocuments(String source);

    /**
     * Runs {@code work} in one transaction. Any exception thrown by {@code work} or by the
     * commit rolls everything back and surfaces as a {@link StoreException}.
     */
    <T> T inTransaction(TransactionWork<T> work);

    Optional<DocumentRecord> findDocument(String documentId);

    List<ChunkRecord> loadChunks(String documentId);

    @Override
    void close();
}
