package com.ragsync.store;

import java.util.Collection;
import java.util.List;

public interface StoreTransaction {

    /**
     * Inserts or updates the document row.
     *
     * @param force write even when the stored content hash already equals the new one
     * @return {@code true} when a row was inserted or updated
     */
    boolean upsertDocument(DocumentRecord document, boolean force);

    int deleteChunks(String documentId);

    int insertChunks(List<ChunkRecord> chunks);

    int deactivate(Collection<String> documentIds);
}
