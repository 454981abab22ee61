package com.ragsync.sync;

import java.util.List;

import com.ragsync.ingest.Chunk;
import com.ragsync.ingest.NormalizedDocument;

public record PreparedDocument(NormalizedDocument document, List<Chunk> chunks, List<float[]> embeddings) {

    public PreparedDocument {
        chunks = List.copyOf(chunks);
        embeddings = List.copyOf(embeddings);
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException("Document " + document.id() + " has " + chunks.size()
                    + " chunks but " + embeddings.size() + " embeddings");
        }
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).index() != i) {
                throw new IllegalArgumentException("Document " + document.id() + " chunk indexes are not contiguous at " + i);
            }
        }
    }
}
