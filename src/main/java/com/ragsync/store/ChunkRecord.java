package com.ragsync.store;

public record ChunkRecord(String documentId, int chunkIndex, String content, String contentHash, float[] embedding) {
}
