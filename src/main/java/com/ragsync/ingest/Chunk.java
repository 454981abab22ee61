package com.ragsync.ingest;

public record Chunk(int index, String content, String contentHash) {
}
