package com.ragsync.sync;

public record WriteSummary(int documentsWritten, int documentsSkipped, int chunksDeleted, int chunksInserted) {

    public static WriteSummary empty() {
        return new WriteSummary(0, 0, 0, 0);
    }

    public WriteSummary plus(WriteSummary other) {
        return new WriteSummary(
                documentsWritten + other.documentsWritten,
                documentsSkipped + other.documentsSkipped,
                chunksDeleted + other.chunksDeleted,
                chunksInserted + other.chunksInserted);
    }
}
