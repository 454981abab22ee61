package com.ragsync.sync;

public record SyncReport(
        int fetched,
        int accepted,
        int rejected,
        int duplicates,
        int unchanged,
        int changed,
        int embeddingFailures,
        int documentsWritten,
        int chunksWritten,
        int chunksDeleted,
        int deactivated) {
}
