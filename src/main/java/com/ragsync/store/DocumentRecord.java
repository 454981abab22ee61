package com.ragsync.store;

import java.time.Instant;

public record DocumentRecord(
        String id,
        String source,
        String title,
        String url,
        String contentHash,
        Instant retrievedAt,
        boolean active) {
}
