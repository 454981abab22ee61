package com.ragsync.ingest;

import java.util.Map;

public record NormalizedDocument(
        String id,
        String source,
        String title,
        String url,
        String content,
        String contentHash,
        Map<String, String> extra) {
}
