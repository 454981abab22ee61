package com.ragsync.ingest;

import java.util.Map;

public record RawDocument(String source, String title, String url, String content, Map<String, String> extra) {

    public RawDocument {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public RawDocument(String source, String title, String url, String content) {
        this(source, title, url, content, Map.of());
    }
}
