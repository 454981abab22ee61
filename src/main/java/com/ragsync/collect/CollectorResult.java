package com.ragsync.collect;

import java.util.List;

import com.ragsync.ingest.RawDocument;

public record CollectorResult(String collector, String source, List<RawDocument> documents, boolean complete, int failures) {

    public CollectorResult {
        documents = List.copyOf(documents);
    }

    public static CollectorResult failed(String collector, String source) {
        return new CollectorResult(collector, source, List.of(), false, 1);
    }
}
