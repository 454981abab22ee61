package com.ragsync.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ChangeDetector {
    private final boolean diffEnabled;

    public ChangeDetector(boolean diffEnabled) {
        this.diffEnabled = diffEnabled;
    }

    public ChangeSet detect(List<NormalizedDocument> documents, Map<String, String> storedHashes) {
        List<NormalizedDocument> unchanged = new ArrayList<>();
        List<NormalizedDocument> workSet = new ArrayList<>();
        for (NormalizedDocument document : documents) {
            if (diffEnabled && document.contentHash().equals(storedHashes.get(document.id()))) {
                unchanged.add(document);
            } else {
                workSet.add(document);
            }
        }
        return new ChangeSet(List.copyOf(unchanged), List.copyOf(workSet));
    }

    public boolean isDiffEnabled() {
        return diffEnabled;
    }
}
