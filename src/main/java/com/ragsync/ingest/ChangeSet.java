package com.ragsync.ingest;

import java.util.List;

public record ChangeSet(List<NormalizedDocument> unchanged, List<NormalizedDocument> workSet) {

    public boolean isEmpty() {
        return workSet.isEmpty();
    }
}
