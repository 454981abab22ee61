package com.ragsync.ingest;

import java.util.List;

public record NormalizationResult(List<NormalizedDocument> documents, int rejected, int duplicates) {
}
