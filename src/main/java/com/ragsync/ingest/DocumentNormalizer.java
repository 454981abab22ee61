package com.ragsync.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DocumentNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DocumentNormalizer.class);

    private final int minContentChars;
    private final DuplicatePolicy duplicatePolicy;

    public DocumentNormalizer(int minContentChars, DuplicatePolicy duplicatePolicy) {
        if (minContentChars < 0) {
            throw new IllegalArgumentException("minContentChars must not be negative");
        }
        this.minContentChars = minContentChars;
        this.duplicatePolicy = duplicatePolicy == null ? DuplicatePolicy.LAST_WINS : duplicatePolicy;
    }

    public Optional<NormalizedDocument> normalize(RawDocument raw) {
        if (raw == null || raw.url() == null || raw.url().isBlank()) {
            return Optional.empty();
        }
        String content = TextCleaner.clean(raw.content());
        if (content.isEmpty() || content.length() < minContentChars) {
            return Optional.empty();
        }
        String source = raw.source() == null || raw.source().isBlank() ? "unknown" : raw.source();
        String url = raw.url().strip();
        String title = raw.title() == null || raw.title().isBlank() ? url : raw.title().strip();
        return Optional.of(new NormalizedDocument(
                ContentHasher.documentId(source, url),
                source,
                title,
                url,
                content,
                ContentHasher.sha1(content),
                raw.extra()));
    }

    public NormalizationResult normalizeAll(List<RawDocument> rawDocuments) {
        Map<String, NormalizedDocument> byId = new LinkedHashMap<>();
        int rejected = 0;
        int duplicates = 0;
        for (RawDocument raw : rawDocuments) {
            Optional<NormalizedDocument> normalized = normalize(raw);
            if (normalized.isEmpty()) {
                rejected++;
                continue;
            }
            NormalizedDocument document = normalized.get();
            if (byId.containsKey(document.id())) {
                duplicates++;
                log.debug("Duplicate document identity source={} url={} policy={}",
                        document.source(), document.url(), duplicatePolicy);
                if (duplicatePolicy == DuplicatePolicy.FIRST_WINS) {
                    continue;
                }
            }
            byId.put(document.id(), document);
        }
        return new NormalizationResult(new ArrayList<>(byId.values()), rejected, duplicates);
    }
}
