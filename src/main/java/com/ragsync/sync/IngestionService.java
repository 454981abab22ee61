package com.ragsync.sync;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragsync.embedding.EmbeddingBatcher;
import com.ragsync.embedding.EmbeddingGateway;
import com.ragsync.ingest.ChangeDetector;
import com.ragsync.ingest.ChangeSet;
import com.ragsync.ingest.Chunk;
import com.ragsync.ingest.Chunker;
import com.ragsync.ingest.DocumentNormalizer;
import com.ragsync.ingest.NormalizationResult;
import com.ragsync.ingest.NormalizedDocument;
import com.ragsync.ingest.RawDocument;
import com.ragsync.runtime.AppConfig;
import com.ragsync.store.DocumentStore;

public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentNormalizer normalizer;
    private final ChangeDetector changeDetector;
    private final Chunker chunker;
    private final EmbeddingBatcher embeddingBatcher;
    private final Synchronizer synchronizer;
    private final DocumentStore store;
    private final boolean deactivateMissing;
    private final boolean dryRun;

    public IngestionService(AppConfig config, EmbeddingGateway embeddingGateway, DocumentStore store, Clock clock, boolean dryRun) {
        this.normalizer = new DocumentNormalizer(
                config.getNormalization().getMinContentChars(),
                config.getNormalization().getDuplicatePolicy());
        this.changeDetector = new ChangeDetector(config.getDiff().isEnabled());
        this.chunker = new Chunker(config.getChunking().getMaxChars(), config.getChunking().getOverlapChars());
        this.embeddingBatcher = new EmbeddingBatcher(
                embeddingGateway,
                config.getEmbedding().getModel(),
                config.getEmbedding().isNormalize(),
                config.getEmbedding().getBatchSize());
        this.synchronizer = new Synchronizer(store, config.getSync().getWriteBatchSize(), clock);
        this.store = store;
        this.deactivateMissing = config.getSync().isDeactivateMissing();
        this.dryRun = dryRun;
    }

    public SyncReport run(List<RawDocument> rawDocuments, Collection<String> completeSources) {
        NormalizationResult normalized = normalizer.normalizeAll(rawDocuments);
        List<NormalizedDocument> documents = normalized.documents();
        log.info("Normalized documents fetched={} accepted={} rejected={} duplicates={}",
                rawDocuments.size(), documents.size(), normalized.rejected(), normalized.duplicates());

        Map<String, String> storedHashes = documents.isEmpty()
                ? Map.of()
                : store.loadContentHashes(documents.stream().map(NormalizedDocument::id).toList());
        ChangeSet changes = changeDetector.detect(documents, storedHashes);
        log.info("Change detection unchanged={} changed={} diffEnabled={}",
                changes.unchanged().size(), changes.workSet().size(), changeDetector.isDiffEnabled());

        Map<String, List<Chunk>> chunksByDocument = new LinkedHashMap<>();
        for (NormalizedDocument document : changes.workSet()) {
            chunksByDocument.put(document.id(), chunker.chunk(document.content()));
        }
        int plannedChunks = chunksByDocument.values().stream().mapToInt(List::size).sum();

        if (dryRun) {
            log.info("Dry run: {} documents would be rewritten with {} chunks", changes.workSet().size(), plannedChunks);
            return new SyncReport(rawDocuments.size(), documents.size(), normalized.rejected(), normalized.duplicates(),
                    changes.unchanged().size(), changes.workSet().size(), 0, 0, 0, 0, 0);
        }

        EmbeddingBatcher.Result embedded = chunksByDocument.isEmpty()
                ? new EmbeddingBatcher.Result(Map.of(), Set.of())
                : embeddingBatcher.embed(chunksByDocument);
        if (!embedded.failedDocuments().isEmpty()) {
            log.warn("Skipping {} documents whose embeddings failed; their stored state is kept",
                    embedded.failedDocuments().size());
        }

        List<PreparedDocument> prepared = new ArrayList<>();
        for (NormalizedDocument document : changes.workSet()) {
            if (embedded.failedDocuments().contains(document.id())) {
                continue;
            }
            prepared.add(new PreparedDocument(
                    document,
                    chunksByDocument.get(document.id()),
                    embedded.vectorsByDocument().get(document.id())));
        }

        WriteSummary written = synchronizer.write(prepared, !changeDetector.isDiffEnabled());
        int deactivated = deactivateMissing ? deactivateMissing(documents, completeSources) : 0;

        return new SyncReport(
                rawDocuments.size(),
                documents.size(),
                normalized.rejected(),
                normalized.duplicates(),
                changes.unchanged().size(),
                changes.workSet().size(),
                embedded.failedDocuments().size(),
                written.documentsWritten(),
                written.chunksInserted(),
                written.chunksDeleted(),
                deactivated);
    }

    private int deactivateMissing(List<NormalizedDocument> documents, Collection<String> completeSources) {
        Map<String, Set<String>> seenBySource = documents.stream()
                .collect(Collectors.groupingBy(NormalizedDocument::source,
                        Collectors.mapping(NormalizedDocument::id, Collectors.toSet())));
        int deactivated = 0;
        for (String source : completeSources) {
            Set<String> seen = seenBySource.get(source);
            if (seen == null || seen.isEmpty()) {
                log.warn("Not deactivating documents of source {}: nothing was collected for it this run", source);
                continue;
            }
            deactivated += synchronizer.deactivateMissing(source, seen);
        }
        return deactivated;
    }
}
