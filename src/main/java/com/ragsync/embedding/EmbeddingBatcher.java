package com.ragsync.embedding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragsync.ingest.Chunk;

public class EmbeddingBatcher {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingBatcher.class);

    private final EmbeddingGateway gateway;
    private final String modelId;
    private final boolean normalize;
    private final int batchSize;

    public EmbeddingBatcher(EmbeddingGateway gateway, String modelId, boolean normalize, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.gateway = gateway;
        this.modelId = modelId;
        this.normalize = normalize;
        this.batchSize = batchSize;
    }

    public Result embed(Map<String, List<Chunk>> chunksByDocument) {
        List<ChunkRef> refs = new ArrayList<>();
        chunksByDocument.forEach((documentId, chunks) -> {
            for (Chunk chunk : chunks) {
                refs.add(new ChunkRef(documentId, chunk));
            }
        });

        Map<String, float[][]> vectors = new HashMap<>();
        chunksByDocument.forEach((documentId, chunks) -> vectors.put(documentId, new float[chunks.size()][]));
        Set<String> failed = new LinkedHashSet<>();
        int dimension = -1;

        for (int start = 0; start < refs.size(); start += batchSize) {
            List<ChunkRef> batch = refs.subList(start, Math.min(refs.size(), start + batchSize));
            if (batch.stream().allMatch(ref -> failed.contains(ref.documentId()))) {
                continue;
            }
            List<String> texts = batch.stream().map(ref -> ref.chunk().content()).toList();
            try {
                List<float[]> embedded = gateway.embed(texts, modelId, normalize);
                if (embedded.size() != texts.size()) {
                    throw new EmbeddingException("Gateway returned " + embedded.size() + " vectors for " + texts.size() + " texts");
                }
                for (int i = 0; i < batch.size(); i++) {
                    float[] vector = embedded.get(i);
                    if (vector == null || vector.length == 0) {
                        throw new EmbeddingException("Gateway returned an empty vector at position " + i);
                    }
                    if (dimension < 0) {
                        dimension = vector.length;
                    } else if (vector.length != dimension) {
                        throw new EmbeddingException("Vector dimension " + vector.length + " differs from " + dimension);
                    }
                }
                for (int i = 0; i < batch.size(); i++) {
                    ChunkRef ref = batch.get(i);
                    vectors.get(ref.documentId())[ref.chunk().index()] = embedded.get(i);
                }
            } catch (EmbeddingException e) {
                Set<String> affected = new LinkedHashSet<>();
                batch.forEach(ref -> affected.add(ref.documentId()));
                failed.addAll(affected);
                log.warn("Embedding batch failed offset={} size={} documents={} cause={}",
                        start, batch.size(), affected.size(), e.getMessage());
            }
        }

        Map<String, List<float[]>> embeddedByDocument = new HashMap<>();
        vectors.forEach((documentId, documentVectors) -> {
            if (!failed.contains(documentId)) {
                embeddedByDocument.put(documentId, List.of(documentVectors));
            }
        });
        return new Result(embeddedByDocument, failed);
    }

    private record ChunkRef(String documentId, Chunk chunk) {
    }

    public record Result(Map<String, List<float[]>> vectorsByDocument, Set<String> failedDocuments) {
    }
}
