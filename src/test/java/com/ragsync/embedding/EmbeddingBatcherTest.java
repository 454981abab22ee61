package com.ragsync.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.ragsync.ingest.Chunk;

class EmbeddingBatcherTest {

    @Test
    void shouldEmbedInBatchesAndKeepOrder() {
        RecordingGateway gateway = new RecordingGateway(Set.of());
        EmbeddingBatcher batcher = new EmbeddingBatcher(gateway, "model-a", true, 2);

        EmbeddingBatcher.Result result = batcher.embed(chunks(Map.of("doc-1", 3)));

        assertEquals(List.of(2, 1), gateway.batchSizes);
        assertEquals(List.of("model-a", "model-a"), gateway.models);
        List<float[]> vectors = result.vectorsByDocument().get("doc-1");
        assertEquals(3, vectors.size());
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(new float[] { ("doc-1#" + i).length(), i }, vectors.get(i));
        }
        assertTrue(result.failedDocuments().isEmpty());
    }

    @Test
    void shouldMarkEveryDocumentInFailedBatchAsFailed() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("doc-1", 1);
        counts.put("doc-2", 2);
        counts.put("doc-3", 1);
        // batches: [doc-1#0, doc-2#0] [doc-2#1, doc-3#0]; the second one fails
        RecordingGateway gateway = new RecordingGateway(Set.of("doc-3#0"));
        EmbeddingBatcher batcher = new EmbeddingBatcher(gateway, "model-a", false, 2);

        EmbeddingBatcher.Result result = batcher.embed(chunks(counts));

        assertEquals(Set.of("doc-2", "doc-3"), result.failedDocuments());
        assertEquals(Set.of("doc-1"), result.vectorsByDocument().keySet());
    }

    @Test
    void shouldFailBatchWhenGatewayReturnsWrongCount() {
        EmbeddingGateway shortGateway = new EmbeddingGateway() {
            @Override
            public List<float[]> embed(List<String> texts, String modelId, boolean normalize) {
                return List.of(new float[] { 1f });
            }

            @Override
            public String name() {
                return "short";
            }
        };

        EmbeddingBatcher.Result result = new EmbeddingBatcher(shortGateway, "m", false, 10).embed(chunks(Map.of("doc-1", 2)));

        assertEquals(Set.of("doc-1"), result.failedDocuments());
        assertFalse(result.vectorsByDocument().containsKey("doc-1"));
    }

    @Test
    void shouldFailBatchWhenDimensionsDiffer() {
        EmbeddingGateway ragged = new EmbeddingGateway() {
            @Override
            public List<float[]> embed(List<String> texts, String modelId, boolean normalize) {
                return List.of(new float[] { 1f, 2f }, new float[] { 1f });
            }

            @Override
            public String name() {
                return "ragged";
            }
        };

        EmbeddingBatcher.Result result = new EmbeddingBatcher(ragged, "m", false, 10).embed(chunks(Map.of("doc-1", 2)));

        assertEquals(Set.of("doc-1"), result.failedDocuments());
    }

    @Test
    void shouldRejectNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingBatcher(new RecordingGateway(Set.of()), "m", true, 0));
    }

    private static Map<String, List<Chunk>> chunks(Map<String, Integer> counts) {
        Map<String, List<Chunk>> chunks = new LinkedHashMap<>();
        counts.forEach((documentId, count) -> {
            List<Chunk> documentChunks = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                documentChunks.add(new Chunk(i, documentId + "#" + i, "hash-" + i));
            }
            chunks.put(documentId, documentChunks);
        });
        return chunks;
    }

    private static final class RecordingGateway implements EmbeddingGateway {
        private final Set<String> failingTexts;
        private final List<Integer> batchSizes = new ArrayList<>();
        private final List<String> models = new ArrayList<>();

        private RecordingGateway(Set<String> failingTexts) {
            this.failingTexts = failingTexts;
        }

        @Override
        public List<float[]> embed(List<String> texts, String modelId, boolean normalize) throws EmbeddingException {
            batchSizes.add(texts.size());
            models.add(modelId);
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                if (failingTexts.contains(text)) {
                    throw new EmbeddingException("model overloaded");
                }
                int index = Integer.parseInt(text.substring(text.indexOf('#') + 1));
                vectors.add(new float[] { text.length(), index });
            }
            return vectors;
        }

        @Override
        public String name() {
            return "recording";
        }
    }
}
