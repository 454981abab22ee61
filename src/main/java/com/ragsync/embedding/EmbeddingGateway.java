package com.ragsync.embedding;

import java.util.List;

public interface EmbeddingGateway extends AutoCloseable {

    default void load() throws EmbeddingException {
    }

    List<float[]> embed(List<String> texts, String modelId, boolean normalize) throws EmbeddingException;

    String name();

    @Override
    default void close() {
    }
}
