package com.ragsync.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class HashingEmbeddingGateway implements EmbeddingGateway {
    private final int dimension;

    public HashingEmbeddingGateway(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts, String modelId, boolean normalize) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            float[] vector = embedOne(text);
            vectors.add(normalize ? Vectors.l2Normalize(vector) : vector);
        }
        return vectors;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }

    public int dimension() {
        return dimension;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[\\s\\p{Punct}。、！？「」]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }
        return vector;
    }

    private void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }
}
