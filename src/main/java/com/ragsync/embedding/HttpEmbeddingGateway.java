package com.ragsync.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpEmbeddingGateway implements EmbeddingGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingGateway.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;

    public HttpEmbeddingGateway(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public void load() throws EmbeddingException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new EmbeddingException("Embedding endpoint is not configured");
        }
        log.info("Using embedding endpoint {}", endpoint);
    }

    @Override
    public List<float[]> embed(List<String> texts, String modelId, boolean normalize) throws EmbeddingException {
        if (texts.isEmpty()) {
            return List.of();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", modelId);
        payload.put("input", texts);
        payload.put("normalize", normalize);

        Request.Builder requestBuilder = new Request.Builder().url(endpoint);
        try {
            requestBuilder.post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        } catch (IOException e) {
            throw new EmbeddingException("Unable to encode embedding request", e);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingException("Embedding request failed with HTTP " + response.code());
            }
            List<float[]> vectors = parseVectors(mapper.readTree(body.string()));
            if (vectors.size() != texts.size()) {
                throw new EmbeddingException("Embedding response size " + vectors.size()
                        + " does not match request size " + texts.size());
            }
            if (normalize) {
                vectors.forEach(Vectors::l2Normalize);
            }
            return vectors;
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "http";
    }

    List<float[]> parseVectors(JsonNode root) throws EmbeddingException {
        JsonNode data = root.path("data");
        if (data.isArray()) {
            float[][] ordered = new float[data.size()][];
            for (int i = 0; i < data.size(); i++) {
                JsonNode item = data.get(i);
                int index = item.has("index") ? item.get("index").asInt() : i;
                if (index < 0 || index >= ordered.length || ordered[index] != null) {
                    throw new EmbeddingException("Embedding response has invalid index " + index);
                }
                ordered[index] = toVector(item.path("embedding"));
            }
            return new ArrayList<>(List.of(ordered));
        }
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray()) {
            List<float[]> vectors = new ArrayList<>(embeddings.size());
            for (JsonNode node : embeddings) {
                vectors.add(toVector(node));
            }
            return vectors;
        }
        throw new EmbeddingException("Embedding response has neither 'data' nor 'embeddings'");
    }

    private static float[] toVector(JsonNode node) throws EmbeddingException {
        if (!node.isArray() || node.isEmpty()) {
            throw new EmbeddingException("Embedding vector is missing or empty");
        }
        float[] out = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            out[i] = (float) node.get(i).asDouble();
        }
        return out;
    }
}
