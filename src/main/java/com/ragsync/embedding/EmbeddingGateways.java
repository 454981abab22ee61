package com.ragsync.embedding;

import java.util.Locale;
import java.util.Map;

import com.ragsync.runtime.AppConfig;
import com.ragsync.runtime.ConfigurationException;
import com.ragsync.runtime.HttpClients;

import okhttp3.OkHttpClient;

public final class EmbeddingGateways {
    private EmbeddingGateways() {
    }

    public static EmbeddingGateway create(AppConfig.EmbeddingConfig config, OkHttpClient httpClient, Map<String, String> environment) {
        String provider = config.getProvider() == null ? "http" : config.getProvider().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "hashing":
            case "local":
                return new HashingEmbeddingGateway(config.getDimension());
            case "http":
                String apiKey = config.getApiKeyEnv() == null ? null : environment.get(config.getApiKeyEnv());
                return new HttpEmbeddingGateway(
                        HttpClients.withReadTimeout(httpClient, config.getTimeoutMs()),
                        config.getEndpoint(),
                        apiKey);
            default:
                throw new ConfigurationException("Unknown embedding.provider: " + config.getProvider());
        }
    }
}
