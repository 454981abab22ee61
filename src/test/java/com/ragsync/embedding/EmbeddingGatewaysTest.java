package com.ragsync.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ragsync.runtime.AppConfig;
import com.ragsync.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

class EmbeddingGatewaysTest {
    private final OkHttpClient client = new OkHttpClient();

    @Test
    void shouldCreateHashingGatewayWithConfiguredDimension() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("hashing");
        config.setDimension(16);

        EmbeddingGateway gateway = EmbeddingGateways.create(config, client, Map.of());

        assertInstanceOf(HashingEmbeddingGateway.class, gateway);
        assertEquals(16, ((HashingEmbeddingGateway) gateway).dimension());
    }

    @Test
    void shouldCreateHttpGatewayByDefault() {
        EmbeddingGateway gateway = EmbeddingGateways.create(new AppConfig.EmbeddingConfig(), client, Map.of("EMBEDDING_API_KEY", "k"));

        assertInstanceOf(HttpEmbeddingGateway.class, gateway);
        assertEquals("http", gateway.name());
    }

    @Test
    void shouldRejectUnknownProvider() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("quantum");

        assertThrows(ConfigurationException.class, () -> EmbeddingGateways.create(config, client, Map.of()));
    }
}
