package com.ragsync.runtime;

import java.time.Duration;

import okhttp3.OkHttpClient;

public final class HttpClients {
    private HttpClients() {
    }

    public static OkHttpClient create(AppConfig.HttpConfig http) {
        Duration timeout = Duration.ofMillis(http.getTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .followRedirects(true)
                .build();
    }

    public static OkHttpClient withReadTimeout(OkHttpClient base, int timeoutMs) {
        Duration timeout = Duration.ofMillis(timeoutMs);
        return base.newBuilder()
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
    }

    public static void shutdown(OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
