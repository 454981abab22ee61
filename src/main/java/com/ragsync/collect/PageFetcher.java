package com.ragsync.collect;

import java.io.IOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final OkHttpClient httpClient;
    private final String userAgent;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final Sleeper sleeper;

    public PageFetcher(OkHttpClient httpClient, String userAgent, int maxRetries, Duration retryBackoff, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.httpClient = httpClient;
        this.userAgent = userAgent;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
        this.sleeper = sleeper;
    }

    public FetchResult fetch(String url) throws InterruptedException {
        FetchResult result = fetchOnce(url);
        for (int attempt = 1; attempt <= maxRetries && result.isRetryable(); attempt++) {
            Duration wait = retryBackoff.multipliedBy(attempt);
            log.debug("Retrying {} in {} ms after {} (attempt {}/{})", url, wait.toMillis(), result.error(), attempt, maxRetries);
            sleeper.sleep(wait);
            result = fetchOnce(url);
        }
        if (!result.isSuccess()) {
            log.warn("Fetch {} ended with {} ({})", url, result.status(), result.error());
        }
        return result;
    }

    FetchResult fetchOnce(String url) {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            return FetchResult.empty(url, 0, "invalid url");
        }
        Request.Builder request = new Request.Builder().url(httpUrl).get();
        if (userAgent != null && !userAgent.isBlank()) {
            request.header("User-Agent", userAgent);
        }
        try (Response response = httpClient.newCall(request.build()).execute()) {
            int code = response.code();
            if (code == 429 || code >= 500) {
                return FetchResult.transportFailure(url, code, "HTTP " + code);
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                return FetchResult.empty(url, code, "HTTP " + code);
            }
            byte[] bytes = body.bytes();
            if (bytes.length == 0) {
                return FetchResult.empty(url, code, "empty body");
            }
            MediaType mediaType = body.contentType();
            String contentType = mediaType == null ? "" : mediaType.type() + "/" + mediaType.subtype();
            String charset = mediaType == null || mediaType.charset() == null ? null : mediaType.charset().name();
            return FetchResult.ok(response.request().url().toString(), code, contentType, bytes, charset);
        } catch (IOException e) {
            return FetchResult.transportFailure(url, 0, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
