package com.ragsync.collect;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.ragsync.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class CollectorFactory {
    private CollectorFactory() {
    }

    public static List<Collector> create(AppConfig config, OkHttpClient httpClient, Sleeper sleeper) {
        AppConfig.HttpConfig http = config.getHttp();
        PageFetcher fetcher = new PageFetcher(
                httpClient,
                http.getUserAgent(),
                http.getMaxRetries(),
                Duration.ofMillis(http.getRetryBackoffMs()),
                sleeper);

        List<Collector> collectors = new ArrayList<>();
        if (config.getStatutes().isEnabled()) {
            collectors.add(new StatuteApiCollector(config.getStatutes(), fetcher, sleeper));
        }
        for (Map.Entry<String, AppConfig.CrawlSourceConfig> crawl : config.getCrawls().entrySet()) {
            if (crawl.getValue().isEnabled()) {
                collectors.add(new WebCrawlerCollector(crawl.getKey(), crawl.getValue(), fetcher, sleeper));
            }
        }
        return collectors;
    }
}
