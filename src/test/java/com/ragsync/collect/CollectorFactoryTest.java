package com.ragsync.collect;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.ragsync.runtime.AppConfig;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectorFactoryTest {

    private final OkHttpClient client = new OkHttpClient();

    @Test
    void shouldCreateEnabledCollectorsInConfigOrder() {
        AppConfig config = new AppConfig();
        config.getStatutes().setEnabled(true);
        config.getCrawls().put("nta", crawl(true, "nta", "https://www.nta.go.jp/law/tsutatsu/menu.htm"));
        config.getCrawls().put("archive", crawl(false, "archive", "https://archive.example/"));
        config.getCrawls().put("qa", crawl(true, null, "https://www.nta.go.jp/law/shitsugi/"));

        List<Collector> collectors = CollectorFactory.create(config, client, duration -> { });

        assertEquals(List.of("statutes", "nta", "qa"), collectors.stream().map(Collector::name).toList());
        assertEquals(List.of("egov", "nta", "qa"), collectors.stream().map(Collector::source).toList());
    }

    @Test
    void shouldCreateNothingWhenEverySourceIsDisabled() {
        AppConfig config = new AppConfig();
        config.getCrawls().put("nta", crawl(false, "nta", "https://www.nta.go.jp/"));

        assertTrue(CollectorFactory.create(config, client, duration -> { }).isEmpty());
    }

    private static AppConfig.CrawlSourceConfig crawl(boolean enabled, String source, String seed) {
        AppConfig.CrawlSourceConfig crawl = new AppConfig.CrawlSourceConfig();
        crawl.setEnabled(enabled);
        crawl.setSource(source);
        crawl.setSeeds(List.of(seed));
        return crawl;
    }
}
