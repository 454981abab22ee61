package com.ragsync.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragsync.ingest.DuplicatePolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void shouldLoadSourcesAndOverridesFromYaml() throws IOException {
        Path file = write("""
                normalization:
                  minContentChars: 20
                  duplicatePolicy: FIRST_WINS
                chunking:
                  maxChars: 500
                  overlapChars: 50
                diff:
                  enabled: false
                sync:
                  writeBatchSize: 10
                  deactivateMissing: true
                statutes:
                  enabled: true
                  keywords:
                    - 所得税法
                  includeSuffixes:
                    - 施行令
                crawls:
                  nta:
                    enabled: true
                    source: nta
                    seeds:
                      - https://www.nta.go.jp/law/tsutatsu/menu.htm
                    maxPages: 5
                    extra:
                      nta_kind: kihon
                  other:
                    enabled: false
                unknownSection:
                  ignored: true
                """);

        AppConfig config = loader.load(file);

        assertEquals(20, config.getNormalization().getMinContentChars());
        assertEquals(DuplicatePolicy.FIRST_WINS, config.getNormalization().getDuplicatePolicy());
        assertEquals(500, config.getChunking().getMaxChars());
        assertEquals(50, config.getChunking().getOverlapChars());
        assertFalse(config.getDiff().isEnabled());
        assertTrue(config.getSync().isDeactivateMissing());
        assertEquals(10, config.getSync().getWriteBatchSize());
        assertTrue(config.getStatutes().isEnabled());
        assertEquals(List.of("所得税法"), config.getStatutes().getKeywords());
        assertEquals(List.of("nta", "other"), List.copyOf(config.getCrawls().keySet()));
        AppConfig.CrawlSourceConfig nta = config.getCrawls().get("nta");
        assertEquals(5, nta.getMaxPages());
        assertEquals("kihon", nta.getExtra().get("nta_kind"));
        assertFalse(config.getCrawls().get("other").isEnabled());
    }

    @Test
    void shouldLoadBundledSampleWithEveryNtaCollection() {
        AppConfig config = loader.load(Path.of("sources.yaml"));

        assertEquals(List.of("nta", "nta_sochiho", "nta_shitsugi"), List.copyOf(config.getCrawls().keySet()));
        assertEquals("kihon", config.getCrawls().get("nta").getExtra().get("nta_kind"));
        assertEquals("sochiho", config.getCrawls().get("nta_sochiho").getExtra().get("nta_kind"));
        assertEquals("shitsugi", config.getCrawls().get("nta_shitsugi").getExtra().get("nta_kind"));
        config.getCrawls().values().forEach(crawl -> assertEquals("nta", crawl.getSource()));
    }

    @Test
    void shouldFallBackToDefaultsWhenFileIsMissing() {
        AppConfig config = loader.load(tempDir.resolve("absent.yaml"));

        assertEquals(1200, config.getChunking().getMaxChars());
        assertTrue(config.getDiff().isEnabled());
    }

    @Test
    void shouldRejectOverlapNotSmallerThanMaxChars() throws IOException {
        Path file = write("""
                chunking:
                  maxChars: 100
                  overlapChars: 100
                """);

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertTrue(error.getMessage().contains("overlapChars"));
    }

    @Test
    void shouldRejectNonPositiveWriteBatchSize() throws IOException {
        Path file = write("""
                sync:
                  writeBatchSize: 0
                """);

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void shouldWrapMalformedYaml() throws IOException {
        Path file = write("""
                chunking:
                  maxChars: [not, a, number
                """);

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("sources.yaml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }
}
