package com.ragsync;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragsync.collect.Collector;
import com.ragsync.collect.CollectorFactory;
import com.ragsync.collect.CollectorResult;
import com.ragsync.collect.CollectorRunner;
import com.ragsync.collect.Sleeper;
import com.ragsync.embedding.EmbeddingException;
import com.ragsync.embedding.EmbeddingGateway;
import com.ragsync.embedding.EmbeddingGateways;
import com.ragsync.ingest.RawDocument;
import com.ragsync.runtime.AppConfig;
import com.ragsync.runtime.ConfigLoader;
import com.ragsync.runtime.ConfigurationException;
import com.ragsync.runtime.HttpClients;
import com.ragsync.store.DocumentStore;
import com.ragsync.store.DocumentStores;
import com.ragsync.store.StoreException;
import com.ragsync.sync.IngestionService;
import com.ragsync.sync.SyncReport;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "rag-sync",
        mixinStandardHelpOptions = true,
        version = "rag-sync 0.1.0",
        description = "Collects source documents and incrementally synchronizes their chunks and embeddings into the document store.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_STORE_FAILURE = 3;

    @Option(names = { "-c", "--config" }, description = "Path to the YAML sources config", defaultValue = "sources.yaml")
    Path configPath;

    @Option(names = "--db-url-env", description = "Environment variable holding the store connection string", defaultValue = "SUPABASE_DB_URL")
    String dbUrlEnv;

    @Option(names = "--dry-run", description = "Collect, normalize, diff and chunk without embedding or writing")
    boolean dryRun;

    @Option(names = "--no-diff", description = "Rewrite every accepted document regardless of stored hashes")
    boolean noDiff;

    @Option(names = "--init-schema", description = "Create the PostgreSQL extension, tables and indexes if missing")
    boolean initSchema;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        Map<String, String> environment = environment();
        String connectionString = environment.get(dbUrlEnv);
        if (connectionString == null || connectionString.isBlank()) {
            log.error("Missing {} environment variable; nothing was collected or written", dbUrlEnv);
            return EXIT_CONFIG_ERROR;
        }

        AppConfig config;
        try {
            config = new ConfigLoader().load(configPath);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        if (noDiff) {
            config.getDiff().setEnabled(false);
        }

        OkHttpClient httpClient = HttpClients.create(config.getHttp());
        try (DocumentStore store = openStore(connectionString);
                EmbeddingGateway gateway = createEmbeddingGateway(config, httpClient, environment)) {
            if (!dryRun) {
                gateway.load();
            }

            List<CollectorResult> results = new CollectorRunner(
                    config.getCollectors().getParallelism(),
                    Duration.ofMinutes(config.getCollectors().getTimeoutMinutes()))
                    .runAll(createCollectors(config, httpClient));
            List<RawDocument> documents = new ArrayList<>();
            results.forEach(result -> documents.addAll(result.documents()));

            SyncReport report = new IngestionService(config, gateway, store, clock(), dryRun)
                    .run(documents, completeSources(results));
            log.info("Sync completed fetched={} accepted={} rejected={} duplicates={} unchanged={} changed={} "
                            + "embeddingFailures={} documentsWritten={} chunksWritten={} chunksDeleted={} deactivated={} dryRun={}",
                    report.fetched(), report.accepted(), report.rejected(), report.duplicates(), report.unchanged(),
                    report.changed(), report.embeddingFailures(), report.documentsWritten(), report.chunksWritten(),
                    report.chunksDeleted(), report.deactivated(), dryRun);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (StoreException e) {
            log.error("Store failure; the current batch was rolled back", e);
            return EXIT_STORE_FAILURE;
        } catch (EmbeddingException e) {
            log.error("Embedding gateway unavailable: {}", e.getMessage());
            return EXIT_UNEXPECTED;
        } catch (RuntimeException e) {
            log.error("Sync failed", e);
            return EXIT_UNEXPECTED;
        } finally {
            HttpClients.shutdown(httpClient);
        }
    }

    static Set<String> completeSources(List<CollectorResult> results) {
        Map<String, Boolean> bySource = new HashMap<>();
        for (CollectorResult result : results) {
            bySource.merge(result.source(), result.complete(), Boolean::logicalAnd);
        }
        Set<String> complete = new LinkedHashSet<>();
        bySource.forEach((source, isComplete) -> {
            if (isComplete) {
                complete.add(source);
            }
        });
        return complete;
    }

    Map<String, String> environment() {
        return System.getenv();
    }

    Clock clock() {
        return Clock.systemUTC();
    }

    DocumentStore openStore(String connectionString) {
        return DocumentStores.open(connectionString, initSchema);
    }

    EmbeddingGateway createEmbeddingGateway(AppConfig config, OkHttpClient httpClient, Map<String, String> environment) {
        return EmbeddingGateways.create(config.getEmbedding(), httpClient, environment);
    }

    List<Collector> createCollectors(AppConfig config, OkHttpClient httpClient) {
        return CollectorFactory.create(config, httpClient, Sleeper.SYSTEM);
    }
}
