package com.ragsync.collect;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CollectorRunner {
    private static final Logger log = LoggerFactory.getLogger(CollectorRunner.class);

    private final int parallelism;
    private final Duration timeout;

    public CollectorRunner(int parallelism, Duration timeout) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.parallelism = parallelism;
        this.timeout = timeout;
    }

    public List<CollectorResult> runAll(List<Collector> collectors) {
        if (collectors.isEmpty()) {
            return List.of();
        }
        List<Callable<CollectorResult>> tasks = new ArrayList<>();
        for (Collector collector : collectors) {
            tasks.add(collector::collect);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, collectors.size()));
        List<CollectorResult> results = new ArrayList<>(collectors.size());
        try {
            List<Future<CollectorResult>> futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(collectors.get(i), futures.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Collector run interrupted; {} of {} collectors finished", results.size(), collectors.size());
            for (int i = results.size(); i < collectors.size(); i++) {
                results.add(CollectorResult.failed(collectors.get(i).name(), collectors.get(i).source()));
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private CollectorResult await(Collector collector, Future<CollectorResult> future) throws InterruptedException {
        try {
            CollectorResult result = future.get();
            log.info("Collector {} source={} documents={} complete={} failures={}",
                    collector.name(), result.source(), result.documents().size(), result.complete(), result.failures());
            return result;
        } catch (CancellationException e) {
            log.error("Collector {} timed out after {} minutes", collector.name(), timeout.toMinutes());
        } catch (ExecutionException e) {
            log.error("Collector {} failed", collector.name(), e.getCause());
        }
        return CollectorResult.failed(collector.name(), collector.source());
    }
}
