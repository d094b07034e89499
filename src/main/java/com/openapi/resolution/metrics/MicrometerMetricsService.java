package com.openapi.resolution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code schema.resolution.duration} (Timer, tag: outcome)</li>
 *   <li>{@code schema.cache.hit}, {@code schema.cache.miss}, {@code schema.cache.eviction} (Counters)</li>
 *   <li>{@code schema.batch.size} (DistributionSummary)</li>
 *   <li>{@code schema.memory.cleanup} (Counter)</li>
 *   <li>{@code schema.catalog.errors} (Counter)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timersByOutcome = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheEvictionCounter;
    private final DistributionSummary batchSizeSummary;
    private final Counter memoryCleanupCounter;
    private final Counter catalogErrorCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("schema.cache.hit")
                .description("Resolutions served from the schema cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("schema.cache.miss")
                .description("Resolutions computed because the schema cache had no entry")
                .register(registry);
        this.cacheEvictionCounter = Counter.builder("schema.cache.eviction")
                .description("Schema cache entries evicted")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("schema.batch.size")
                .description("Schemas per catalog batch")
                .register(registry);
        this.memoryCleanupCounter = Counter.builder("schema.memory.cleanup")
                .description("Cache cleanups triggered by heap pressure")
                .register(registry);
        this.catalogErrorCounter = Counter.builder("schema.catalog.errors")
                .description("Schemas that failed to resolve during catalog builds")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(String outcome, Duration duration) {
        Timer timer = timersByOutcome.computeIfAbsent(outcome, o ->
                Timer.builder("schema.resolution.duration")
                        .description("Duration of single schema resolutions")
                        .tag("outcome", o)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheEviction() {
        cacheEvictionCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordMemoryCleanup() {
        memoryCleanupCounter.increment();
    }

    @Override
    public void recordCatalogErrors(int count) {
        catalogErrorCounter.increment(count);
    }
}
