package com.openapi.resolution.memory;

import com.openapi.resolution.cache.ResolutionCache;
import com.openapi.resolution.metrics.MetricsService;
import com.openapi.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Splits catalog work into batches and reacts to heap pressure between them.
 *
 * <p>After each batch the heap is sampled. When cleanup is enabled and usage is above the
 * threshold, the cache is evicted down to the configured watermark and a GC hint is issued.
 * Memory pressure never fails a build; if usage stays high a warning is logged.</p>
 */
public class MemoryController {
    private static final Logger log = LoggerFactory.getLogger(MemoryController.class);
    private static final long BYTES_PER_MB = 1024L * 1024;

    private final MemoryConfig config;
    private final MemorySampler sampler;
    private final Runnable gcHint;
    private final MetricsService metrics;
    private final AtomicLong lastSample = new AtomicLong();
    private final AtomicLong peak = new AtomicLong();
    private final AtomicLong cleanups = new AtomicLong();

    public MemoryController(MemoryConfig config) {
        this(config, new JvmMemorySampler(), System::gc, new NoOpMetricsService());
    }

    public MemoryController(MemoryConfig config, MemorySampler sampler, Runnable gcHint, MetricsService metrics) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.sampler = Objects.requireNonNull(sampler, "sampler is required");
        this.gcHint = Objects.requireNonNull(gcHint, "gcHint is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public MemoryConfig config() {
        return config;
    }

    /**
     * Splits {@code items} into batches: a single batch when streaming is off, otherwise
     * consecutive batches of {@code batchSize}. Order is preserved.
     */
    public <T> List<List<T>> partition(List<T> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        if (!config.streamingMode()) {
            return List.of(List.copyOf(items));
        }
        List<List<T>> batches = new ArrayList<>((items.size() + config.batchSize() - 1) / config.batchSize());
        for (int start = 0; start < items.size(); start += config.batchSize()) {
            batches.add(List.copyOf(items.subList(start, Math.min(items.size(), start + config.batchSize()))));
        }
        return batches;
    }

    /**
     * Samples the heap after a batch and cleans up the cache when above the threshold.
     *
     * @return {@code true} if a cleanup ran
     */
    public boolean afterBatch(ResolutionCache cache) {
        long used = sample();
        if (!config.enabled() || used <= config.memoryThresholdBytes()) {
            return false;
        }
        long target = (long) Math.floor(cache.maxSize() * config.evictionWatermark());
        long evicted = cache.evictTo(target);
        gcHint.run();
        cleanups.incrementAndGet();
        metrics.recordMemoryCleanup();
        long after = sample();
        log.info("memory.cleanup usedMB={} afterMB={} thresholdMB={} evicted={}",
                used / BYTES_PER_MB, after / BYTES_PER_MB, config.memoryThresholdBytes() / BYTES_PER_MB, evicted);
        if (after > config.memoryThresholdBytes()) {
            log.warn("memory.pressure usedMB={} thresholdMB={} - continuing with reduced cache",
                    after / BYTES_PER_MB, config.memoryThresholdBytes() / BYTES_PER_MB);
        }
        return true;
    }

    public MemoryStats getMemoryStats() {
        return new MemoryStats(lastSample.get(), peak.get() / BYTES_PER_MB, cleanups.get());
    }

    private long sample() {
        long used = sampler.usedHeapBytes();
        lastSample.set(used);
        peak.accumulateAndGet(used, Math::max);
        return used;
    }
}
