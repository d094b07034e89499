package com.openapi.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.metrics.MetricsService;
import com.openapi.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Caffeine-backed resolution cache.
 *
 * <p>Completed entries live in a size-bounded Caffeine cache. Computations in progress are
 * tracked separately so that a second thread asking for the same key waits for the first
 * one instead of computing again, while a recursive request from the computing thread itself
 * falls through to an uncached computation rather than blocking on its own future.</p>
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<String, CacheEntry> cache;
    private final ConcurrentMap<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final MetricsService metrics;
    private final int maxSize;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final Object resizeLock = new Object();

    public CaffeineResolutionCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public CaffeineResolutionCache(CacheConfig config, MetricsService metrics) {
        this.maxSize = config.maxSize();
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .executor(Runnable::run)
                .recordStats()
                .removalListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        this.metrics.recordCacheEviction();
                    }
                })
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public ResolvedSchema getOrCompute(String key, Supplier<ResolvedSchema> compute) {
        CacheEntry cached = cache.getIfPresent(key);
        if (cached != null) {
            recordHit();
            return cached.value();
        }

        InFlight mine = new InFlight(Thread.currentThread());
        InFlight existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            if (existing.owner() == Thread.currentThread()) {
                log.trace("cache.reentrant key={}", key);
                return compute.get();
            }
            recordHit();
            return await(existing, key);
        }

        try {
            cached = cache.getIfPresent(key);
            if (cached != null) {
                recordHit();
                mine.result().complete(cached.value());
                return cached.value();
            }
            recordMiss();
            ResolvedSchema value = compute.get();
            cache.put(key, CacheEntry.of(key, value));
            mine.result().complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.result().completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    @Override
    public Optional<ResolvedSchema> getIfPresent(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        return entry != null ? Optional.of(entry.value()) : Optional.empty();
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        log.debug("cache.cleared");
    }

    @Override
    public long evictTo(long targetSize) {
        if (targetSize < 0) {
            throw new IllegalArgumentException("targetSize must be >= 0");
        }
        long before = cache.estimatedSize();
        if (before <= targetSize) {
            return 0;
        }
        synchronized (resizeLock) {
            Optional<Policy.Eviction<String, CacheEntry>> eviction = cache.policy().eviction();
            if (eviction.isPresent()) {
                eviction.get().setMaximum(targetSize);
                cache.cleanUp();
                eviction.get().setMaximum(maxSize);
            }
        }
        long removed = Math.max(0, before - cache.estimatedSize());
        log.debug("cache.evicted removed={} targetSize={}", removed, targetSize);
        return removed;
    }

    @Override
    public long maxSize() {
        return maxSize;
    }

    @Override
    public CacheStats getStats() {
        long totalSizeHint = 0;
        for (CacheEntry entry : cache.asMap().values()) {
            totalSizeHint += entry.sizeHint();
        }
        return new CacheStats(
                hits.sum(),
                misses.sum(),
                cache.stats().evictionCount(),
                cache.estimatedSize(),
                maxSize,
                totalSizeHint
        );
    }

    private ResolvedSchema await(InFlight pending, String key) {
        try {
            return pending.result().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Computation failed for " + key, cause);
        }
    }

    private void recordHit() {
        hits.increment();
        metrics.recordCacheHit();
    }

    private void recordMiss() {
        misses.increment();
        metrics.recordCacheMiss();
    }

    /**
     * A computation in progress and the thread running it.
     */
    private record InFlight(Thread owner, CompletableFuture<ResolvedSchema> result) {
        InFlight(Thread owner) {
            this(owner, new CompletableFuture<>());
        }
    }
}
