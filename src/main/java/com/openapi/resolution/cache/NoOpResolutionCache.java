package com.openapi.resolution.cache;

import com.openapi.resolution.core.model.ResolvedSchema;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public ResolvedSchema getOrCompute(String key, Supplier<ResolvedSchema> compute) {
        return compute.get();
    }

    @Override
    public Optional<ResolvedSchema> getIfPresent(String key) {
        return Optional.empty();
    }

    @Override
    public void invalidate(String key) {
        // no-op
    }

    @Override
    public void clear() {
        // no-op
    }

    @Override
    public long evictTo(long targetSize) {
        return 0;
    }

    @Override
    public long maxSize() {
        return 0;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
