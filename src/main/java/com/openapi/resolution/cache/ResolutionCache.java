package com.openapi.resolution.cache;

import com.openapi.resolution.core.model.ResolvedSchema;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache of resolved schemas keyed by canonical reference ({@code ref:...}) or by
 * structural signature of an inline node ({@code shape:...}).
 *
 * <p>Implementations are safe for concurrent use.</p>
 */
public interface ResolutionCache {

    /**
     * Returns the cached schema for {@code key}, computing and storing it on a miss.
     *
     * <p>At most one computation runs per key. A concurrent caller for a key that is being
     * computed on another thread waits for that result. A re-entrant call from the thread
     * already computing the key computes without caching. Failures are not cached; callers
     * waiting on a failed computation receive the same exception.</p>
     */
    ResolvedSchema getOrCompute(String key, Supplier<ResolvedSchema> compute);

    Optional<ResolvedSchema> getIfPresent(String key);

    void invalidate(String key);

    void clear();

    /**
     * Evicts entries until at most {@code targetSize} remain.
     *
     * @return the number of entries removed
     */
    long evictTo(long targetSize);

    /**
     * Configured bound, or 0 for a cache that stores nothing.
     */
    long maxSize();

    CacheStats getStats();
}
