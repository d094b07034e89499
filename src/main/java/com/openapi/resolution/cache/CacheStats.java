package com.openapi.resolution.cache;

/**
 * Snapshot of cache counters.
 *
 * @param hits          lookups served from the cache, including waits on an in-flight computation
 * @param misses        lookups that computed a value
 * @param evictions     entries removed because of the size bound or a memory cleanup
 * @param size          current number of entries
 * @param maxSize       configured bound, 0 when caching is off
 * @param totalSizeHint summed {@code sizeHint()} of the cached schemas
 */
public record CacheStats(long hits, long misses, long evictions, long size, long maxSize, long totalSizeHint) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0);
    }
}
