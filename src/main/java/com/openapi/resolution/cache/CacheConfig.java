package com.openapi.resolution.cache;

/**
 * Configuration for the resolution cache.
 *
 * @param enabled whether resolved schemas are cached
 * @param maxSize maximum number of cached schemas
 */
public record CacheConfig(boolean enabled, int maxSize) {

    public static final int DEFAULT_MAX_SIZE = 500;

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: enabled, 500 entries.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(true, DEFAULT_MAX_SIZE);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(false, DEFAULT_MAX_SIZE);
    }
}
