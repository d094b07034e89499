package com.openapi.resolution.memory;

/**
 * Memory and streaming settings for catalog builds.
 *
 * @param enabled              whether heap pressure triggers cache cleanups
 * @param memoryThresholdBytes heap usage above which a cleanup runs
 * @param streamingMode        whether schemas are resolved in fixed-size batches
 * @param batchSize            schemas per batch in streaming mode
 * @param evictionWatermark    fraction of the cache bound kept after a cleanup
 */
public record MemoryConfig(boolean enabled, long memoryThresholdBytes, boolean streamingMode,
                           int batchSize, double evictionWatermark) {

    public static final long DEFAULT_THRESHOLD_BYTES = 1024L * 1024 * 1024;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final double DEFAULT_EVICTION_WATERMARK = 0.5;

    public MemoryConfig {
        if (memoryThresholdBytes <= 0) {
            throw new IllegalArgumentException("memoryThresholdBytes must be > 0");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (evictionWatermark < 0.0 || evictionWatermark > 1.0) {
            throw new IllegalArgumentException("evictionWatermark must be between 0.0 and 1.0");
        }
    }

    /**
     * Defaults: cleanup disabled, 1 GiB threshold, streaming off, batches of 10.
     */
    public static MemoryConfig defaults() {
        return new MemoryConfig(false, DEFAULT_THRESHOLD_BYTES, false, DEFAULT_BATCH_SIZE, DEFAULT_EVICTION_WATERMARK);
    }

    public static MemoryConfig streaming(int batchSize) {
        return new MemoryConfig(false, DEFAULT_THRESHOLD_BYTES, true, batchSize, DEFAULT_EVICTION_WATERMARK);
    }
}
