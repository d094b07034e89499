package com.openapi.resolution.api;

import com.openapi.resolution.cache.CacheConfig;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.memory.MemoryConfig;

/**
 * Options for schema resolution and catalog builds.
 * Configures caching, memory management, parallelism and limits.
 */
public class ResolutionOptions {

    private static final long DEFAULT_EXTERNAL_TIMEOUT_MS = 30_000;

    private final boolean cachingEnabled;
    private final int cacheMaxSize;
    private final boolean memoryOptimizationEnabled;
    private final long memoryThresholdBytes;
    private final boolean streamingModeEnabled;
    private final int batchSize;
    private final double evictionWatermark;
    private final boolean metricsEnabled;
    private final int parallelism;
    private final int maxResolutionDepth;
    private final long externalReferenceTimeoutMs;
    private final boolean validateDocument;

    private ResolutionOptions(Builder builder) {
        this.cachingEnabled = builder.cachingEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.memoryOptimizationEnabled = builder.memoryOptimizationEnabled;
        this.memoryThresholdBytes = builder.memoryThresholdBytes;
        this.streamingModeEnabled = builder.streamingModeEnabled;
        this.batchSize = builder.batchSize;
        this.evictionWatermark = builder.evictionWatermark;
        this.metricsEnabled = builder.metricsEnabled;
        this.parallelism = builder.parallelism;
        this.maxResolutionDepth = builder.maxResolutionDepth;
        this.externalReferenceTimeoutMs = builder.externalReferenceTimeoutMs;
        this.validateDocument = builder.validateDocument;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public boolean isMemoryOptimizationEnabled() {
        return memoryOptimizationEnabled;
    }

    public long getMemoryThresholdBytes() {
        return memoryThresholdBytes;
    }

    public boolean isStreamingModeEnabled() {
        return streamingModeEnabled;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public double getEvictionWatermark() {
        return evictionWatermark;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getMaxResolutionDepth() {
        return maxResolutionDepth;
    }

    public long getExternalReferenceTimeoutMs() {
        return externalReferenceTimeoutMs;
    }

    public boolean isValidateDocument() {
        return validateDocument;
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(cachingEnabled, cacheMaxSize);
    }

    public MemoryConfig toMemoryConfig() {
        return new MemoryConfig(memoryOptimizationEnabled, memoryThresholdBytes, streamingModeEnabled,
                batchSize, evictionWatermark);
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Streaming with memory cleanup enabled, for very large documents.
     */
    public static ResolutionOptions lowMemory() {
        return builder()
                .memoryOptimizationEnabled(true)
                .streamingModeEnabled(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static int defaultParallelism() {
        return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }

    @Override
    public String toString() {
        return "ResolutionOptions{caching=" + cachingEnabled + "/" + cacheMaxSize
                + ", memory=" + memoryOptimizationEnabled + "/" + memoryThresholdBytes
                + ", streaming=" + streamingModeEnabled + "/" + batchSize
                + ", metrics=" + metricsEnabled
                + ", parallelism=" + parallelism
                + ", maxDepth=" + maxResolutionDepth + "}";
    }

    public static class Builder {
        private boolean cachingEnabled = true;
        private int cacheMaxSize = CacheConfig.DEFAULT_MAX_SIZE;
        private boolean memoryOptimizationEnabled = false;
        private long memoryThresholdBytes = MemoryConfig.DEFAULT_THRESHOLD_BYTES;
        private boolean streamingModeEnabled = false;
        private int batchSize = MemoryConfig.DEFAULT_BATCH_SIZE;
        private double evictionWatermark = MemoryConfig.DEFAULT_EVICTION_WATERMARK;
        private boolean metricsEnabled = false;
        private int parallelism = defaultParallelism();
        private int maxResolutionDepth = ResolutionContext.DEFAULT_MAX_DEPTH;
        private long externalReferenceTimeoutMs = DEFAULT_EXTERNAL_TIMEOUT_MS;
        private boolean validateDocument = true;

        public Builder cachingEnabled(boolean cachingEnabled) {
            this.cachingEnabled = cachingEnabled;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            requirePositive(cacheMaxSize, "cacheMaxSize");
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder memoryOptimizationEnabled(boolean memoryOptimizationEnabled) {
            this.memoryOptimizationEnabled = memoryOptimizationEnabled;
            return this;
        }

        public Builder memoryThresholdBytes(long memoryThresholdBytes) {
            requirePositive(memoryThresholdBytes, "memoryThresholdBytes");
            this.memoryThresholdBytes = memoryThresholdBytes;
            return this;
        }

        public Builder streamingModeEnabled(boolean streamingModeEnabled) {
            this.streamingModeEnabled = streamingModeEnabled;
            return this;
        }

        public Builder batchSize(int batchSize) {
            requirePositive(batchSize, "batchSize");
            this.batchSize = batchSize;
            return this;
        }

        public Builder evictionWatermark(double evictionWatermark) {
            if (evictionWatermark < 0.0 || evictionWatermark > 1.0) {
                throw new IllegalArgumentException("evictionWatermark must be between 0.0 and 1.0");
            }
            this.evictionWatermark = evictionWatermark;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        /**
         * Worker threads for catalog builds; 1 resolves everything on the calling thread.
         */
        public Builder parallelism(int parallelism) {
            requirePositive(parallelism, "parallelism");
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxResolutionDepth(int maxResolutionDepth) {
            requirePositive(maxResolutionDepth, "maxResolutionDepth");
            this.maxResolutionDepth = maxResolutionDepth;
            return this;
        }

        public Builder externalReferenceTimeoutMs(long externalReferenceTimeoutMs) {
            requirePositive(externalReferenceTimeoutMs, "externalReferenceTimeoutMs");
            this.externalReferenceTimeoutMs = externalReferenceTimeoutMs;
            return this;
        }

        public Builder validateDocument(boolean validateDocument) {
            this.validateDocument = validateDocument;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }

        private static void requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
