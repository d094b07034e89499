package com.openapi.resolution.api;

import com.openapi.resolution.cache.CacheConfig;
import com.openapi.resolution.memory.MemoryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionOptions Tests")
class ResolutionOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        ResolutionOptions options = ResolutionOptions.defaults();

        assertTrue(options.isCachingEnabled());
        assertEquals(500, options.getCacheMaxSize());
        assertFalse(options.isMemoryOptimizationEnabled());
        assertEquals(1024L * 1024 * 1024, options.getMemoryThresholdBytes());
        assertFalse(options.isStreamingModeEnabled());
        assertEquals(10, options.getBatchSize());
        assertFalse(options.isMetricsEnabled());
        assertEquals(100, options.getMaxResolutionDepth());
        assertEquals(30_000, options.getExternalReferenceTimeoutMs());
        assertTrue(options.isValidateDocument());
        assertTrue(options.getParallelism() >= 1 && options.getParallelism() <= 4);
    }

    @Test
    @DisplayName("lowMemory enables streaming and cleanup")
    void lowMemory() {
        ResolutionOptions options = ResolutionOptions.lowMemory();

        assertTrue(options.isStreamingModeEnabled());
        assertTrue(options.isMemoryOptimizationEnabled());
    }

    @Test
    @DisplayName("Converts to cache and memory configs")
    void conversions() {
        ResolutionOptions options = ResolutionOptions.builder()
                .cacheMaxSize(50)
                .streamingModeEnabled(true)
                .batchSize(7)
                .evictionWatermark(0.25)
                .build();

        assertEquals(new CacheConfig(true, 50), options.toCacheConfig());
        MemoryConfig memory = options.toMemoryConfig();
        assertTrue(memory.streamingMode());
        assertEquals(7, memory.batchSize());
        assertEquals(0.25, memory.evictionWatermark());
    }

    @Test
    @DisplayName("Rejects invalid values")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().cacheMaxSize(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().batchSize(-1));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().parallelism(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().maxResolutionDepth(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().memoryThresholdBytes(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().externalReferenceTimeoutMs(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().evictionWatermark(1.1));
    }
}
