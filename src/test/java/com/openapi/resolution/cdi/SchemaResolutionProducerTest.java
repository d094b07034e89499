package com.openapi.resolution.cdi;

import com.openapi.resolution.api.ResolutionOptions;
import com.openapi.resolution.api.SchemaResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaResolutionProducer Tests")
class SchemaResolutionProducerTest {

    private SchemaResolutionProducer producer;

    @BeforeEach
    void setUp() {
        producer = new SchemaResolutionProducer();
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 200;
        producer.memoryEnabled = true;
        producer.memoryThresholdBytes = 512L * 1024 * 1024;
        producer.streaming = true;
        producer.batchSize = 25;
        producer.metricsEnabled = false;
        producer.parallelism = 2;
        producer.maxDepth = 50;
        producer.externalTimeoutMs = 5_000;
    }

    @Test
    @DisplayName("Options reflect the configured properties")
    void producesOptions() {
        ResolutionOptions options = producer.resolutionOptions();

        assertTrue(options.isCachingEnabled());
        assertEquals(200, options.getCacheMaxSize());
        assertTrue(options.isMemoryOptimizationEnabled());
        assertEquals(512L * 1024 * 1024, options.getMemoryThresholdBytes());
        assertTrue(options.isStreamingModeEnabled());
        assertEquals(25, options.getBatchSize());
        assertEquals(2, options.getParallelism());
        assertEquals(50, options.getMaxResolutionDepth());
        assertEquals(5_000, options.getExternalReferenceTimeoutMs());
    }

    @Test
    @DisplayName("Produces a resolver using the options and disposes it")
    void producesResolver() {
        ResolutionOptions options = producer.resolutionOptions();

        SchemaResolver resolver = producer.schemaResolver(options);

        assertSame(options, resolver.getOptions());
        assertEquals(200, resolver.getCacheStats().maxSize());
        assertDoesNotThrow(() -> producer.closeResolver(resolver));
    }

    @Test
    @DisplayName("Invalid properties are rejected")
    void rejectsInvalid() {
        producer.batchSize = 0;

        assertThrows(IllegalArgumentException.class, () -> producer.resolutionOptions());
    }
}
