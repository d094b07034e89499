package com.openapi.resolution.api;

import com.openapi.resolution.TestDocuments;
import com.openapi.resolution.cache.CacheConfig;
import com.openapi.resolution.cache.CachingSchemaNodeResolver;
import com.openapi.resolution.cache.CaffeineResolutionCache;
import com.openapi.resolution.exception.CatalogBuildException;
import com.openapi.resolution.memory.MemoryConfig;
import com.openapi.resolution.memory.MemoryController;
import com.openapi.resolution.metrics.MetricsService;
import com.openapi.resolution.reference.ReferenceResolver;
import com.openapi.resolution.tracing.Span;
import com.openapi.resolution.tracing.TracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogBuilderTest {

    @Mock
    private MetricsService metrics;

    @Mock
    private TracingService tracing;

    @Mock
    private Span span;

    private CatalogBuilder builder;

    @BeforeEach
    void setUp() {
        when(tracing.startSpan(anyString(), anyMap())).thenReturn(span);
        CachingSchemaNodeResolver resolver = new CachingSchemaNodeResolver(new ReferenceResolver(),
                new CaffeineResolutionCache(CacheConfig.defaults()));
        MemoryController memory = new MemoryController(MemoryConfig.defaults(), () -> 0L, () -> { }, metrics);
        builder = new CatalogBuilder(resolver, memory, metrics, tracing,
                ResolutionOptions.builder().parallelism(2).build());
    }

    @Test
    @DisplayName("Should trace the catalog and its batch and record every resolution")
    void tracesAndRecords() {
        SchemaCatalog catalog = builder.build(TestDocuments.load("petstore.yaml"), null);

        assertEquals(5, catalog.schemas().size());
        verify(tracing).startSpan(eq("schema.catalog"), anyMap());
        verify(tracing).startSpan(eq("schema.batch"), anyMap());
        verify(span, times(2)).close();
        verify(span, never()).fail(any());
        verify(metrics).recordBatchSize(14);
        verify(metrics, times(14)).recordResolutionDuration(eq("success"), any(Duration.class));
        verify(metrics, never()).recordCatalogErrors(anyInt());
    }

    @Test
    @DisplayName("Should mark the catalog span failed and count errors")
    void failedBuild() {
        CatalogBuildException e = assertThrows(CatalogBuildException.class, () -> builder.build(
                TestDocuments.withSchemas("""
                        Broken:
                          type: wibble
                        Fine:
                          type: string
                        """), CancellationToken.none()));

        assertEquals(1, e.getErrors().size());
        assertTrue(e.getPartialCatalog().schema("Fine").isPresent());
        verify(span).fail(e);
        verify(metrics).recordCatalogErrors(1);
        verify(metrics).recordResolutionDuration(eq("UNSUPPORTED_SCHEMA_TYPE"), any(Duration.class));
    }
}
