package com.openapi.resolution.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.cache.CacheStats;
import com.openapi.resolution.cache.CachingSchemaNodeResolver;
import com.openapi.resolution.cache.CaffeineResolutionCache;
import com.openapi.resolution.cache.NoOpResolutionCache;
import com.openapi.resolution.cache.ResolutionCache;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.DocumentFormat;
import com.openapi.resolution.document.DocumentLoader;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.memory.JvmMemorySampler;
import com.openapi.resolution.memory.MemoryController;
import com.openapi.resolution.memory.MemorySampler;
import com.openapi.resolution.memory.MemoryStats;
import com.openapi.resolution.metrics.MetricsService;
import com.openapi.resolution.metrics.MicrometerMetricsService;
import com.openapi.resolution.metrics.NoOpMetricsService;
import com.openapi.resolution.reference.ExternalReferenceResolver;
import com.openapi.resolution.reference.ReferenceResolver;
import com.openapi.resolution.reference.TimeoutExternalReferenceResolver;
import com.openapi.resolution.reference.UnsupportedExternalReferenceResolver;
import com.openapi.resolution.tracing.NoOpTracingService;
import com.openapi.resolution.tracing.TracingService;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point: resolves single schemas and builds whole-document catalogs.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (SchemaResolver resolver = SchemaResolver.builder()
 *         .options(ResolutionOptions.lowMemory())
 *         .build()) {
 *     OpenApiDocument doc = resolver.loadDocument(Path.of("petstore.yaml"));
 *     SchemaCatalog catalog = resolver.buildCatalog(doc);
 *     ResolvedSchema pet = catalog.schema("Pet").orElseThrow();
 * }
 * </pre>
 *
 * <p>One resolver may serve several documents; cache entries are keyed per document. It is
 * safe to call from several threads.</p>
 */
public class SchemaResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    private final ResolutionOptions options;
    private final ResolutionCache cache;
    private final CachingSchemaNodeResolver resolver;
    private final MemoryController memoryController;
    private final CatalogBuilder catalogBuilder;
    private final DocumentLoader documentLoader;
    private final TimeoutExternalReferenceResolver timeoutResolver;

    private SchemaResolver(Builder builder) {
        this.options = builder.options;

        MetricsService metricsService;
        if (!options.isMetricsEnabled()) {
            metricsService = new NoOpMetricsService();
        } else if (builder.metricsService != null) {
            metricsService = builder.metricsService;
        } else {
            metricsService = new MicrometerMetricsService(Metrics.globalRegistry);
        }
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.isCachingEnabled()) {
            this.cache = new CaffeineResolutionCache(options.toCacheConfig(), metricsService);
        } else {
            this.cache = new NoOpResolutionCache();
        }

        ExternalReferenceResolver external;
        if (builder.externalResolver != null) {
            this.timeoutResolver = new TimeoutExternalReferenceResolver(builder.externalResolver,
                    Duration.ofMillis(options.getExternalReferenceTimeoutMs()));
            external = timeoutResolver;
        } else {
            this.timeoutResolver = null;
            external = UnsupportedExternalReferenceResolver.INSTANCE;
        }

        this.resolver = new CachingSchemaNodeResolver(new ReferenceResolver(external), cache);
        MemorySampler sampler = builder.memorySampler != null ? builder.memorySampler : new JvmMemorySampler();
        Runnable gcHint = builder.gcHint != null ? builder.gcHint : System::gc;
        this.memoryController = new MemoryController(options.toMemoryConfig(), sampler, gcHint, metricsService);
        this.catalogBuilder = new CatalogBuilder(resolver, memoryController, metricsService, tracingService, options);
        this.documentLoader = new DocumentLoader(options.isValidateDocument());

        log.info("SchemaResolver initialized: caching={} maxSize={} streaming={} parallelism={}",
                options.isCachingEnabled(), options.getCacheMaxSize(), options.isStreamingModeEnabled(),
                options.getParallelism());
    }

    public static SchemaResolver create() {
        return builder().build();
    }

    // ========== Documents ==========

    public OpenApiDocument loadDocument(Path path) {
        return documentLoader.load(path);
    }

    public OpenApiDocument parseDocument(byte[] bytes, DocumentFormat format) {
        return documentLoader.parse(bytes, format);
    }

    // ========== Resolution API ==========

    /**
     * Resolves a schema node, which may itself be a {@code $ref}, with a fresh context.
     */
    public ResolvedSchema resolveSchema(OpenApiDocument document, JsonNode schema) {
        Objects.requireNonNull(document, "document is required");
        Objects.requireNonNull(schema, "schema is required");
        return resolver.composer().resolveSchema(document, schema, newContext());
    }

    /**
     * Resolves the schema a pointer such as {@code #/components/schemas/User} names.
     */
    public ResolvedSchema resolveReference(OpenApiDocument document, String pointer) {
        Objects.requireNonNull(document, "document is required");
        Objects.requireNonNull(pointer, "pointer is required");
        return resolver.resolveReference(document, SchemaReference.of(pointer), newContext());
    }

    public SchemaCatalog buildCatalog(OpenApiDocument document) {
        return buildCatalog(document, CancellationToken.none());
    }

    /**
     * @throws com.openapi.resolution.exception.CatalogBuildException     if any schema failed
     * @throws com.openapi.resolution.exception.CatalogCancelledException if the token was cancelled
     */
    public SchemaCatalog buildCatalog(OpenApiDocument document, CancellationToken token) {
        return catalogBuilder.build(document, token);
    }

    // ========== Stats ==========

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public MemoryStats getMemoryStats() {
        return memoryController.getMemoryStats();
    }

    public void clearCache() {
        cache.clear();
        log.debug("cache.cleared");
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    private ResolutionContext newContext() {
        return new ResolutionContext(options.getMaxResolutionDepth());
    }

    @Override
    public void close() {
        if (timeoutResolver != null) {
            timeoutResolver.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolutionOptions options = ResolutionOptions.defaults();
        private ResolutionCache cache;
        private ExternalReferenceResolver externalResolver;
        private MetricsService metricsService;
        private TracingService tracingService;
        private MemorySampler memorySampler;
        private Runnable gcHint;

        public Builder options(ResolutionOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets a custom cache. Defaults to a Caffeine cache sized from the options, or a
         * no-op cache when caching is disabled.
         */
        public Builder cache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Sets the resolver for references outside the document. Calls are bounded by
         * {@link ResolutionOptions#getExternalReferenceTimeoutMs()}. Without one, external
         * references fail with {@code EXTERNAL_REFERENCE_NOT_SUPPORTED}.
         */
        public Builder externalResolver(ExternalReferenceResolver externalResolver) {
            this.externalResolver = externalResolver;
            return this;
        }

        /**
         * Sets the metrics backend used when metrics are enabled in the options.
         * Defaults to Micrometer's global registry.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder memorySampler(MemorySampler memorySampler) {
            this.memorySampler = memorySampler;
            return this;
        }

        public Builder gcHint(Runnable gcHint) {
            this.gcHint = gcHint;
            return this;
        }

        public SchemaResolver build() {
            return new SchemaResolver(this);
        }
    }
}
