package com.openapi.resolution.cdi;

import com.openapi.resolution.api.ResolutionOptions;
import com.openapi.resolution.api.SchemaResolver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the schema resolver from MicroProfile Config properties.
 *
 * <p>All keys are optional:</p>
 * <pre>
 * schema-resolution:
 *   cache:
 *     enabled: true
 *     max-size: 500
 *   memory:
 *     enabled: false
 *     threshold-bytes: 1073741824
 *     streaming: false
 *     batch-size: 10
 *   metrics:
 *     enabled: false
 *   parallelism: 4
 *   max-depth: 100
 *   external:
 *     timeout-ms: 30000
 * </pre>
 */
@ApplicationScoped
public class SchemaResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(SchemaResolutionProducer.class);

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "schema-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "schema-resolution.cache.max-size", defaultValue = "500")
    int cacheMaxSize;

    // ── Memory ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "schema-resolution.memory.enabled", defaultValue = "false")
    boolean memoryEnabled;

    @Inject
    @ConfigProperty(name = "schema-resolution.memory.threshold-bytes", defaultValue = "1073741824")
    long memoryThresholdBytes;

    @Inject
    @ConfigProperty(name = "schema-resolution.memory.streaming", defaultValue = "false")
    boolean streaming;

    @Inject
    @ConfigProperty(name = "schema-resolution.memory.batch-size", defaultValue = "10")
    int batchSize;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "schema-resolution.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "schema-resolution.parallelism", defaultValue = "4")
    int parallelism;

    @Inject
    @ConfigProperty(name = "schema-resolution.max-depth", defaultValue = "100")
    int maxDepth;

    @Inject
    @ConfigProperty(name = "schema-resolution.external.timeout-ms", defaultValue = "30000")
    long externalTimeoutMs;

    @Produces
    @ApplicationScoped
    public ResolutionOptions resolutionOptions() {
        ResolutionOptions options = ResolutionOptions.builder()
                .cachingEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .memoryOptimizationEnabled(memoryEnabled)
                .memoryThresholdBytes(memoryThresholdBytes)
                .streamingModeEnabled(streaming)
                .batchSize(batchSize)
                .metricsEnabled(metricsEnabled)
                .parallelism(parallelism)
                .maxResolutionDepth(maxDepth)
                .externalReferenceTimeoutMs(externalTimeoutMs)
                .build();
        log.info("Producing ResolutionOptions: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public SchemaResolver schemaResolver(ResolutionOptions options) {
        return SchemaResolver.builder()
                .options(options)
                .build();
    }

    public void closeResolver(@Disposes SchemaResolver resolver) {
        log.info("Closing SchemaResolver");
        resolver.close();
    }
}
