package com.openapi.resolution.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.cache.CachingSchemaNodeResolver;
import com.openapi.resolution.compose.CompositionDependencyGraph;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.CatalogBuildException;
import com.openapi.resolution.exception.CatalogCancelledException;
import com.openapi.resolution.exception.SchemaResolutionException;
import com.openapi.resolution.logging.LogContext;
import com.openapi.resolution.memory.MemoryController;
import com.openapi.resolution.metrics.MetricsService;
import com.openapi.resolution.tracing.Span;
import com.openapi.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Resolves every schema of a document into a {@link SchemaCatalog}.
 *
 * <p>Work is split into batches by the {@link MemoryController}. Within a batch, schemas whose
 * expansion reaches a cycle (see {@link CompositionDependencyGraph}) run on the calling
 * thread and the rest on a fixed pool of {@code parallelism} workers. Between batches the
 * cancellation token is checked and the memory controller may shrink the cache.</p>
 *
 * <p>Failures do not stop the build: every error is collected and reported together in a
 * {@link CatalogBuildException} once all batches ran.</p>
 */
public class CatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(CatalogBuilder.class);

    private final CachingSchemaNodeResolver resolver;
    private final MemoryController memory;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ResolutionOptions options;

    public CatalogBuilder(CachingSchemaNodeResolver resolver, MemoryController memory, MetricsService metrics,
                          TracingService tracing, ResolutionOptions options) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.memory = Objects.requireNonNull(memory, "memory is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracing = Objects.requireNonNull(tracing, "tracing is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * @throws CatalogBuildException     if any schema failed; carries the partial catalog
     * @throws CatalogCancelledException if {@code token} was cancelled; carries the partial catalog
     */
    public SchemaCatalog build(OpenApiDocument document, CancellationToken token) {
        Objects.requireNonNull(document, "document is required");
        CancellationToken cancellation = token != null ? token : CancellationToken.none();
        Run run = new Run(document, LogContext.generateRunId());

        try (LogContext ignored = LogContext.forCatalog(run.runId);
             Span span = tracing.startSpan("schema.catalog", Map.of("runId", run.runId))) {
            log.info("catalog.started schemas={} pathSchemas={} parallelism={} streaming={}",
                    run.namedCount, run.items.size() - run.namedCount,
                    options.getParallelism(), options.isStreamingModeEnabled());
            try {
                SchemaCatalog catalog = execute(run, cancellation);
                span.setAttribute("schemas", catalog.schemas().size());
                return catalog;
            } catch (SchemaResolutionException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private SchemaCatalog execute(Run run, CancellationToken cancellation) {
        List<List<WorkItem>> batches = memory.partition(run.items);
        ExecutorService pool = options.getParallelism() > 1
                ? Executors.newFixedThreadPool(options.getParallelism(), workerFactory(run.runId))
                : null;
        try {
            for (int b = 0; b < batches.size(); b++) {
                if (cancellation.isCancelled()) {
                    log.warn("catalog.cancelled completedBatches={} totalBatches={}", b, batches.size());
                    throw new CatalogCancelledException(b, batches.size(), assemble(run, b));
                }
                runBatch(run, b, batches.get(b), pool);
                memory.afterBatch(resolver.cache());
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        SchemaCatalog catalog = assemble(run, batches.size());
        List<SchemaResolutionException> errors = run.sortedErrors();
        if (!errors.isEmpty()) {
            metrics.recordCatalogErrors(errors.size());
            log.warn("catalog.failed errors={} resolved={}", errors.size(), catalog.size());
            throw new CatalogBuildException(errors, catalog);
        }
        log.info("catalog.built schemas={} pathSchemas={} batches={} peakInFlight={} durationMs={}",
                catalog.schemas().size(), catalog.pathSchemas().size(), batches.size(),
                run.peakInFlight.get(), catalog.stats().duration().toMillis());
        return catalog;
    }

    private void runBatch(Run run, int batchIndex, List<WorkItem> batch, ExecutorService pool) {
        String batchId = run.runId + "-" + batchIndex;
        try (LogContext ignored = LogContext.forBatch(batchId);
             Span span = tracing.startSpan("schema.batch", Map.of("batchId", batchId))) {
            span.setAttribute("batch.size", batch.size());
            metrics.recordBatchSize(batch.size());

            List<CompletableFuture<Void>> futures = new ArrayList<>();
            List<WorkItem> onCallingThread = new ArrayList<>();
            for (WorkItem item : batch) {
                if (pool == null || item.sequential) {
                    onCallingThread.add(item);
                } else {
                    futures.add(CompletableFuture.runAsync(() -> resolve(run, item), pool));
                }
            }
            for (WorkItem item : onCallingThread) {
                resolve(run, item);
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException e) {
                span.fail(e.getCause());
                if (e.getCause() instanceof RuntimeException re) {
                    throw re;
                }
                throw e;
            }
            log.debug("batch.completed batchId={} size={} sequential={}", batchId, batch.size(),
                    pool == null ? batch.size() : onCallingThread.size());
        }
    }

    private void resolve(Run run, WorkItem item) {
        int current = run.inFlight.incrementAndGet();
        run.peakInFlight.accumulateAndGet(current, Math::max);
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forSchema(run.runId, item.key)) {
            ResolvedSchema schema;
            if (item.named) {
                ResolutionContext ctx = new ResolutionContext(options.getMaxResolutionDepth());
                schema = resolver.resolveReference(run.document, SchemaReference.toComponent(item.key), ctx);
            } else {
                ResolutionContext ctx = ResolutionContext.at(item.pointerPath, options.getMaxResolutionDepth());
                schema = resolver.composer().resolveBoundary(run.document, item.node, ctx);
            }
            run.results.set(item.index, schema);
            metrics.recordResolutionDuration("success", Duration.ofNanos(System.nanoTime() - start));
            log.trace("schema.resolved kind={}", schema.kind());
        } catch (SchemaResolutionException e) {
            run.errors.add(new IndexedError(item.index, e));
            metrics.recordResolutionDuration(e.getErrorCode().name(), Duration.ofNanos(System.nanoTime() - start));
            log.debug("schema.failed code={} path={}", e.getErrorCode(), e.getSchemaPath());
        } finally {
            run.inFlight.decrementAndGet();
        }
    }

    private SchemaCatalog assemble(Run run, int completedBatches) {
        Map<String, ResolvedSchema> named = new LinkedHashMap<>();
        Map<String, ResolvedSchema> pathSchemas = new LinkedHashMap<>();
        for (WorkItem item : run.items) {
            ResolvedSchema schema = run.results.get(item.index);
            if (schema == null) {
                continue;
            }
            if (item.named) {
                named.put(item.key, schema);
            } else {
                pathSchemas.put(item.key, schema);
            }
        }
        CatalogStats stats = new CatalogStats(
                run.runId,
                named.size(),
                pathSchemas.size(),
                run.errors.size(),
                completedBatches,
                run.peakInFlight.get(),
                Duration.ofNanos(System.nanoTime() - run.startNanos),
                resolver.cache().getStats(),
                memory.getMemoryStats());
        return new SchemaCatalog(named, pathSchemas, run.collector.tags(), run.collector.operations(), stats);
    }

    private static ThreadFactory workerFactory(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "schema-catalog-" + runId.substring(0, 8) + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * One schema to resolve. {@code index} is its position in document order.
     */
    private record WorkItem(int index, boolean named, String key, String pointerPath, JsonNode node,
                            boolean sequential) {
    }

    private record IndexedError(int index, SchemaResolutionException error) {
    }

    /**
     * Mutable state of one build.
     */
    private static final class Run {
        final OpenApiDocument document;
        final String runId;
        final long startNanos = System.nanoTime();
        final PathSchemaCollector collector;
        final List<WorkItem> items = new ArrayList<>();
        final int namedCount;
        final AtomicReferenceArray<ResolvedSchema> results;
        final ConcurrentLinkedQueue<IndexedError> errors = new ConcurrentLinkedQueue<>();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger peakInFlight = new AtomicInteger();

        Run(OpenApiDocument document, String runId) {
            this.document = document;
            this.runId = runId;
            this.collector = PathSchemaCollector.collect(document);
            CompositionDependencyGraph graph = CompositionDependencyGraph.build(document);
            if (!graph.taintedSchemas().isEmpty()) {
                log.debug("catalog.sequential schemas={}", graph.taintedSchemas());
            }
            for (String name : document.componentSchemaNames()) {
                items.add(new WorkItem(items.size(), true, name, SchemaReference.toComponent(name).pointer(),
                        null, graph.isTainted(name)));
            }
            this.namedCount = items.size();
            for (PathSchemaCollector.PathSchema schema : collector.schemas()) {
                items.add(new WorkItem(items.size(), false, schema.location(), schema.pointerPath(),
                        schema.node(), graph.reachesTainted(schema.node())));
            }
            this.results = new AtomicReferenceArray<>(items.size());
            int offset = items.size();
            for (SchemaResolutionException error : collector.errors()) {
                errors.add(new IndexedError(offset++, error));
            }
        }

        List<SchemaResolutionException> sortedErrors() {
            return errors.stream()
                    .sorted(Comparator.comparingInt(IndexedError::index))
                    .map(IndexedError::error)
                    .toList();
        }
    }
}
