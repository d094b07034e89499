package com.openapi.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSchema(runId, "User")) {
 *     log.debug("schema.resolved kind={}", schema.kind());
 * }
 * </pre>
 *
 * <p>Contexts nest: closing an inner context restores the values it replaced. MDC is
 * thread-local, so worker threads open their own context.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String SCHEMA = "schema";
    public static final String BATCH_ID = "batchId";
    public static final String OPERATION = "operation";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forCatalog(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(OPERATION, "catalog");
        return ctx;
    }

    public static LogContext forSchema(String runId, String schemaName) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(SCHEMA, schemaName);
        ctx.put(OPERATION, "resolve");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        ctx.put(OPERATION, "batch");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, old) -> {
            if (old == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, old);
            }
        });
        previous.clear();
    }
}
