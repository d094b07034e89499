package com.openapi.resolution.tracing;

/**
 * A unit of traced work. Closing the span ends it, so spans are used with
 * try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startSpan("schema.batch")) {
 *     span.setAttribute("batch.size", schemas.size());
 *     ...
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks the span as failed and attaches the exception.
     */
    void fail(Throwable t);

    @Override
    void close();
}
