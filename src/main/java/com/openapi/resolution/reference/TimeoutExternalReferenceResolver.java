package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ExternalReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call of the wrapped resolver by a timeout.
 *
 * <p>The delegate runs on the supplied executor. When a call does not finish in time the
 * worker thread is interrupted and the call fails with
 * {@link ErrorCode#EXTERNAL_FETCH_TIMEOUT}. A delegate that ignores interruption keeps its
 * thread until it returns. The schema path is attached by {@link ReferenceResolver}.</p>
 */
public class TimeoutExternalReferenceResolver implements ExternalReferenceResolver, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TimeoutExternalReferenceResolver.class);

    private final ExternalReferenceResolver delegate;
    private final Duration timeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public TimeoutExternalReferenceResolver(ExternalReferenceResolver delegate, Duration timeout) {
        this(delegate, timeout, Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "external-ref-fetch");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    public TimeoutExternalReferenceResolver(ExternalReferenceResolver delegate, Duration timeout,
                                            ExecutorService executor) {
        this(delegate, timeout, executor, false);
    }

    private TimeoutExternalReferenceResolver(ExternalReferenceResolver delegate, Duration timeout,
                                             ExecutorService executor, boolean ownsExecutor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public JsonNode resolveExternal(String pointer, String baseContext) {
        Future<JsonNode> future = executor.submit(() -> delegate.resolveExternal(pointer, baseContext));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("external.timeout pointer={} timeoutMs={}", pointer, timeout.toMillis());
            throw new ExternalReferenceException("Timed out after " + timeout.toMillis()
                    + "ms resolving " + pointer, ErrorCode.EXTERNAL_FETCH_TIMEOUT, pointer, "", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExternalReferenceException("Interrupted while resolving " + pointer,
                    ErrorCode.EXTERNAL_FILE_LOAD_FAILED, pointer, "", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause(), pointer);
        }
    }

    private static RuntimeException unwrap(Throwable cause, String pointer) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new ExternalReferenceException("Failed to resolve external reference " + pointer,
                ErrorCode.EXTERNAL_FILE_LOAD_FAILED, pointer, "", cause);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
