package com.openapi.resolution.tracing;

import java.util.Map;

/**
 * Tracing integration point. The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
