package com.openapi.resolution.api;

import com.openapi.resolution.cache.CacheStats;
import com.openapi.resolution.memory.MemoryStats;

import java.time.Duration;

/**
 * Figures of one catalog build.
 *
 * @param runId                correlation id, also present in the MDC of the run's log events
 * @param schemasResolved      named component schemas resolved successfully
 * @param pathSchemasResolved  schemas found under {@code paths} resolved successfully
 * @param errors               schemas that failed
 * @param batches              batches processed
 * @param peakInFlight         highest number of schemas being resolved at the same time
 */
public record CatalogStats(
        String runId,
        int schemasResolved,
        int pathSchemasResolved,
        int errors,
        int batches,
        int peakInFlight,
        Duration duration,
        CacheStats cache,
        MemoryStats memory
) {
}
