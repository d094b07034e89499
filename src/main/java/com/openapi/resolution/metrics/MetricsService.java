package com.openapi.resolution.metrics;

import java.time.Duration;

/**
 * Interface for recording schema resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a
 * metrics backend.
 */
public interface MetricsService {

    /**
     * @param outcome {@code success} or the error code of the failure
     */
    void recordResolutionDuration(String outcome, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheEviction();

    void recordBatchSize(int size);

    void recordMemoryCleanup();

    void recordCatalogErrors(int count);
}
