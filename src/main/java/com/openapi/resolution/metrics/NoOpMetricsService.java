package com.openapi.resolution.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String outcome, Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheEviction() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordMemoryCleanup() {
    }

    @Override
    public void recordCatalogErrors(int count) {
    }
}
