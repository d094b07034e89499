package com.openapi.resolution.memory;

/**
 * @param heapUsedBytes last sampled heap usage
 * @param peakUsageMB   highest sampled heap usage in MiB
 * @param cleanupCount  cleanups triggered by heap pressure
 */
public record MemoryStats(long heapUsedBytes, long peakUsageMB, long cleanupCount) {

    public static MemoryStats empty() {
        return new MemoryStats(0, 0, 0);
    }
}
