package com.openapi.resolution.memory;

/**
 * Source of heap usage samples. Replaced by a fake in tests.
 */
@FunctionalInterface
public interface MemorySampler {

    long usedHeapBytes();
}
