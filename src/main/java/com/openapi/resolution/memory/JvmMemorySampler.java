package com.openapi.resolution.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Samples heap usage through the platform {@link MemoryMXBean}.
 */
public class JvmMemorySampler implements MemorySampler {

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    @Override
    public long usedHeapBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed();
    }
}
