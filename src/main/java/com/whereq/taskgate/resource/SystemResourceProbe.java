package com.whereq.taskgate.resource;

/**
 * Source of raw host CPU and memory measurements.
 * Implementations may block and may throw
 * {@link com.whereq.taskgate.exception.ResourceSamplingException}.
 */
public interface SystemResourceProbe {

    /**
     * @return logical CPU cores available to this process
     */
    int getLogicalProcessorCount();

    /**
     * @return total physical memory in bytes
     */
    long getTotalMemoryBytes();

    /**
     * @return system-wide CPU load in [0.0, 1.0]
     */
    double getCpuLoad();

    /**
     * @return memory available for new work in bytes
     */
    long getAvailableMemoryBytes();
}
