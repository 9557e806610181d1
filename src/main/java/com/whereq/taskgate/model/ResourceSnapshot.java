package com.whereq.taskgate.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of host CPU and RAM availability
 */
@Value
@Builder
public class ResourceSnapshot {
    /**
     * Logical CPU cores, fixed at startup
     */
    int totalCpuCores;

    /**
     * Cores not busy right now
     */
    double availableCpuCores;

    /**
     * Physical RAM in GB, fixed at startup
     */
    double totalRamGb;

    /**
     * RAM available right now in GB
     */
    double availableRamGb;

    /**
     * CPU busy percentage [0, 100]
     */
    double cpuPercent;

    /**
     * RAM used percentage [0, 100]
     */
    double ramPercent;
}
