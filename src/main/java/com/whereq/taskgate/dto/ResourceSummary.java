package com.whereq.taskgate.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.taskgate.model.ResourceProfile;
import lombok.Builder;
import lombok.Value;

/**
 * Resource totals, availability and admission thresholds
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResourceSummary {

    CpuSummary cpu;

    RamSummary ram;

    /**
     * Buffer kept free, as a percentage of totals
     */
    double bufferPercent;

    ResourceProfile profile;

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CpuSummary {
        int totalCores;
        double availableCores;
        double usagePercent;
        double minThresholdCores;
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RamSummary {
        double totalGb;
        double availableGb;
        double usagePercent;
        double minThresholdGb;
    }
}
