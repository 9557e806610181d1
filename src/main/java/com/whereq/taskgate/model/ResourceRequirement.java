package com.whereq.taskgate.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Nominal resource footprint of a task type
 */
@Value
public class ResourceRequirement {

    private static final Map<TaskType, ResourceRequirement> REQUIREMENTS;

    static {
        Map<TaskType, ResourceRequirement> table = new EnumMap<>(TaskType.class);
        table.put(TaskType.BACKTEST, new ResourceRequirement(1.0, 0.5));
        table.put(TaskType.MODEL_TRAINING, new ResourceRequirement(2.0, 1.5));
        table.put(TaskType.PREDICTION, new ResourceRequirement(0.5, 0.3));
        REQUIREMENTS = Collections.unmodifiableMap(table);
    }

    /**
     * CPU cores needed
     */
    double cpuCores;

    /**
     * RAM needed in GB
     */
    double ramGb;

    /**
     * Look up the requirement of a task type
     *
     * @param taskType task type
     * @return its nominal requirement
     */
    public static ResourceRequirement forType(TaskType taskType) {
        ResourceRequirement requirement = REQUIREMENTS.get(taskType);
        if (requirement == null) {
            throw new IllegalArgumentException("No resource requirement for task type: " + taskType);
        }
        return requirement;
    }

    /**
     * Requirement scaled by the fraction of it a task is expected to consume
     */
    public ResourceRequirement scale(double factor) {
        return new ResourceRequirement(cpuCores * factor, ramGb * factor);
    }
}
