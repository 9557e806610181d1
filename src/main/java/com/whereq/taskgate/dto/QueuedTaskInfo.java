package com.whereq.taskgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.taskgate.model.TaskType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Pending task as reported in queue status
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueuedTaskInfo {
    String taskId;
    TaskType taskType;
    int priority;
    Instant queuedAt;
    double estimatedCpuCores;
    double estimatedRamGb;

    /**
     * 1-indexed position in the pending collection
     */
    int queuePosition;

    String description;
    String ownerId;
}
