package com.whereq.taskgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.taskgate.model.TaskType;
import lombok.Builder;
import lombok.Value;

/**
 * Running task as reported in queue status
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunningTaskInfo {
    String taskId;
    TaskType taskType;
    double estimatedCpuCores;
    double estimatedRamGb;
    String description;
    String ownerId;
}
