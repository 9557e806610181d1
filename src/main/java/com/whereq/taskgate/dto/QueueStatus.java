package com.whereq.taskgate.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Consistent snapshot of pending and running tasks
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueueStatus {

    int queuedCount;

    int runningCount;

    /**
     * Pending tasks in promotion order
     */
    List<QueuedTaskInfo> queuedTasks;

    List<RunningTaskInfo> runningTasks;

    public boolean contains(String taskId) {
        return queuedTasks.stream().anyMatch(t -> t.getTaskId().equals(taskId))
            || runningTasks.stream().anyMatch(t -> t.getTaskId().equals(taskId));
    }
}
