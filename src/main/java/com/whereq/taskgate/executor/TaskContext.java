package com.whereq.taskgate.executor;

import com.whereq.taskgate.model.TaskType;

/**
 * View of a running task handed to its unit of work
 */
public interface TaskContext {

    String getTaskId();

    TaskType getTaskType();

    /**
     * Publish a progress message for this task.
     * Ignored once the task is no longer running.
     *
     * @param description human-readable progress message
     */
    void updateDescription(String description);
}
