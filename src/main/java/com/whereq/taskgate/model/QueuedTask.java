package com.whereq.taskgate.model;

import com.whereq.taskgate.executor.TaskWork;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of pending or running work, owned by the task queue
 */
@Getter
@ToString(exclude = "work")
public class QueuedTask {
    /**
     * Unique task identifier
     */
    private final String taskId;

    private final TaskType taskType;

    private final TaskWork work;

    /**
     * Higher priority runs sooner
     */
    private final int priority;

    /**
     * Submitting user, may be null
     */
    private final String ownerId;

    /**
     * When the task was created
     */
    private final Instant queuedAt;

    private final double estimatedCpuCores;

    private final double estimatedRamGb;

    /**
     * Current progress message, updated while running
     */
    @Setter
    private volatile String description = "";

    @Builder
    private QueuedTask(String taskId, TaskType taskType, TaskWork work, int priority,
                       String ownerId, Instant queuedAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.taskType = Objects.requireNonNull(taskType, "taskType");
        this.work = Objects.requireNonNull(work, "work");
        this.priority = priority;
        this.ownerId = ownerId;
        this.queuedAt = queuedAt != null ? queuedAt : Instant.now();

        ResourceRequirement requirement = taskType.getRequirement();
        this.estimatedCpuCores = requirement.getCpuCores();
        this.estimatedRamGb = requirement.getRamGb();
    }

    public boolean isOwnedBy(String owner) {
        return owner == null || owner.equals(ownerId);
    }
}
