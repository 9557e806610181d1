package com.whereq.taskgate.service;

import com.whereq.taskgate.dto.TaskSubmitResponse;
import com.whereq.taskgate.dto.TaskSubmitResponse.SubmissionStatus;
import com.whereq.taskgate.executor.TaskWork;
import com.whereq.taskgate.model.AdmissionDecision;
import com.whereq.taskgate.model.TaskType;
import com.whereq.taskgate.queue.TaskQueue;
import com.whereq.taskgate.resource.ResourceMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;

/**
 * Admission control for task submissions.
 * Starts a task right away when resources allow it, queues it otherwise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskSubmissionService {

    private final ResourceMonitor resourceMonitor;

    private final TaskQueue taskQueue;

    public TaskSubmitResponse submit(TaskType taskType, TaskWork work) {
        return submit(taskType, work, 0, null, null);
    }

    /**
     * Submit a task
     *
     * @param taskType task type
     * @param work unit of work
     * @param priority queue priority, used only if the task has to wait
     * @param taskId task id, generated if null
     * @param ownerId submitting user, may be null
     * @return whether the task is running or queued, with the admission reason
     */
    public TaskSubmitResponse submit(TaskType taskType, TaskWork work, int priority, String taskId, String ownerId) {
        AdmissionDecision decision = resourceMonitor.canRunTask(taskType);

        if (decision.isAdmitted()) {
            String id = taskQueue.registerRunningTask(taskType, work, taskId, ownerId);
            log.info("Task {} ({}) admitted: {}", id, taskType.getWireName(), decision.getReason());
            return TaskSubmitResponse.builder()
                .taskId(id)
                .status(SubmissionStatus.RUNNING)
                .message("Task started: " + decision.getReason())
                .build();
        }

        String id = taskQueue.enqueue(taskType, work, priority, taskId, ownerId);
        // Empty if the worker already promoted it
        OptionalInt queuePosition = taskQueue.getTaskPosition(id);
        Integer position = queuePosition.isPresent() ? queuePosition.getAsInt() : null;
        log.info("Task {} ({}) queued at position {}: {}", id, taskType.getWireName(), position, decision.getReason());
        return TaskSubmitResponse.builder()
            .taskId(id)
            .status(SubmissionStatus.QUEUED)
            .queuePosition(position)
            .message("Task queued due to insufficient resources: " + decision.getReason())
            .build();
    }
}
