package com.whereq.taskgate.queue;

import com.whereq.taskgate.dto.QueueStatus;
import com.whereq.taskgate.dto.QueuedTaskInfo;
import com.whereq.taskgate.dto.RunningTaskInfo;
import com.whereq.taskgate.exception.DuplicateTaskException;
import com.whereq.taskgate.executor.TaskContext;
import com.whereq.taskgate.executor.TaskWork;
import com.whereq.taskgate.model.AdmissionDecision;
import com.whereq.taskgate.model.QueuedTask;
import com.whereq.taskgate.model.TaskEventType;
import com.whereq.taskgate.model.TaskType;
import com.whereq.taskgate.resource.ResourceMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority queue of tasks with resource-based promotion to running.
 *
 * Pending tasks are ordered by descending priority, FIFO within equal
 * priority. A task id is in at most one of pending/running. All structural
 * changes happen under one lock that is never held while a unit of work
 * runs or while resources are sampled.
 */
@Slf4j
@Component
public class TaskQueue {

    private final ResourceMonitor resourceMonitor;
    private final TaskEventBus eventBus;
    private final Scheduler taskScheduler;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final List<QueuedTask> pending = new ArrayList<>();
    private final Map<String, QueuedTask> running = new LinkedHashMap<>();

    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Timer executionTimer;

    @Autowired
    public TaskQueue(ResourceMonitor resourceMonitor,
                     TaskEventBus eventBus,
                     @Qualifier("taskWorkScheduler") Scheduler taskScheduler,
                     MeterRegistry meterRegistry) {
        this.resourceMonitor = resourceMonitor;
        this.eventBus = eventBus;
        this.taskScheduler = taskScheduler;

        succeededCounter = Counter.builder("taskgate.tasks.succeeded")
            .description("Number of tasks that completed normally")
            .register(meterRegistry);

        failedCounter = Counter.builder("taskgate.tasks.failed")
            .description("Number of tasks whose work threw")
            .register(meterRegistry);

        executionTimer = Timer.builder("taskgate.tasks.execution.time")
            .description("Task execution time")
            .register(meterRegistry);

        Gauge.builder("taskgate.queue.pending", this::getQueuedCount)
            .description("Tasks waiting for resources")
            .register(meterRegistry);

        Gauge.builder("taskgate.queue.running", this::getRunningCount)
            .description("Tasks currently running")
            .register(meterRegistry);
    }

    public String enqueue(TaskType taskType, TaskWork work) {
        return enqueue(taskType, work, 0, null, null);
    }

    public String enqueue(TaskType taskType, TaskWork work, int priority) {
        return enqueue(taskType, work, priority, null, null);
    }

    /**
     * Add a task to the pending queue. Admission is evaluated later by
     * {@link #tryExecuteNext()}.
     *
     * @param taskType task type
     * @param work unit of work
     * @param priority higher runs sooner
     * @param taskId task id, generated if null
     * @param ownerId submitting user, may be null
     * @return the task id
     * @throws DuplicateTaskException if the id is already pending or running
     */
    public String enqueue(TaskType taskType, TaskWork work, int priority, String taskId, String ownerId) {
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(work, "work");

        lock.lock();
        try {
            QueuedTask task = QueuedTask.builder()
                .taskId(resolveTaskId(taskId))
                .taskType(taskType)
                .work(work)
                .priority(priority)
                .ownerId(ownerId)
                .queuedAt(Instant.now())
                .build();

            int index = insertionIndex(priority);
            pending.add(index, task);
            int position = index + 1;

            log.info("Queued task {} ({}) at position {} with priority {}, {} task(s) pending",
                task.getTaskId(), taskType.getWireName(), position, priority, pending.size());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("task_id", task.getTaskId());
            data.put("task_type", taskType.getWireName());
            data.put("estimated_cpu_cores", task.getEstimatedCpuCores());
            data.put("estimated_ram_gb", task.getEstimatedRamGb());
            data.put("queue_position", position);
            data.put("description", task.getDescription());
            eventBus.publish(TaskEventType.TASK_QUEUED, Collections.unmodifiableMap(data));

            return task.getTaskId();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start the head of the queue if resources allow it. Never skips the
     * head in favour of a later, smaller task.
     *
     * @return id of the started task, or empty if nothing was started
     */
    public Optional<String> tryExecuteNext() {
        QueuedTask head;
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return Optional.empty();
            }
            head = pending.get(0);
        } finally {
            lock.unlock();
        }

        AdmissionDecision decision = resourceMonitor.canRunTask(head.getTaskType());
        if (!decision.isAdmitted()) {
            log.debug("Head task {} stays queued: {}", head.getTaskId(), decision.getReason());
            return Optional.empty();
        }

        lock.lock();
        try {
            // Another caller may have promoted the head, or a higher-priority task arrived
            if (pending.isEmpty() || pending.get(0) != head) {
                log.debug("Queue head changed during admission check of task {}, retrying next tick",
                    head.getTaskId());
                return Optional.empty();
            }
            pending.remove(0);
            running.put(head.getTaskId(), head);
            log.info("Promoted task {} ({}) to running: {}",
                head.getTaskId(), head.getTaskType().getWireName(), decision.getReason());
            eventBus.publish(TaskEventType.TASK_RUNNING, runningPayload(head));
        } finally {
            lock.unlock();
        }

        dispatch(head);
        return Optional.of(head.getTaskId());
    }

    public String registerRunningTask(TaskType taskType, TaskWork work) {
        return registerRunningTask(taskType, work, null, null);
    }

    /**
     * Start a task immediately, bypassing the pending queue. For callers that
     * already confirmed admission themselves.
     *
     * @param taskType task type
     * @param work unit of work
     * @param taskId task id, generated if null
     * @param ownerId submitting user, may be null
     * @return the task id
     * @throws DuplicateTaskException if the id is already pending or running
     */
    public String registerRunningTask(TaskType taskType, TaskWork work, String taskId, String ownerId) {
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(work, "work");

        QueuedTask task;
        lock.lock();
        try {
            task = QueuedTask.builder()
                .taskId(resolveTaskId(taskId))
                .taskType(taskType)
                .work(work)
                .priority(0)
                .ownerId(ownerId)
                .queuedAt(Instant.now())
                .build();

            running.put(task.getTaskId(), task);
            log.info("Registered running task {} ({}), {} task(s) running",
                task.getTaskId(), taskType.getWireName(), running.size());
            eventBus.publish(TaskEventType.TASK_RUNNING, runningPayload(task));
        } finally {
            lock.unlock();
        }

        dispatch(task);
        return task.getTaskId();
    }

    public QueueStatus getQueueStatus() {
        return getQueueStatus(null);
    }

    /**
     * Snapshot of pending and running tasks
     *
     * @param ownerId only include tasks of this owner, or all if null.
     *                Queue positions stay global.
     * @return queue status
     */
    public QueueStatus getQueueStatus(String ownerId) {
        lock.lock();
        try {
            List<QueuedTaskInfo> queued = new ArrayList<>();
            for (int i = 0; i < pending.size(); i++) {
                QueuedTask task = pending.get(i);
                if (task.isOwnedBy(ownerId)) {
                    queued.add(QueuedTaskInfo.builder()
                        .taskId(task.getTaskId())
                        .taskType(task.getTaskType())
                        .priority(task.getPriority())
                        .queuedAt(task.getQueuedAt())
                        .estimatedCpuCores(task.getEstimatedCpuCores())
                        .estimatedRamGb(task.getEstimatedRamGb())
                        .queuePosition(i + 1)
                        .description(task.getDescription())
                        .ownerId(task.getOwnerId())
                        .build());
                }
            }

            List<RunningTaskInfo> active = new ArrayList<>();
            for (QueuedTask task : running.values()) {
                if (task.isOwnedBy(ownerId)) {
                    active.add(RunningTaskInfo.builder()
                        .taskId(task.getTaskId())
                        .taskType(task.getTaskType())
                        .estimatedCpuCores(task.getEstimatedCpuCores())
                        .estimatedRamGb(task.getEstimatedRamGb())
                        .description(task.getDescription())
                        .ownerId(task.getOwnerId())
                        .build());
                }
            }

            return QueueStatus.builder()
                .queuedCount(queued.size())
                .runningCount(active.size())
                .queuedTasks(Collections.unmodifiableList(queued))
                .runningTasks(Collections.unmodifiableList(active))
                .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 1-indexed position of a pending task, or empty if not pending
     */
    public OptionalInt getTaskPosition(String taskId) {
        lock.lock();
        try {
            for (int i = 0; i < pending.size(); i++) {
                if (pending.get(i).getTaskId().equals(taskId)) {
                    return OptionalInt.of(i + 1);
                }
            }
            return OptionalInt.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Update the progress message of a running task. Unknown ids are ignored,
     * since updates can race with completion.
     *
     * @param taskId task id
     * @param description new progress message
     */
    public void updateTaskDescription(String taskId, String description) {
        lock.lock();
        try {
            QueuedTask task = running.get(taskId);
            if (task == null) {
                log.debug("Ignoring description update for task {}: not running", taskId);
                return;
            }
            task.setDescription(description);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("task_id", taskId);
            data.put("task_type", task.getTaskType().getWireName());
            data.put("description", description);
            eventBus.publish(TaskEventType.TASK_DESCRIPTION_UPDATE, Collections.unmodifiableMap(data));

            log.debug("Updated task {} description: {}", taskId, description);
        } finally {
            lock.unlock();
        }
    }

    public EventSubscription subscribeToEvents() {
        return eventBus.subscribe();
    }

    public void unsubscribeFromEvents(EventSubscription subscription) {
        eventBus.unsubscribe(subscription);
    }

    public int getQueuedCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int getRunningCount() {
        lock.lock();
        try {
            return running.size();
        } finally {
            lock.unlock();
        }
    }

    private String resolveTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return "task-" + UUID.randomUUID();
        }
        if (running.containsKey(taskId) || pending.stream().anyMatch(t -> t.getTaskId().equals(taskId))) {
            throw new DuplicateTaskException(taskId);
        }
        return taskId;
    }

    /**
     * First position whose priority is strictly lower than the new one
     */
    private int insertionIndex(int priority) {
        for (int i = 0; i < pending.size(); i++) {
            if (priority > pending.get(i).getPriority()) {
                return i;
            }
        }
        return pending.size();
    }

    private Map<String, Object> runningPayload(QueuedTask task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", task.getTaskId());
        data.put("task_type", task.getTaskType().getWireName());
        data.put("estimated_cpu_cores", task.getEstimatedCpuCores());
        data.put("estimated_ram_gb", task.getEstimatedRamGb());
        return Collections.unmodifiableMap(data);
    }

    private void dispatch(QueuedTask task) {
        try {
            taskScheduler.schedule(() -> executeTask(task));
        } catch (RejectedExecutionException e) {
            log.error("Could not dispatch task {}: scheduler rejected it", task.getTaskId(), e);
            completeTask(task, false);
        }
    }

    /**
     * Run a task's work. Failures are logged and reported through the
     * completion event. Exceptions are not rethrown; errors are, once the
     * completion has been reported.
     */
    private void executeTask(QueuedTask task) {
        log.info("Executing task {} ({})", task.getTaskId(), task.getTaskType().getWireName());

        boolean success = false;
        long startTime = System.nanoTime();
        try {
            task.getWork().execute(new QueueTaskContext(task));
            success = true;
            log.info("Task {} completed", task.getTaskId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Task {} interrupted", task.getTaskId(), e);
        } catch (Exception e) {
            log.error("Task {} failed: {}", task.getTaskId(), e.getMessage(), e);
        } catch (Error e) {
            log.error("Task {} failed with error: {}", task.getTaskId(), e.toString(), e);
            throw e;
        } finally {
            executionTimer.record(System.nanoTime() - startTime, TimeUnit.NANOSECONDS);
            completeTask(task, success);
        }
    }

    private void completeTask(QueuedTask task, boolean success) {
        lock.lock();
        try {
            if (!running.remove(task.getTaskId(), task)) {
                return;
            }
            (success ? succeededCounter : failedCounter).increment();
            log.info("Removed completed task {} (success={}), {} task(s) still running",
                task.getTaskId(), success, running.size());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("task_id", task.getTaskId());
            data.put("task_type", task.getTaskType().getWireName());
            data.put("success", success);
            eventBus.publish(TaskEventType.TASK_COMPLETED, Collections.unmodifiableMap(data));
        } finally {
            lock.unlock();
        }
    }

    private class QueueTaskContext implements TaskContext {

        private final QueuedTask task;

        QueueTaskContext(QueuedTask task) {
            this.task = task;
        }

        @Override
        public String getTaskId() {
            return task.getTaskId();
        }

        @Override
        public TaskType getTaskType() {
            return task.getTaskType();
        }

        @Override
        public void updateDescription(String description) {
            updateTaskDescription(task.getTaskId(), description);
        }
    }
}
