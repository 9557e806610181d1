package com.whereq.taskgate.executor;

/**
 * Unit of work executed once a task is admitted
 */
@FunctionalInterface
public interface TaskWork {
    /**
     * Run the task to completion (blocking)
     *
     * @param context handle to the running task
     * @throws Exception if the task fails
     */
    void execute(TaskContext context) throws Exception;
}
