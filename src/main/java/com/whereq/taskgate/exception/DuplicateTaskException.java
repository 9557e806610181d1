package com.whereq.taskgate.exception;

/**
 * Exception thrown when a task id is already pending or running
 */
public class DuplicateTaskException extends RuntimeException {
    public DuplicateTaskException(String taskId) {
        super("Task already queued or running: " + taskId);
    }
}
