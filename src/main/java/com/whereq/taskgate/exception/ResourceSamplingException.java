package com.whereq.taskgate.exception;

/**
 * Exception thrown when CPU or memory availability cannot be sampled
 */
public class ResourceSamplingException extends RuntimeException {
    public ResourceSamplingException(String message) {
        super(message);
    }

    public ResourceSamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
