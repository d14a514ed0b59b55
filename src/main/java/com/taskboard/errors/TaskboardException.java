package com.taskboard.errors;

/**
 * Base type for request-level failures raised by the board services.
 */
public abstract class TaskboardException extends RuntimeException {

    protected TaskboardException(String message) {
        super(message);
    }

    protected TaskboardException(String message, Throwable cause) {
        super(message, cause);
    }
}
