package com.taskboard.errors;

/**
 * Bad or missing input. Raised before any state change.
 */
public class ValidationException extends TaskboardException {

    public ValidationException(String message) {
        super(message);
    }
}
