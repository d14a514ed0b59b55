package com.taskboard.errors;

/**
 * The actor lacks the role or ownership needed for the operation.
 * Also raised for boards the actor has no relation to, whether or not they exist.
 */
public class ForbiddenException extends TaskboardException {

    public ForbiddenException() {
        super("Forbidden");
    }

    public ForbiddenException(String message) {
        super(message);
    }
}
