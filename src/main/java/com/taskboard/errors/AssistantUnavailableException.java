package com.taskboard.errors;

/**
 * The language-model backend failed, timed out or was interrupted. No actions were parsed or applied.
 */
public class AssistantUnavailableException extends Exception {

    public AssistantUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
