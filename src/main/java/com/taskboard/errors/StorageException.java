package com.taskboard.errors;

/**
 * The persistence layer could not complete a read or write.
 */
public class StorageException extends TaskboardException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
