package com.z254.loom.domain.repository;

/**
 * Raised when a {@link TaskStore} is called with an invalid argument.
 */
public class TaskStoreException extends IllegalArgumentException {

    public TaskStoreException(String message) {
        super(message);
    }
}
