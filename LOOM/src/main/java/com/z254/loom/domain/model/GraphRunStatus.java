package com.z254.loom.domain.model;

/**
 * Lifecycle of a single graph run.
 */
public enum GraphRunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
