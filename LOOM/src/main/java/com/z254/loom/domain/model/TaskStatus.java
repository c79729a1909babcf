package com.z254.loom.domain.model;

/**
 * Lifecycle of a delegated worker task.
 */
public enum TaskStatus {
    /**
     * Persisted and waiting for a worker.
     */
    PENDING,

    /**
     * Assigned to a worker.
     */
    IN_PROGRESS,

    /**
     * Finished with a successful result.
     */
    COMPLETED,

    /**
     * Finished with a failed result.
     */
    FAILED,

    /**
     * Manually marked as waiting on something outside the system.
     */
    BLOCKED,

    /**
     * Manually marked for human review.
     */
    REVIEW,

    /**
     * Withdrawn before completion.
     */
    CANCELLED;

    /**
     * Terminal statuses refuse further status transitions.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
