package com.z254.loom.domain.model;

/**
 * Policies for choosing a worker for a task.
 */
public enum LoadBalancingStrategy {
    /**
     * Rotate through workers with a shared cursor.
     */
    ROUND_ROBIN,

    /**
     * Prefer workers advertising the task's required capability.
     */
    CAPABILITY_BASED,

    /**
     * Prefer the least loaded worker relative to its capacity.
     */
    PRIORITY_BASED,

    /**
     * Uniform random choice.
     */
    RANDOM
}
