package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A unit of work delegated to a worker agent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkerTask {

    /**
     * Unique identifier, assigned on submission when absent.
     */
    private String taskId;

    /**
     * Free-form classification used for statistics and worker routing.
     */
    private String taskType;

    /**
     * Input payload handed to the worker.
     */
    @Builder.Default
    private Map<String, Object> input = new HashMap<>();

    /**
     * Tool or intent a worker must support to run the task.
     */
    private String requiredCapability;

    /**
     * Higher values are dispatched first.
     */
    private int priority;

    /**
     * Worker that should receive the task when it is available.
     */
    private String preferredAgentId;

    @Builder.Default
    private Instant createdAt = Instant.now();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public boolean hasRequiredCapability() {
        return requiredCapability != null && !requiredCapability.isBlank();
    }
}
