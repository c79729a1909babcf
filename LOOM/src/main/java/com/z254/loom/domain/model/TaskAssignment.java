package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A task paired with the worker chosen to run it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskAssignment {

    private WorkerTask task;

    private String agentId;

    private LoadBalancingStrategy strategy;

    @Builder.Default
    private Instant assignedAt = Instant.now();

    public String getTaskId() {
        return task != null ? task.getTaskId() : null;
    }
}
