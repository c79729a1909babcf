package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome reported by a worker for a {@link WorkerTask}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerTaskResult {

    private String taskId;

    private boolean success;

    /**
     * Worker output, set on success.
     */
    private Object output;

    /**
     * Failure description, set when {@link #success} is false.
     */
    private String errorMessage;

    /**
     * Worker that executed the task.
     */
    private String workerAgentId;

    private Duration executionTime;

    @Builder.Default
    private Instant completedAt = Instant.now();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static WorkerTaskResult success(String taskId, String workerAgentId, Object output,
                                           Duration executionTime) {
        return WorkerTaskResult.builder()
                .taskId(taskId)
                .success(true)
                .output(output)
                .workerAgentId(workerAgentId)
                .executionTime(executionTime)
                .build();
    }

    public static WorkerTaskResult failure(String taskId, String workerAgentId, String errorMessage,
                                           Duration executionTime) {
        return WorkerTaskResult.builder()
                .taskId(taskId)
                .success(false)
                .errorMessage(errorMessage)
                .workerAgentId(workerAgentId)
                .executionTime(executionTime)
                .build();
    }

    public TaskStatus toStatus() {
        return success ? TaskStatus.COMPLETED : TaskStatus.FAILED;
    }
}
