package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted execution position of a graph run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    /**
     * Key the checkpoint is stored under; later saves with the same id replace it.
     */
    private String checkpointId;

    /**
     * Run that wrote the checkpoint.
     */
    private String executionId;

    private String graphName;

    /**
     * Last node that completed successfully.
     */
    private String nodeName;

    /**
     * Node a resumed run starts from. The end sentinel when the run had finished.
     */
    private String nextNode;

    /**
     * State produced by {@link #nodeName}.
     */
    private AgentState state;

    private int stepCount;

    @Builder.Default
    private Instant createdAt = Instant.now();
}
