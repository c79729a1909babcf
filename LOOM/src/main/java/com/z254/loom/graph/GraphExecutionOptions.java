package com.z254.loom.graph;

import com.z254.loom.config.LoomProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Per-invocation settings of a graph run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphExecutionOptions {

    public static final int DEFAULT_MAX_STEPS = 100;

    /**
     * Upper bound on node executions in one run.
     */
    @Builder.Default
    private int maxSteps = DEFAULT_MAX_STEPS;

    /**
     * Wall-clock budget, checked between steps. No limit when null.
     */
    private Duration timeout;

    /**
     * Save a checkpoint after every successful node.
     */
    private boolean checkpointEnabled;

    /**
     * Resume from this checkpoint instead of the entry point.
     */
    private String resumeFromCheckpointId;

    /**
     * Run identifier; generated when absent.
     */
    private String executionId;

    public static GraphExecutionOptions defaults() {
        return GraphExecutionOptions.builder().build();
    }

    public static GraphExecutionOptions from(LoomProperties.GraphProperties properties) {
        return GraphExecutionOptions.builder()
                .maxSteps(properties.getMaxSteps())
                .timeout(properties.getTimeout())
                .checkpointEnabled(properties.isCheckpointEnabled())
                .build();
    }

    public boolean isResuming() {
        return resumeFromCheckpointId != null;
    }
}
