package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Point-in-time counters of the delegation subsystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupervisorStatistics {

    private long totalSubmitted;
    private long completed;
    private long failed;
    private long cancelled;

    /**
     * Tasks waiting in the dispatch queue.
     */
    private int pending;

    /**
     * Tasks assigned to a worker without a result yet.
     */
    private long inProgress;

    /**
     * Mean execution time over reported results, zero when none were reported.
     */
    @Builder.Default
    private Duration averageExecutionTime = Duration.ZERO;

    @Builder.Default
    private Map<String, Long> tasksByType = new HashMap<>();

    @Builder.Default
    private Map<String, Long> tasksByAgent = new HashMap<>();
}
