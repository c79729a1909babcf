package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Observable unit emitted per transition of a graph run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEvent {

    /**
     * Identifier of the run that emitted the event.
     */
    private String executionId;

    /**
     * Name of the graph being executed.
     */
    private String graphName;

    /**
     * Node the event refers to. For edge events, the source node.
     */
    private String nodeName;

    /**
     * Destination of an {@link GraphEventType#EDGE_TRAVERSED} event.
     */
    private String targetNode;

    /**
     * Event kind.
     */
    private GraphEventType type;

    /**
     * Snapshot of the state at emission time.
     */
    private AgentState state;

    /**
     * Number of nodes executed so far.
     */
    private int step;

    /**
     * Handler duration, set on completion and error events.
     */
    private Duration duration;

    /**
     * Failure carried by {@link GraphEventType#ERROR} events.
     */
    private Throwable error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public boolean hasError() {
        return type == GraphEventType.ERROR;
    }
}
