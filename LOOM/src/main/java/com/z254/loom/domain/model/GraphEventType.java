package com.z254.loom.domain.model;

/**
 * Kinds of events emitted while a graph runs.
 */
public enum GraphEventType {
    /**
     * A node handler is about to run.
     */
    NODE_STARTED,

    /**
     * A node handler returned a new state.
     */
    NODE_COMPLETED,

    /**
     * Routing moved from one node to the next (or to the end sentinel).
     */
    EDGE_TRAVERSED,

    /**
     * A node handler or edge failed; the run fails right after this event.
     */
    ERROR,

    /**
     * The run finished successfully. Always the last event of a successful run.
     */
    GRAPH_COMPLETED
}
