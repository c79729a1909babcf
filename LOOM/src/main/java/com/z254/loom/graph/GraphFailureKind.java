package com.z254.loom.graph;

/**
 * Classification of {@link GraphException}s.
 */
public enum GraphFailureKind {
    DUPLICATE_NODE,
    NODE_NOT_FOUND,
    MAX_STEPS_EXCEEDED,
    TIMEOUT,
    NODE_HANDLER_FAILURE,
    CANCELLED,
    CHECKPOINT_NOT_FOUND,
    CHECKPOINT_FAILURE
}
