package com.z254.loom.graph;

import com.z254.loom.domain.model.AgentState;
import lombok.Getter;

import java.time.Duration;

/**
 * Failure raised while building or running a graph.
 * <p>
 * Run failures carry the node involved, the step reached and the last state the run produced
 * successfully, when one exists.
 */
@Getter
public class GraphException extends RuntimeException {

    private final GraphFailureKind kind;
    private final String nodeName;
    private final int step;
    private final transient AgentState lastState;

    public GraphException(GraphFailureKind kind, String message) {
        this(kind, message, null, 0, null, null);
    }

    public GraphException(GraphFailureKind kind, String message, String nodeName, int step,
                          AgentState lastState, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.nodeName = nodeName;
        this.step = step;
        this.lastState = lastState;
    }

    public static GraphException duplicateNode(String nodeName) {
        return new GraphException(GraphFailureKind.DUPLICATE_NODE,
                "Node already exists: " + nodeName, nodeName, 0, null, null);
    }

    public static GraphException nodeNotFound(String nodeName) {
        return new GraphException(GraphFailureKind.NODE_NOT_FOUND,
                "Node not found: " + nodeName, nodeName, 0, null, null);
    }

    public static GraphException nodeNotFound(String nodeName, int step, AgentState lastState) {
        return new GraphException(GraphFailureKind.NODE_NOT_FOUND,
                "Node not found: " + nodeName, nodeName, step, lastState, null);
    }

    public static GraphException maxStepsExceeded(int maxSteps, String nextNode, AgentState lastState) {
        return new GraphException(GraphFailureKind.MAX_STEPS_EXCEEDED,
                "Maximum steps (" + maxSteps + ") exceeded before node " + nextNode,
                nextNode, maxSteps, lastState, null);
    }

    public static GraphException timeout(Duration timeout, String nextNode, int step, AgentState lastState) {
        return new GraphException(GraphFailureKind.TIMEOUT,
                "Execution exceeded timeout of " + timeout + " before node " + nextNode,
                nextNode, step, lastState, null);
    }

    public static GraphException handlerFailure(String nodeName, int step, AgentState lastState, Throwable cause) {
        return new GraphException(GraphFailureKind.NODE_HANDLER_FAILURE,
                "Node " + nodeName + " failed: " + cause.getMessage(), nodeName, step, lastState, cause);
    }

    public static GraphException cancelled(String graphName) {
        return new GraphException(GraphFailureKind.CANCELLED, "Execution of graph " + graphName + " was cancelled");
    }

    public static GraphException checkpointNotFound(String checkpointId) {
        return new GraphException(GraphFailureKind.CHECKPOINT_NOT_FOUND, "Checkpoint not found: " + checkpointId);
    }

    public static GraphException checkpointFailure(String checkpointId, Throwable cause) {
        return new GraphException(GraphFailureKind.CHECKPOINT_FAILURE,
                "Checkpoint " + checkpointId + " could not be stored: " + cause.getMessage(),
                null, 0, null, cause);
    }
}
