package com.z254.loom.graph;

import lombok.Value;

import java.util.Set;

/**
 * A conditional edge as registered on the builder.
 */
@Value
public class ConditionalEdge {

    String source;

    EdgeCondition condition;

    /**
     * Targets the condition may route to. Empty when undeclared.
     */
    Set<String> possibleTargets;

    public boolean mayEnd() {
        return possibleTargets.isEmpty() || possibleTargets.contains(EdgeDecision.END);
    }
}
