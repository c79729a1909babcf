package com.z254.loom.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Routing outcome of a conditional edge: a node name, or the end sentinel.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EdgeDecision {

    /**
     * Reserved target that terminates the run.
     */
    public static final String END = "__end__";

    private static final EdgeDecision END_DECISION = new EdgeDecision(END);

    private final String target;

    public static EdgeDecision to(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Edge target must not be blank");
        }
        return END.equals(target) ? END_DECISION : new EdgeDecision(target);
    }

    public static EdgeDecision end() {
        return END_DECISION;
    }

    public boolean isEnd() {
        return END.equals(target);
    }
}
