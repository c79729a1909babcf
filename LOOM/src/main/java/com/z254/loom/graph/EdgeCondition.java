package com.z254.loom.graph;

import com.z254.loom.domain.model.AgentState;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Routing predicate attached to a node. Evaluated against the state the node produced.
 */
@FunctionalInterface
public interface EdgeCondition {

    /**
     * Decide where to go next.
     *
     * @return the decision, or empty when this edge does not apply
     */
    Mono<EdgeDecision> decide(AgentState state, CancellationToken cancellation);

    /**
     * Adapt a function returning a decision, or null when the edge does not apply.
     */
    static EdgeCondition of(Function<AgentState, EdgeDecision> function) {
        return (state, cancellation) -> Mono.fromSupplier(() -> function.apply(state));
    }
}
