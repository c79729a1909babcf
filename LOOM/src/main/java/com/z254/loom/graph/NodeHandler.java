package com.z254.loom.graph;

import com.z254.loom.domain.model.AgentState;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Work performed by one graph node.
 * <p>
 * The returned state replaces the current one; it is never merged. An error signal fails the
 * run, and the engine does not retry.
 */
@FunctionalInterface
public interface NodeHandler {

    /**
     * Execute the node.
     *
     * @param state        the current state
     * @param cancellation the run's cancellation token
     * @return the replacement state
     */
    Mono<AgentState> execute(AgentState state, CancellationToken cancellation);

    /**
     * Adapt a synchronous state transformation.
     */
    static NodeHandler of(Function<AgentState, AgentState> function) {
        return (state, cancellation) -> Mono.fromCallable(() -> function.apply(state));
    }
}
