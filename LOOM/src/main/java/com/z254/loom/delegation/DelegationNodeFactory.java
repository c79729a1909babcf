package com.z254.loom.delegation;

import com.z254.loom.config.LoomProperties;
import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.domain.model.WorkerTaskResult;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Creates delegation nodes bound to the application's supervisor and {@code loom.delegation.*} settings.
 */
public class DelegationNodeFactory {

    private final Supervisor supervisor;
    private final LoomProperties.DelegationProperties properties;

    public DelegationNodeFactory(Supervisor supervisor, LoomProperties.DelegationProperties properties) {
        this.supervisor = supervisor;
        this.properties = properties;
    }

    public DelegateToWorkerNode delegate(String name, Function<AgentState, List<WorkerTask>> taskFactory) {
        return new DelegateToWorkerNode(name, supervisor, taskFactory);
    }

    public AggregateResultsNode aggregate(String name,
                                          BiFunction<AgentState, Map<String, WorkerTaskResult>, AgentState> aggregator) {
        return new AggregateResultsNode(name, supervisor, aggregator, true,
                properties.getPollInterval(), properties.getMaxWait());
    }

    /**
     * An aggregating node that takes whatever has finished without waiting.
     */
    public AggregateResultsNode collectFinished(String name,
                                                BiFunction<AgentState, Map<String, WorkerTaskResult>, AgentState> aggregator) {
        return new AggregateResultsNode(name, supervisor, aggregator, false,
                properties.getPollInterval(), properties.getMaxWait());
    }
}
