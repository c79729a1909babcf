package com.z254.loom.graph;

import com.z254.loom.checkpoint.CheckpointStore;
import com.z254.loom.config.LoomProperties;
import com.z254.loom.observability.GraphEventLogger;
import com.z254.loom.observability.GraphMetrics;

/**
 * Applies the application's checkpoint store, metrics and event logging to compiled graphs.
 */
public class GraphRuntime {

    private final CheckpointStore checkpointStore;
    private final GraphMetrics metrics;
    private final GraphEventLogger eventLogger;
    private final LoomProperties.GraphProperties graphProperties;

    /**
     * @param eventLogger may be null to leave event logging off
     */
    public GraphRuntime(CheckpointStore checkpointStore,
                        GraphMetrics metrics,
                        GraphEventLogger eventLogger,
                        LoomProperties.GraphProperties graphProperties) {
        this.checkpointStore = checkpointStore;
        this.metrics = metrics;
        this.eventLogger = eventLogger;
        this.graphProperties = graphProperties;
    }

    public CompiledGraph compile(GraphBuilder builder) {
        return attach(builder.compile());
    }

    public CompiledGraph attach(CompiledGraph graph) {
        return graph.withCheckpointStore(checkpointStore)
                .withMetrics(metrics)
                .withEventLogger(eventLogger);
    }

    /**
     * Execution options built from {@code loom.graph.*}.
     */
    public GraphExecutionOptions defaultOptions() {
        return GraphExecutionOptions.from(graphProperties);
    }
}
