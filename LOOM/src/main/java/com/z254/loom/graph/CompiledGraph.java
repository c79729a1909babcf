package com.z254.loom.graph;

import com.z254.loom.checkpoint.CheckpointStore;
import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.Checkpoint;
import com.z254.loom.domain.model.GraphEvent;
import com.z254.loom.domain.model.GraphEventType;
import com.z254.loom.domain.model.GraphRunStatus;
import com.z254.loom.observability.GraphEventLogger;
import com.z254.loom.observability.GraphMetrics;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable, executable form of a graph.
 * <p>
 * A run walks the graph one node at a time: start the node, await its handler, replace the state
 * with the handler's result, route to the next node, repeat. Routing evaluates the node's
 * conditional edges in registration order against the new state and takes the first decision;
 * without a decision it follows the static edge; without a static edge the run ends.
 * <p>
 * The driver is a phase machine re-subscribed once per event, so a run of any length uses constant
 * stack and produces events only as fast as they are consumed. Instances hold no per-run state
 * and may execute any number of runs concurrently.
 */
@Slf4j
public final class CompiledGraph {

    private final GraphDefinition definition;
    private final CheckpointStore checkpointStore;
    private final GraphMetrics metrics;
    private final GraphEventLogger eventLogger;

    CompiledGraph(GraphDefinition definition) {
        this(definition, null, null, null);
    }

    private CompiledGraph(GraphDefinition definition,
                          CheckpointStore checkpointStore,
                          GraphMetrics metrics,
                          GraphEventLogger eventLogger) {
        this.definition = definition;
        this.checkpointStore = checkpointStore;
        this.metrics = metrics;
        this.eventLogger = eventLogger;
    }

    public String getName() {
        return definition.getName();
    }

    public GraphDefinition getDefinition() {
        return definition;
    }

    public CompiledGraph withCheckpointStore(CheckpointStore store) {
        return new CompiledGraph(definition, store, metrics, eventLogger);
    }

    public CompiledGraph withMetrics(GraphMetrics graphMetrics) {
        return new CompiledGraph(definition, checkpointStore, graphMetrics, eventLogger);
    }

    public CompiledGraph withEventLogger(GraphEventLogger logger) {
        return new CompiledGraph(definition, checkpointStore, metrics, logger);
    }

    // --------------------------------------------------------------------------------------------
    // Invocation
    // --------------------------------------------------------------------------------------------

    public Mono<AgentState> invoke(AgentState initialState) {
        return invoke(initialState, GraphExecutionOptions.defaults(), CancellationToken.none());
    }

    public Mono<AgentState> invoke(AgentState initialState, GraphExecutionOptions options) {
        return invoke(initialState, options, CancellationToken.none());
    }

    /**
     * Run the graph to completion and emit the final state.
     * <p>
     * Fails with a {@link GraphException} when the run fails or is cancelled.
     */
    public Mono<AgentState> invoke(AgentState initialState, GraphExecutionOptions options,
                                   CancellationToken cancellation) {
        return stream(initialState, options, cancellation)
                .filter(event -> event.getType() == GraphEventType.GRAPH_COMPLETED)
                .map(GraphEvent::getState)
                .singleOrEmpty()
                .switchIfEmpty(Mono.error(() -> GraphException.cancelled(getName())));
    }

    public Flux<GraphEvent> stream(AgentState initialState) {
        return stream(initialState, GraphExecutionOptions.defaults(), CancellationToken.none());
    }

    public Flux<GraphEvent> stream(AgentState initialState, GraphExecutionOptions options) {
        return stream(initialState, options, CancellationToken.none());
    }

    /**
     * Run the graph lazily, one event per transition.
     * <p>
     * Per node the sequence is NODE_STARTED, then NODE_COMPLETED or ERROR, then EDGE_TRAVERSED;
     * a successful run ends with GRAPH_COMPLETED. The token is checked between nodes: once it is
     * cancelled the sequence completes without running another node and without GRAPH_COMPLETED.
     */
    public Flux<GraphEvent> stream(AgentState initialState, GraphExecutionOptions options,
                                   CancellationToken cancellation) {
        GraphExecutionOptions effectiveOptions = options != null ? options : GraphExecutionOptions.defaults();
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();

        return Flux.defer(() -> start(initialState, effectiveOptions, token)
                .flatMapMany(run -> Mono.defer(() -> advance(run))
                        .repeat(run::isActive)
                        .doOnNext(this::observe)
                        .doFinally(signal -> finish(run, signal))));
    }

    // --------------------------------------------------------------------------------------------
    // Run phases
    // --------------------------------------------------------------------------------------------

    private Mono<Run> start(AgentState initialState, GraphExecutionOptions options, CancellationToken cancellation) {
        if (options.getMaxSteps() <= 0) {
            return Mono.error(new IllegalArgumentException("maxSteps must be positive: " + options.getMaxSteps()));
        }
        if ((options.isCheckpointEnabled() || options.isResuming()) && checkpointStore == null) {
            return Mono.error(new IllegalStateException(
                    "Graph " + getName() + " has no checkpoint store configured"));
        }

        String executionId = options.getExecutionId() != null
                ? options.getExecutionId()
                : UUID.randomUUID().toString();
        String checkpointId = null;
        if (options.isCheckpointEnabled()) {
            checkpointId = options.isResuming() ? options.getResumeFromCheckpointId() : executionId;
        }
        String effectiveCheckpointId = checkpointId;

        if (options.isResuming()) {
            String resumeId = options.getResumeFromCheckpointId();
            return checkpointStore.load(resumeId)
                    .switchIfEmpty(Mono.error(() -> GraphException.checkpointNotFound(resumeId)))
                    .map(checkpoint -> {
                        log.info("Resuming graph {} from checkpoint {} at node {} (step {})",
                                getName(), resumeId, checkpoint.getNextNode(), checkpoint.getStepCount());
                        return begin(new Run(executionId, effectiveCheckpointId, options, cancellation,
                                checkpoint.getState(), checkpoint.getNextNode(), checkpoint.getStepCount()));
                    });
        }

        if (initialState == null) {
            return Mono.error(new IllegalArgumentException("Initial state must not be null"));
        }
        return Mono.fromSupplier(() -> begin(new Run(executionId, effectiveCheckpointId, options, cancellation,
                initialState.copy(), definition.getEntryPoint(), 0)));
    }

    private Run begin(Run run) {
        log.info("Starting graph {} execution {} at node {}", getName(), run.executionId, run.currentNode);
        if (metrics != null) {
            metrics.recordRunStarted();
        }
        return run;
    }

    private Mono<GraphEvent> advance(Run run) {
        return switch (run.phase) {
            case START -> startNode(run);
            case EXECUTE -> executeNode(run);
            case ROUTE -> route(run);
            case COMPLETE -> {
                run.phase = Phase.DONE;
                run.status = GraphRunStatus.COMPLETED;
                yield Mono.just(event(run, GraphEventType.GRAPH_COMPLETED, run.state.getCurrentNode()).build());
            }
            case FAIL -> Mono.error(fail(run, run.failure));
            case DONE -> Mono.empty();
        };
    }

    private Mono<GraphEvent> startNode(Run run) {
        if (run.cancellation.isCancellationRequested()) {
            log.info("Graph {} execution {} cancelled before node {}", getName(), run.executionId, run.currentNode);
            run.phase = Phase.DONE;
            run.status = GraphRunStatus.CANCELLED;
            return Mono.empty();
        }

        Duration timeout = run.options.getTimeout();
        if (timeout != null && run.elapsed().compareTo(timeout) > 0) {
            return Mono.error(fail(run, GraphException.timeout(timeout, run.currentNode, run.step, run.state)));
        }
        if (run.step >= run.options.getMaxSteps()) {
            return Mono.error(fail(run,
                    GraphException.maxStepsExceeded(run.options.getMaxSteps(), run.currentNode, run.state)));
        }
        if (!definition.hasNode(run.currentNode)) {
            run.failure = GraphException.nodeNotFound(run.currentNode, run.step, run.state);
            run.phase = Phase.FAIL;
            return Mono.just(errorEvent(run, run.currentNode, run.failure, null));
        }

        log.debug("Graph {} execution {} starting node {} (step {})",
                getName(), run.executionId, run.currentNode, run.step + 1);
        run.phase = Phase.EXECUTE;
        run.nodeStartedAt = System.nanoTime();
        return Mono.just(event(run, GraphEventType.NODE_STARTED, run.currentNode).build());
    }

    private Mono<GraphEvent> executeNode(Run run) {
        String nodeName = run.currentNode;
        NodeHandler handler = definition.getNode(nodeName);
        AgentState input = run.state;

        return Mono.defer(() -> handler.execute(input, run.cancellation))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Node " + nodeName + " returned no state")))
                .map(result -> {
                    Duration duration = run.nodeElapsed();
                    run.step++;
                    AgentState next = result.copy();
                    next.setCurrentNode(nodeName);
                    next.setStepCount(run.step);
                    run.state = next;
                    run.phase = Phase.ROUTE;
                    recordNode(nodeName, duration, true);
                    return event(run, GraphEventType.NODE_COMPLETED, nodeName).duration(duration).build();
                })
                .onErrorResume(error -> {
                    Duration duration = run.nodeElapsed();
                    recordNode(nodeName, duration, false);
                    log.error("Node {} of graph {} failed: {}", nodeName, getName(), error.getMessage());
                    run.failure = GraphException.handlerFailure(nodeName, run.step, run.state, error);
                    run.phase = Phase.FAIL;
                    return Mono.just(errorEvent(run, nodeName, run.failure, duration));
                });
    }

    private Mono<GraphEvent> route(Run run) {
        String from = run.currentNode;
        AgentState state = run.state;

        return resolveNext(run, from, state)
                .onErrorMap(error -> !(error instanceof GraphException),
                        error -> GraphException.handlerFailure(from, run.step, state, error))
                .flatMap(next -> saveCheckpoint(run, from, next).thenReturn(next))
                .map(next -> {
                    log.debug("Graph {} execution {} routing {} -> {}", getName(), run.executionId, from, next);
                    run.currentNode = next;
                    run.phase = EdgeDecision.END.equals(next) ? Phase.COMPLETE : Phase.START;
                    return event(run, GraphEventType.EDGE_TRAVERSED, from).targetNode(next).build();
                })
                .onErrorResume(GraphException.class, failure -> {
                    run.failure = failure;
                    run.phase = Phase.FAIL;
                    return Mono.just(errorEvent(run, from, failure, null));
                });
    }

    private Mono<String> resolveNext(Run run, String nodeName, AgentState state) {
        return Flux.fromIterable(definition.getConditionalEdges(nodeName))
                .concatMap(edge -> Mono.defer(() -> edge.getCondition().decide(state, run.cancellation)))
                .next()
                .map(EdgeDecision::getTarget)
                .switchIfEmpty(Mono.fromSupplier(() -> staticTarget(nodeName)))
                .flatMap(target -> {
                    if (!EdgeDecision.END.equals(target) && !definition.hasNode(target)) {
                        return Mono.error(GraphException.nodeNotFound(target, run.step, state));
                    }
                    return Mono.just(target);
                });
    }

    private String staticTarget(String nodeName) {
        Optional<String> edge = definition.getStaticEdge(nodeName);
        if (edge.isPresent()) {
            return edge.get();
        }
        if (!definition.isExitPoint(nodeName)) {
            log.debug("Node {} of graph {} has no outgoing route, ending run", nodeName, getName());
        }
        return EdgeDecision.END;
    }

    private Mono<Void> saveCheckpoint(Run run, String nodeName, String nextNode) {
        if (run.checkpointId == null) {
            return Mono.empty();
        }
        Checkpoint checkpoint = Checkpoint.builder()
                .checkpointId(run.checkpointId)
                .executionId(run.executionId)
                .graphName(getName())
                .nodeName(nodeName)
                .nextNode(nextNode)
                .state(run.state)
                .stepCount(run.step)
                .build();
        return Mono.defer(() -> checkpointStore.save(checkpoint))
                .onErrorMap(error -> !(error instanceof GraphException),
                        error -> GraphException.checkpointFailure(run.checkpointId, error));
    }

    private GraphException fail(Run run, GraphException failure) {
        run.phase = Phase.DONE;
        run.status = GraphRunStatus.FAILED;
        run.failure = failure;
        return failure;
    }

    private void finish(Run run, SignalType signal) {
        if (run.status == GraphRunStatus.RUNNING) {
            run.status = signal == SignalType.ON_ERROR ? GraphRunStatus.FAILED : GraphRunStatus.CANCELLED;
        }
        long elapsedMs = run.elapsed().toMillis();
        switch (run.status) {
            case COMPLETED -> {
                log.info("Graph {} execution {} completed after {} step(s) in {}ms",
                        getName(), run.executionId, run.step, elapsedMs);
                if (metrics != null) metrics.recordRunCompleted();
            }
            case FAILED -> {
                log.warn("Graph {} execution {} failed after {} step(s): {}", getName(), run.executionId,
                        run.step, run.failure != null ? run.failure.getMessage() : signal);
                if (metrics != null) metrics.recordRunFailed();
            }
            case CANCELLED -> {
                log.info("Graph {} execution {} cancelled after {} step(s)", getName(), run.executionId, run.step);
                if (metrics != null) metrics.recordRunCancelled();
            }
            default -> {
            }
        }
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private void observe(GraphEvent event) {
        if (eventLogger != null) {
            eventLogger.log(event);
        }
    }

    private void recordNode(String nodeName, Duration duration, boolean success) {
        if (metrics != null) {
            metrics.recordNodeExecution(getName(), nodeName, duration, success);
        }
    }

    private GraphEvent.GraphEventBuilder event(Run run, GraphEventType type, String nodeName) {
        return GraphEvent.builder()
                .executionId(run.executionId)
                .graphName(getName())
                .nodeName(nodeName)
                .type(type)
                .state(run.state.copy())
                .step(run.step);
    }

    private GraphEvent errorEvent(Run run, String nodeName, GraphException failure, Duration duration) {
        return event(run, GraphEventType.ERROR, nodeName)
                .duration(duration)
                .error(failure)
                .build();
    }

    private enum Phase {
        START,
        EXECUTE,
        ROUTE,
        COMPLETE,
        FAIL,
        DONE
    }

    /**
     * Mutable position of one run. Touched by one signal at a time.
     */
    private static final class Run {

        private final String executionId;
        private final String checkpointId;
        private final GraphExecutionOptions options;
        private final CancellationToken cancellation;
        private final long startedAt = System.nanoTime();

        private AgentState state;
        private String currentNode;
        private int step;
        private Phase phase;
        private GraphRunStatus status = GraphRunStatus.RUNNING;
        private GraphException failure;
        private long nodeStartedAt;

        private Run(String executionId, String checkpointId, GraphExecutionOptions options,
                    CancellationToken cancellation, AgentState state, String currentNode, int step) {
            this.executionId = executionId;
            this.checkpointId = checkpointId;
            this.options = options;
            this.cancellation = cancellation;
            this.state = state;
            this.currentNode = currentNode;
            this.step = step;
            this.phase = EdgeDecision.END.equals(currentNode) ? Phase.COMPLETE : Phase.START;
        }

        private boolean isActive() {
            return phase != Phase.DONE;
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedAt);
        }

        private Duration nodeElapsed() {
            return Duration.ofNanos(System.nanoTime() - nodeStartedAt);
        }
    }
}
