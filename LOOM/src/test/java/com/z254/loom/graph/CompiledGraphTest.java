package com.z254.loom.graph;

import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.GraphEvent;
import com.z254.loom.domain.model.Message;
import com.z254.loom.observability.GraphMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.z254.loom.domain.model.GraphEventType.EDGE_TRAVERSED;
import static com.z254.loom.domain.model.GraphEventType.ERROR;
import static com.z254.loom.domain.model.GraphEventType.GRAPH_COMPLETED;
import static com.z254.loom.domain.model.GraphEventType.NODE_COMPLETED;
import static com.z254.loom.domain.model.GraphEventType.NODE_STARTED;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CompiledGraph}.
 */
class CompiledGraphTest {

    private CompiledGraph triage;

    @BeforeEach
    void setUp() {
        triage = GraphBuilder.create("triage")
                .addNode("start", NodeHandler.of(state -> state.withMessage(Message.user("hi"))))
                .addNode("classify", NodeHandler.of(state -> state.withValue("intent", "greeting")))
                .addNode("respond", NodeHandler.of(state -> state.withMessage(Message.assistant("Hello!"))))
                .addEdge("start", "classify")
                .addConditionalEdge("classify",
                        EdgeCondition.of(state -> state.hasValue("intent")
                                ? EdgeDecision.to("respond")
                                : EdgeDecision.end()),
                        "respond", EdgeDecision.END)
                .setEntryPoint("start")
                .addExitPoint("respond")
                .compile();
    }

    /**
     * A single node that routes back to itself forever and counts its executions.
     */
    private static CompiledGraph loop(NodeHandler handler) {
        return GraphBuilder.create("loop")
                .addNode("spin", handler)
                .addConditionalEdge("spin", EdgeCondition.of(state -> EdgeDecision.to("spin")))
                .setEntryPoint("spin")
                .compile();
    }

    @Nested
    @DisplayName("Invocation")
    class InvocationTests {

        @Test
        @DisplayName("should run the graph to its exit point")
        void runToCompletion() {
            StepVerifier.create(triage.invoke(AgentState.empty()))
                    .assertNext(state -> {
                        assertThat(state.getValue("intent")).isEqualTo("greeting");
                        assertThat(state.getMessages()).extracting(Message::getContent)
                                .containsExactly("hi", "Hello!");
                        assertThat(state.getCurrentNode()).isEqualTo("respond");
                        assertThat(state.getStepCount()).isEqualTo(3);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not mutate the caller's initial state")
        void initialStateUntouched() {
            AgentState initial = AgentState.of(Map.of("user", "ada"));

            StepVerifier.create(triage.invoke(initial))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(initial.getMessages()).isEmpty();
            assertThat(initial.hasValue("intent")).isFalse();
            assertThat(initial.getStepCount()).isZero();
        }

        @Test
        @DisplayName("should overwrite bookkeeping set by handlers")
        void stampPosition() {
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("a", NodeHandler.of(state -> {
                        AgentState next = state.copy();
                        next.setStepCount(42);
                        next.setCurrentNode("elsewhere");
                        return next;
                    }))
                    .setEntryPoint("a")
                    .compile();

            StepVerifier.create(graph.invoke(AgentState.empty()))
                    .assertNext(state -> {
                        assertThat(state.getStepCount()).isEqualTo(1);
                        assertThat(state.getCurrentNode()).isEqualTo("a");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should leave a state object returned by a handler untouched")
        void sharedHandlerResultUntouched() {
            AgentState shared = AgentState.of(Map.of("answer", 42));
            CompiledGraph graph = GraphBuilder.create("cached")
                    .addNode("lookup", NodeHandler.of(state -> shared))
                    .addNode("reply", NodeHandler.of(state -> shared))
                    .addEdge("lookup", "reply")
                    .setEntryPoint("lookup")
                    .compile();

            StepVerifier.create(Flux.range(0, 10).flatMap(i -> graph.invoke(AgentState.empty())))
                    .thenConsumeWhile(state -> state.getStepCount() == 2 && "reply".equals(state.getCurrentNode()))
                    .verifyComplete();

            assertThat(shared.getCurrentNode()).isNull();
            assertThat(shared.getStepCount()).isZero();
            assertThat(shared.getValue("answer")).isEqualTo(42);
        }

        @Test
        @DisplayName("should run concurrent invocations independently")
        void concurrentRuns() {
            CompiledGraph graph = GraphBuilder.create("echo")
                    .addNode("delay", (state, token) -> Mono.delay(Duration.ofMillis(5)).thenReturn(state))
                    .addNode("echo", NodeHandler.of(state -> state.withValue("echo", state.getValue("input"))))
                    .addEdge("delay", "echo")
                    .setEntryPoint("delay")
                    .compile();

            Flux<AgentState> runs = Flux.range(0, 20)
                    .flatMap(i -> graph.invoke(AgentState.of(Map.of("input", i))));

            StepVerifier.create(runs.collectList())
                    .assertNext(states -> {
                        assertThat(states).hasSize(20);
                        assertThat(states).allSatisfy(state ->
                                assertThat(state.getValue("echo")).isEqualTo(state.getValue("input")));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should end the run at a node with no outgoing route")
        void implicitEnd() {
            AtomicInteger secondRuns = new AtomicInteger();
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("a", NodeHandler.of(state -> state.withValue("a", true)))
                    .addNode("b", NodeHandler.of(state -> {
                        secondRuns.incrementAndGet();
                        return state;
                    }))
                    .setEntryPoint("a")
                    .compile();

            StepVerifier.create(graph.invoke(AgentState.empty()))
                    .assertNext(state -> assertThat(state.getCurrentNode()).isEqualTo("a"))
                    .verifyComplete();
            assertThat(secondRuns).hasValue(0);
        }
    }

    @Nested
    @DisplayName("Event streaming")
    class StreamingTests {

        @Test
        @DisplayName("should emit started, completed and edge events per node then completion")
        void eventOrder() {
            StepVerifier.create(triage.stream(AgentState.empty()).map(GraphEvent::getType))
                    .expectNext(NODE_STARTED, NODE_COMPLETED, EDGE_TRAVERSED)
                    .expectNext(NODE_STARTED, NODE_COMPLETED, EDGE_TRAVERSED)
                    .expectNext(NODE_STARTED, NODE_COMPLETED, EDGE_TRAVERSED)
                    .expectNext(GRAPH_COMPLETED)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should describe each transition")
        void eventDetails() {
            List<GraphEvent> events = triage.stream(AgentState.empty()).collectList().block();

            assertThat(events).isNotNull();
            assertThat(events).extracting(GraphEvent::getExecutionId).containsOnly(events.get(0).getExecutionId());
            assertThat(events).extracting(GraphEvent::getGraphName).containsOnly("triage");

            List<GraphEvent> edges = events.stream().filter(e -> e.getType() == EDGE_TRAVERSED).toList();
            assertThat(edges).extracting(GraphEvent::getNodeName).containsExactly("start", "classify", "respond");
            assertThat(edges).extracting(GraphEvent::getTargetNode)
                    .containsExactly("classify", "respond", EdgeDecision.END);

            GraphEvent firstCompleted = events.get(1);
            assertThat(firstCompleted.getType()).isEqualTo(NODE_COMPLETED);
            assertThat(firstCompleted.getDuration()).isNotNull();
            assertThat(firstCompleted.getState().hasValue("intent")).isFalse();
        }

        @Test
        @DisplayName("should use the execution id from the options")
        void executionIdFromOptions() {
            GraphExecutionOptions options = GraphExecutionOptions.builder().executionId("run-7").build();

            StepVerifier.create(triage.stream(AgentState.empty(), options).map(GraphEvent::getExecutionId).distinct())
                    .expectNext("run-7")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should only run nodes as events are requested")
        void demandDriven() {
            AtomicInteger executions = new AtomicInteger();
            CompiledGraph graph = loop(NodeHandler.of(state -> {
                executions.incrementAndGet();
                return state;
            }));

            StepVerifier.create(graph.stream(AgentState.empty()), 0)
                    .thenRequest(2)
                    .expectNextCount(2)
                    .then(() -> assertThat(executions).hasValue(1))
                    .thenCancel()
                    .verify();
        }
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("should take the first conditional decision in registration order")
        void firstDecisionWins() {
            AtomicInteger thirdEvaluated = new AtomicInteger();
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("a", NodeHandler.of(state -> state))
                    .addNode("b", NodeHandler.of(state -> state.withValue("visited", "b")))
                    .addNode("c", NodeHandler.of(state -> state.withValue("visited", "c")))
                    .addConditionalEdge("a", EdgeCondition.of(state -> null))
                    .addConditionalEdge("a", EdgeCondition.of(state -> EdgeDecision.to("b")), "b")
                    .addConditionalEdge("a", EdgeCondition.of(state -> {
                        thirdEvaluated.incrementAndGet();
                        return EdgeDecision.to("c");
                    }), "c")
                    .setEntryPoint("a")
                    .compile();

            StepVerifier.create(graph.invoke(AgentState.empty()))
                    .assertNext(state -> assertThat(state.getValue("visited")).isEqualTo("b"))
                    .verifyComplete();
            assertThat(thirdEvaluated).hasValue(0);
        }

        @Test
        @DisplayName("should fall through to the static edge when no condition decides")
        void staticFallback() {
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("a", NodeHandler.of(state -> state))
                    .addNode("b", NodeHandler.of(state -> state.withValue("visited", "b")))
                    .addConditionalEdge("a", EdgeCondition.of(state -> null))
                    .addEdge("a", "b")
                    .setEntryPoint("a")
                    .compile();

            StepVerifier.create(graph.invoke(AgentState.empty()))
                    .assertNext(state -> assertThat(state.getValue("visited")).isEqualTo("b"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should evaluate conditions against the state the node produced")
        void conditionSeesNewState() {
            StepVerifier.create(triage.stream(AgentState.empty())
                            .filter(event -> event.getType() == EDGE_TRAVERSED && "classify".equals(event.getNodeName()))
                            .map(GraphEvent::getTargetNode))
                    .expectNext("respond")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail when a decision names an unknown node")
        void unknownDecisionTarget() {
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("a", NodeHandler.of(state -> state))
                    .addConditionalEdge("a", EdgeCondition.of(state -> EdgeDecision.to("ghost")))
                    .setEntryPoint("a")
                    .compile();

            StepVerifier.create(graph.stream(AgentState.empty()).map(GraphEvent::getType))
                    .expectNext(NODE_STARTED, NODE_COMPLETED, ERROR)
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(GraphException.class);
                        GraphException failure = (GraphException) error;
                        assertThat(failure.getKind()).isEqualTo(GraphFailureKind.NODE_NOT_FOUND);
                        assertThat(failure.getNodeName()).isEqualTo("ghost");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should treat a failing condition as a node failure")
        void failingCondition() {
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("a", NodeHandler.of(state -> state))
                    .addConditionalEdge("a", EdgeCondition.of(state -> {
                        throw new IllegalStateException("router down");
                    }))
                    .setEntryPoint("a")
                    .compile();

            StepVerifier.create(graph.invoke(AgentState.empty()))
                    .expectErrorSatisfies(error -> {
                        GraphException failure = (GraphException) error;
                        assertThat(failure.getKind()).isEqualTo(GraphFailureKind.NODE_HANDLER_FAILURE);
                        assertThat(failure.getCause()).hasMessage("router down");
                    })
                    .verify();
        }
    }

    @Nested
    @DisplayName("Failures and limits")
    class FailureTests {

        @Test
        @DisplayName("should fail once the step budget is spent")
        void maxSteps() {
            AtomicInteger executions = new AtomicInteger();
            CompiledGraph graph = loop(NodeHandler.of(state -> {
                executions.incrementAndGet();
                return state;
            }));

            StepVerifier.create(graph.invoke(AgentState.empty(), GraphExecutionOptions.builder().maxSteps(5).build()))
                    .expectErrorSatisfies(error -> {
                        GraphException failure = (GraphException) error;
                        assertThat(failure.getKind()).isEqualTo(GraphFailureKind.MAX_STEPS_EXCEEDED);
                        assertThat(failure.getLastState().getStepCount()).isEqualTo(5);
                    })
                    .verify();
            assertThat(executions).hasValue(5);
        }

        @Test
        @DisplayName("should reject a non-positive step budget")
        void invalidMaxSteps() {
            StepVerifier.create(triage.invoke(AgentState.empty(), GraphExecutionOptions.builder().maxSteps(0).build()))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail when the wall-clock budget runs out between steps")
        void timeout() {
            CompiledGraph graph = loop((state, token) -> Mono.delay(Duration.ofMillis(100)).thenReturn(state));
            GraphExecutionOptions options = GraphExecutionOptions.builder()
                    .timeout(Duration.ofMillis(20))
                    .build();

            StepVerifier.create(graph.invoke(AgentState.empty(), options))
                    .expectErrorSatisfies(error -> {
                        GraphException failure = (GraphException) error;
                        assertThat(failure.getKind()).isEqualTo(GraphFailureKind.TIMEOUT);
                        assertThat(failure.getStep()).isLessThanOrEqualTo(1);
                    })
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should surface handler failures without retrying")
        void handlerFailure() {
            AtomicInteger attempts = new AtomicInteger();
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("ok", NodeHandler.of(state -> state.withValue("ok", true)))
                    .addNode("boom", NodeHandler.of(state -> {
                        attempts.incrementAndGet();
                        throw new IllegalStateException("kaput");
                    }))
                    .addEdge("ok", "boom")
                    .setEntryPoint("ok")
                    .compile();

            StepVerifier.create(graph.stream(AgentState.empty()))
                    .expectNextCount(3)
                    .expectNextMatches(event -> event.getType() == NODE_STARTED)
                    .assertNext(event -> {
                        assertThat(event.getType()).isEqualTo(ERROR);
                        assertThat(event.getNodeName()).isEqualTo("boom");
                        assertThat(event.hasError()).isTrue();
                    })
                    .expectErrorSatisfies(error -> {
                        GraphException failure = (GraphException) error;
                        assertThat(failure.getKind()).isEqualTo(GraphFailureKind.NODE_HANDLER_FAILURE);
                        assertThat(failure.getNodeName()).isEqualTo("boom");
                        assertThat(failure.getCause()).hasMessage("kaput");
                        assertThat(failure.getLastState().getValue("ok")).isEqualTo(true);
                    })
                    .verify();
            assertThat(attempts).hasValue(1);
        }

        @Test
        @DisplayName("should fail when a handler completes without a state")
        void emptyHandlerResult() {
            CompiledGraph graph = GraphBuilder.create("g")
                    .addNode("silent", (state, token) -> Mono.empty())
                    .setEntryPoint("silent")
                    .compile();

            StepVerifier.create(graph.invoke(AgentState.empty()))
                    .expectErrorSatisfies(error -> assertThat(((GraphException) error).getKind())
                            .isEqualTo(GraphFailureKind.NODE_HANDLER_FAILURE))
                    .verify();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        private CompiledGraph chain(CancellationToken token, AtomicInteger thirdRuns) {
            return GraphBuilder.create("chain")
                    .addNode("first", NodeHandler.of(state -> state))
                    .addNode("second", (state, t) -> {
                        token.cancel();
                        return Mono.just(state);
                    })
                    .addNode("third", NodeHandler.of(state -> {
                        thirdRuns.incrementAndGet();
                        return state;
                    }))
                    .addEdge("first", "second")
                    .addEdge("second", "third")
                    .setEntryPoint("first")
                    .compile();
        }

        @Test
        @DisplayName("should stop between nodes without a completion event")
        void streamStopsQuietly() {
            CancellationToken token = CancellationToken.create();
            AtomicInteger thirdRuns = new AtomicInteger();

            StepVerifier.create(chain(token, thirdRuns)
                            .stream(AgentState.empty(), GraphExecutionOptions.defaults(), token)
                            .map(GraphEvent::getType))
                    .expectNext(NODE_STARTED, NODE_COMPLETED, EDGE_TRAVERSED)
                    .expectNext(NODE_STARTED, NODE_COMPLETED, EDGE_TRAVERSED)
                    .verifyComplete();
            assertThat(thirdRuns).hasValue(0);
        }

        @Test
        @DisplayName("should fail invoke with a cancellation error")
        void invokeReportsCancellation() {
            CancellationToken token = CancellationToken.create();

            StepVerifier.create(chain(token, new AtomicInteger())
                            .invoke(AgentState.empty(), GraphExecutionOptions.defaults(), token))
                    .expectErrorSatisfies(error -> assertThat(((GraphException) error).getKind())
                            .isEqualTo(GraphFailureKind.CANCELLED))
                    .verify();
        }

        @Test
        @DisplayName("should not run anything when cancelled up front")
        void cancelledBeforeStart() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            StepVerifier.create(triage.stream(AgentState.empty(), GraphExecutionOptions.defaults(), token))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        private SimpleMeterRegistry registry;
        private GraphMetrics metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new GraphMetrics(registry);
        }

        @Test
        @DisplayName("should count completed runs and time each node")
        void completedRun() {
            StepVerifier.create(triage.withMetrics(metrics).invoke(AgentState.empty()))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(metrics.getRunsStarted().count()).isEqualTo(1.0);
            assertThat(metrics.getRunsCompleted().count()).isEqualTo(1.0);
            assertThat(metrics.getActiveRuns()).isZero();
            assertThat(registry.find("loom.graph.node.execution")
                    .tags("graph", "triage", "node", "classify", "outcome", "success")
                    .timer()
                    .count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should count failed runs")
        void failedRun() {
            CompiledGraph graph = loop(NodeHandler.of(state -> state)).withMetrics(metrics);

            StepVerifier.create(graph.invoke(AgentState.empty(), GraphExecutionOptions.builder().maxSteps(2).build()))
                    .expectError(GraphException.class)
                    .verify();

            assertThat(metrics.getRunsFailed().count()).isEqualTo(1.0);
            assertThat(metrics.getActiveRuns()).isZero();
        }

        @Test
        @DisplayName("should count runs abandoned by the subscriber as cancelled")
        void abandonedRun() {
            CompiledGraph graph = loop(NodeHandler.of(state -> state)).withMetrics(metrics);

            StepVerifier.create(graph.stream(AgentState.empty()).take(4))
                    .expectNextCount(4)
                    .verifyComplete();

            assertThat(metrics.getRunsCancelled().count()).isEqualTo(1.0);
            assertThat(metrics.getActiveRuns()).isZero();
        }
    }
}
