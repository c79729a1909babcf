package com.z254.loom.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.GraphEvent;
import com.z254.loom.domain.model.GraphEventType;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for GraphEventLogger.
 */
class GraphEventLoggerTest {

    private final GraphEventLogger eventLogger = new GraphEventLogger(new ObjectMapper());

    @Test
    void shouldDescribeEdgeEvents() {
        GraphEvent event = GraphEvent.builder()
                .executionId("exec-1")
                .graphName("triage")
                .nodeName("classify")
                .targetNode("respond")
                .type(GraphEventType.EDGE_TRAVERSED)
                .state(AgentState.empty().withValue("secret", "do-not-log"))
                .step(2)
                .build();

        Map<String, Object> data = eventLogger.describe(event);

        assertThat(data)
                .containsEntry("event", "edge_traversed")
                .containsEntry("executionId", "exec-1")
                .containsEntry("graph", "triage")
                .containsEntry("node", "classify")
                .containsEntry("target", "respond")
                .containsEntry("step", 2)
                .containsEntry("service", "loom")
                .containsKey("timestamp")
                .doesNotContainKeys("state", "durationMs", "error");
        assertThat(data.values()).doesNotContain("do-not-log");
    }

    @Test
    void shouldDescribeErrorEvents() {
        GraphEvent event = GraphEvent.builder()
                .executionId("exec-1")
                .graphName("triage")
                .nodeName("classify")
                .type(GraphEventType.ERROR)
                .duration(Duration.ofMillis(42))
                .error(new IllegalStateException("model unavailable"))
                .build();

        Map<String, Object> data = eventLogger.describe(event);

        assertThat(data)
                .containsEntry("event", "error")
                .containsEntry("durationMs", 42L)
                .containsEntry("error", "model unavailable");
    }

    @Test
    void shouldClearDiagnosticContextAfterLogging() {
        GraphEvent event = GraphEvent.builder()
                .executionId("exec-1")
                .graphName("triage")
                .nodeName("respond")
                .type(GraphEventType.GRAPH_COMPLETED)
                .build();

        assertThatCode(() -> eventLogger.log(event)).doesNotThrowAnyException();

        assertThat(MDC.get(GraphEventLogger.MDC_EXECUTION_ID)).isNull();
        assertThat(MDC.get(GraphEventLogger.MDC_GRAPH_NAME)).isNull();
        assertThat(MDC.get(GraphEventLogger.MDC_NODE_NAME)).isNull();
    }
}
