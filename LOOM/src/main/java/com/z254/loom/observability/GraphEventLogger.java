package com.z254.loom.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.loom.domain.model.GraphEvent;
import com.z254.loom.domain.model.GraphEventType;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging of graph events.
 * Writes one machine-parseable JSON line per event, with the run's identifiers in the MDC.
 */
@Slf4j
public class GraphEventLogger {

    public static final String MDC_EXECUTION_ID = "executionId";
    public static final String MDC_GRAPH_NAME = "graphName";
    public static final String MDC_NODE_NAME = "nodeName";

    private final ObjectMapper objectMapper;

    public GraphEventLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void log(GraphEvent event) {
        setContext(event);
        try {
            if (event.getType() == GraphEventType.ERROR) {
                log.warn(toJson(event));
            } else if (event.getType() == GraphEventType.GRAPH_COMPLETED) {
                log.info(toJson(event));
            } else if (log.isDebugEnabled()) {
                log.debug(toJson(event));
            }
        } finally {
            clearContext();
        }
    }

    /**
     * Render the event without its state payload.
     */
    Map<String, Object> describe(GraphEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", event.getType().name().toLowerCase());
        data.put("executionId", event.getExecutionId());
        data.put("graph", event.getGraphName());
        data.put("node", event.getNodeName());
        if (event.getTargetNode() != null) {
            data.put("target", event.getTargetNode());
        }
        data.put("step", event.getStep());
        if (event.getDuration() != null) {
            data.put("durationMs", event.getDuration().toMillis());
        }
        if (event.getError() != null) {
            data.put("error", event.getError().getMessage());
        }
        data.put("timestamp", event.getTimestamp() != null ? event.getTimestamp().toString() : null);
        data.put("service", "loom");
        return data;
    }

    private String toJson(GraphEvent event) {
        Map<String, Object> data = describe(event);
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            return "event=" + data.get("event") + " data=" + data;
        }
    }

    private void setContext(GraphEvent event) {
        if (event.getExecutionId() != null) MDC.put(MDC_EXECUTION_ID, event.getExecutionId());
        if (event.getGraphName() != null) MDC.put(MDC_GRAPH_NAME, event.getGraphName());
        if (event.getNodeName() != null) MDC.put(MDC_NODE_NAME, event.getNodeName());
    }

    private void clearContext() {
        MDC.remove(MDC_EXECUTION_ID);
        MDC.remove(MDC_GRAPH_NAME);
        MDC.remove(MDC_NODE_NAME);
    }
}
