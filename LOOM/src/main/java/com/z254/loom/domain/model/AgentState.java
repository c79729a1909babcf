package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload threaded through the nodes of a graph run.
 * <p>
 * Node handlers receive the current state and return a complete replacement; the engine never
 * merges. The {@code with*} helpers return copies so handlers can carry fields forward without
 * touching the instance they were given. {@code currentNode} and {@code stepCount} are stamped by
 * the engine after every node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentState {

    /**
     * Ordered message history.
     */
    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /**
     * Open key/value payload. Values must be JSON-compatible when checkpointing is enabled.
     */
    @Builder.Default
    private Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Name of the node that produced this state.
     */
    private String currentNode;

    /**
     * Number of nodes executed so far in the run.
     */
    private int stepCount;

    public static AgentState empty() {
        return new AgentState();
    }

    public static AgentState of(Map<String, Object> values) {
        return AgentState.builder().values(new LinkedHashMap<>(values)).build();
    }

    /**
     * Copy with fresh message and value containers; the contained values themselves are shared.
     */
    public AgentState copy() {
        return AgentState.builder()
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .values(values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>())
                .currentNode(currentNode)
                .stepCount(stepCount)
                .build();
    }

    public AgentState withValue(String key, Object value) {
        AgentState copy = copy();
        copy.values.put(key, value);
        return copy;
    }

    public AgentState withoutValue(String key) {
        AgentState copy = copy();
        copy.values.remove(key);
        return copy;
    }

    public AgentState withMessage(Message message) {
        AgentState copy = copy();
        copy.messages.add(message);
        return copy;
    }

    public Object getValue(String key) {
        return values != null ? values.get(key) : null;
    }

    /**
     * Typed lookup; returns null when absent and fails with ClassCastException on a type mismatch.
     */
    public <T> T getValue(String key, Class<T> type) {
        Object value = getValue(key);
        return value != null ? type.cast(value) : null;
    }

    public boolean hasValue(String key) {
        return values != null && values.containsKey(key);
    }

    public Message lastMessage() {
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        return messages.get(messages.size() - 1);
    }
}
