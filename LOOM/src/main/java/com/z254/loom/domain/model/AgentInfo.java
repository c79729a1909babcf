package com.z254.loom.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Advertised state of a worker agent.
 * <p>
 * The current task count is kept in an {@link AtomicInteger} so concurrent assignments and
 * completions never lose updates; it never drops below zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentInfo {

    private String agentId;

    /**
     * Kind of worker, e.g. "researcher" or "coder".
     */
    private String agentType;

    @Builder.Default
    private AgentCapabilities capabilities = new AgentCapabilities();

    @Builder.Default
    private AgentStatus status = AgentStatus.AVAILABLE;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private AtomicInteger taskCounter = new AtomicInteger();

    private Instant lastHeartbeat;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public int getCurrentTaskCount() {
        return taskCounter.get();
    }

    public void setCurrentTaskCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Task count must not be negative: " + count);
        }
        taskCounter.set(count);
    }

    public int incrementTaskCount() {
        return taskCounter.incrementAndGet();
    }

    public int decrementTaskCount() {
        return taskCounter.updateAndGet(count -> Math.max(0, count - 1));
    }

    public int getMaxConcurrentTasks() {
        return capabilities != null ? capabilities.getMaxConcurrentTasks() : 0;
    }

    public boolean hasSpareCapacity() {
        return getCurrentTaskCount() < getMaxConcurrentTasks();
    }

    /**
     * Current load relative to capacity; workers without capacity count as saturated.
     */
    public double getLoadRatio() {
        int max = getMaxConcurrentTasks();
        if (max <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return (double) getCurrentTaskCount() / max;
    }

    public boolean supports(String capability) {
        return capabilities != null && capabilities.supports(capability);
    }

    public boolean isOnline() {
        return status != AgentStatus.OFFLINE;
    }

    public static class AgentInfoBuilder {
        public AgentInfoBuilder currentTaskCount(int count) {
            return taskCounter(new AtomicInteger(count));
        }
    }
}
