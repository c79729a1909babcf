package com.z254.loom.observability;

import com.z254.loom.domain.model.LoadBalancingStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for LOOM.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Graph runs (started, completed, failed, cancelled, active)</li>
 *     <li>Node executions (duration by graph, node and outcome)</li>
 *     <li>Delegated tasks (submitted, completed, failed)</li>
 *     <li>Worker selection (by strategy, no worker available)</li>
 * </ul>
 * Meters are shared by every instance bound to the same registry, the active-runs gauge included.
 */
public class GraphMetrics {

    // Gauge backing value per registry; the registry only keeps the first one it was given.
    private static final Map<MeterRegistry, AtomicInteger> ACTIVE_RUNS =
            Collections.synchronizedMap(new WeakHashMap<>());

    private final MeterRegistry meterRegistry;

    // Run metrics
    @Getter
    private final Counter runsStarted;
    @Getter
    private final Counter runsCompleted;
    @Getter
    private final Counter runsFailed;
    @Getter
    private final Counter runsCancelled;
    private final AtomicInteger activeRuns;

    // Delegation metrics
    @Getter
    private final Counter tasksSubmitted;
    @Getter
    private final Counter tasksCompleted;
    @Getter
    private final Counter tasksFailed;
    @Getter
    private final Counter workerUnavailable;
    private final Map<LoadBalancingStrategy, Counter> selectionsByStrategy = new ConcurrentHashMap<>();

    public GraphMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsStarted = Counter.builder("loom.graph.runs.started")
                .description("Graph runs started")
                .register(meterRegistry);
        this.runsCompleted = Counter.builder("loom.graph.runs.completed")
                .description("Graph runs completed successfully")
                .register(meterRegistry);
        this.runsFailed = Counter.builder("loom.graph.runs.failed")
                .description("Graph runs failed")
                .register(meterRegistry);
        this.runsCancelled = Counter.builder("loom.graph.runs.cancelled")
                .description("Graph runs cancelled")
                .register(meterRegistry);
        this.activeRuns = ACTIVE_RUNS.computeIfAbsent(meterRegistry,
                registry -> registry.gauge("loom.graph.runs.active", new AtomicInteger(0)));

        this.tasksSubmitted = Counter.builder("loom.delegation.tasks.submitted")
                .description("Worker tasks submitted")
                .register(meterRegistry);
        this.tasksCompleted = Counter.builder("loom.delegation.tasks.completed")
                .description("Worker tasks completed successfully")
                .register(meterRegistry);
        this.tasksFailed = Counter.builder("loom.delegation.tasks.failed")
                .description("Worker tasks failed")
                .register(meterRegistry);
        this.workerUnavailable = Counter.builder("loom.delegation.worker.unavailable")
                .description("Dispatch attempts that found no worker")
                .register(meterRegistry);
    }

    // ========== Run Methods ==========

    public void recordRunStarted() {
        runsStarted.increment();
        activeRuns.incrementAndGet();
    }

    public void recordRunCompleted() {
        runsCompleted.increment();
        activeRuns.decrementAndGet();
    }

    public void recordRunFailed() {
        runsFailed.increment();
        activeRuns.decrementAndGet();
    }

    public void recordRunCancelled() {
        runsCancelled.increment();
        activeRuns.decrementAndGet();
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }

    public void recordNodeExecution(String graphName, String nodeName, Duration duration, boolean success) {
        Timer.builder("loom.graph.node.execution")
                .description("Node handler execution time")
                .tag("graph", graphName)
                .tag("node", nodeName)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .record(duration);
    }

    // ========== Delegation Methods ==========

    public void recordTasksSubmitted(int count) {
        tasksSubmitted.increment(count);
    }

    public void recordTaskResult(boolean success) {
        if (success) {
            tasksCompleted.increment();
        } else {
            tasksFailed.increment();
        }
    }

    public void recordWorkerSelected(LoadBalancingStrategy strategy) {
        selectionsByStrategy.computeIfAbsent(strategy, key ->
                Counter.builder("loom.delegation.worker.selections")
                        .tag("strategy", key.name())
                        .description("Workers selected by load-balancing strategy")
                        .register(meterRegistry))
                .increment();
    }

    public void recordWorkerUnavailable() {
        workerUnavailable.increment();
    }
}
