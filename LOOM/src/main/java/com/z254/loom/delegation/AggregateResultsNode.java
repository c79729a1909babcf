package com.z254.loom.delegation;

import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.TaskStatus;
import com.z254.loom.domain.model.WorkerTaskResult;
import com.z254.loom.graph.CancellationToken;
import com.z254.loom.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Graph node that collects the results of previously delegated tasks.
 * <p>
 * When waiting is enabled the node polls the supervisor until every pending task has finished,
 * the run is cancelled, or the maximum wait elapses; it then proceeds with whatever finished.
 * Finished ids move from {@link DelegationStateKeys#PENDING_TASK_IDS} to the completed or failed
 * list, and the collected results are handed to the aggregator.
 */
@Slf4j
public class AggregateResultsNode implements GraphNode {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofMinutes(5);

    private final String name;
    private final Supervisor supervisor;
    private final BiFunction<AgentState, Map<String, WorkerTaskResult>, AgentState> aggregator;
    private final boolean waitForAll;
    private final Duration pollInterval;
    private final Duration maxWait;

    public AggregateResultsNode(String name, Supervisor supervisor,
                                BiFunction<AgentState, Map<String, WorkerTaskResult>, AgentState> aggregator) {
        this(name, supervisor, aggregator, true, DEFAULT_POLL_INTERVAL, DEFAULT_MAX_WAIT);
    }

    public AggregateResultsNode(String name, Supervisor supervisor,
                                BiFunction<AgentState, Map<String, WorkerTaskResult>, AgentState> aggregator,
                                boolean waitForAll, Duration pollInterval, Duration maxWait) {
        this.name = name;
        this.supervisor = supervisor;
        this.aggregator = aggregator;
        this.waitForAll = waitForAll;
        this.pollInterval = pollInterval;
        this.maxWait = maxWait;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Mono<AgentState> execute(AgentState state, CancellationToken cancellation) {
        List<String> pendingIds = DelegationStateKeys.readIds(state, DelegationStateKeys.PENDING_TASK_IDS);
        if (pendingIds.isEmpty()) {
            return Mono.fromCallable(() -> aggregator.apply(state, Map.of()));
        }

        Mono<Progress> progress = poll(pendingIds);
        if (waitForAll) {
            progress = progress
                    .filter(current -> current.isComplete(pendingIds) || cancellation.isCancellationRequested())
                    .repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval))
                    .timeout(maxWait, Mono.defer(() -> poll(pendingIds)));
        }

        return progress.map(current -> {
            log.info("Node {} collected {} of {} delegated task(s)",
                    name, current.finished().size(), pendingIds.size());
            return aggregator.apply(apply(state, pendingIds, current), current.results());
        });
    }

    private Mono<Progress> poll(List<String> taskIds) {
        return Flux.fromIterable(taskIds)
                .concatMap(taskId -> supervisor.getTaskStatus(taskId)
                        .filter(TaskStatus::isTerminal)
                        .flatMap(status -> supervisor.getTaskResult(taskId)
                                .map(result -> new Outcome(taskId, result))
                                .defaultIfEmpty(new Outcome(taskId, null))))
                .collectList()
                .map(Progress::of);
    }

    private AgentState apply(AgentState state, List<String> pendingIds, Progress progress) {
        List<String> remaining = new ArrayList<>();
        List<String> completed = DelegationStateKeys.readIds(state, DelegationStateKeys.COMPLETED_TASK_IDS);
        List<String> failed = DelegationStateKeys.readIds(state, DelegationStateKeys.FAILED_TASK_IDS);

        for (String taskId : pendingIds) {
            if (!progress.finished().contains(taskId)) {
                remaining.add(taskId);
                continue;
            }
            WorkerTaskResult result = progress.results().get(taskId);
            if (result != null && result.isSuccess()) {
                completed.add(taskId);
            } else {
                failed.add(taskId);
            }
        }

        AgentState next = state.copy();
        next.getValues().put(DelegationStateKeys.PENDING_TASK_IDS, remaining);
        next.getValues().put(DelegationStateKeys.COMPLETED_TASK_IDS, completed);
        next.getValues().put(DelegationStateKeys.FAILED_TASK_IDS, failed);
        return next;
    }

    private record Outcome(String taskId, WorkerTaskResult result) {
    }

    private record Progress(Set<String> finished, Map<String, WorkerTaskResult> results) {

        static Progress of(List<Outcome> outcomes) {
            Set<String> finished = new LinkedHashSet<>();
            Map<String, WorkerTaskResult> results = new LinkedHashMap<>();
            for (Outcome outcome : outcomes) {
                finished.add(outcome.taskId());
                if (outcome.result() != null) {
                    results.put(outcome.taskId(), outcome.result());
                }
            }
            return new Progress(finished, results);
        }

        boolean isComplete(List<String> taskIds) {
            return finished.containsAll(taskIds);
        }
    }
}
