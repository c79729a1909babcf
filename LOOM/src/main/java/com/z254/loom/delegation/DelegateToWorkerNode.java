package com.z254.loom.delegation;

import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.graph.CancellationToken;
import com.z254.loom.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * Graph node that hands work to the worker pool and moves on without waiting.
 * <p>
 * The ids of the submitted tasks are appended to {@link DelegationStateKeys#PENDING_TASK_IDS};
 * a later {@link AggregateResultsNode} collects their results.
 */
@Slf4j
public class DelegateToWorkerNode implements GraphNode {

    private final String name;
    private final Supervisor supervisor;
    private final Function<AgentState, List<WorkerTask>> taskFactory;
    private final boolean dispatchImmediately;

    public DelegateToWorkerNode(String name, Supervisor supervisor,
                                Function<AgentState, List<WorkerTask>> taskFactory) {
        this(name, supervisor, taskFactory, true);
    }

    /**
     * @param dispatchImmediately assign the queued tasks right after submitting them; when false,
     *                            dispatching is left to whoever drives the supervisor
     */
    public DelegateToWorkerNode(String name, Supervisor supervisor,
                                Function<AgentState, List<WorkerTask>> taskFactory,
                                boolean dispatchImmediately) {
        this.name = name;
        this.supervisor = supervisor;
        this.taskFactory = taskFactory;
        this.dispatchImmediately = dispatchImmediately;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Mono<AgentState> execute(AgentState state, CancellationToken cancellation) {
        List<WorkerTask> tasks = taskFactory.apply(state);
        if (tasks == null || tasks.isEmpty()) {
            log.warn("Node {} produced no tasks to delegate", name);
            return Mono.just(state);
        }

        return supervisor.submitTasks(tasks)
                .flatMap(ids -> dispatch().thenReturn(ids))
                .map(ids -> {
                    List<String> pending = DelegationStateKeys.readIds(state, DelegationStateKeys.PENDING_TASK_IDS);
                    pending.addAll(ids);
                    log.info("Node {} delegated {} task(s)", name, ids.size());
                    return state.withValue(DelegationStateKeys.PENDING_TASK_IDS, pending);
                });
    }

    private Mono<Void> dispatch() {
        return dispatchImmediately ? supervisor.dispatchPending(null).then() : Mono.empty();
    }
}
