package com.z254.loom.delegation;

import com.z254.loom.domain.model.LoadBalancingStrategy;
import com.z254.loom.domain.model.SupervisorStatistics;
import com.z254.loom.domain.model.TaskAssignment;
import com.z254.loom.domain.model.TaskStatus;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.domain.model.WorkerTaskResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Entry point of the delegation subsystem.
 * <p>
 * Submission only persists and queues work: it never waits for a worker to finish. Assignment
 * happens when {@link #dispatchPending} runs, and results arrive through {@link #reportResult}.
 */
public interface Supervisor {

    /**
     * Persist tasks as PENDING and queue them for dispatch.
     *
     * @return the task ids, in submission order
     */
    Mono<List<String>> submitTasks(List<WorkerTask> tasks);

    /**
     * Persist a single task as PENDING and queue it for dispatch.
     */
    Mono<String> submitTask(WorkerTask task);

    /**
     * Assign queued tasks to workers until the queue is empty or no worker is online.
     *
     * @param strategy selection policy, or null for the configured default
     * @return the assignments made, in dispatch order
     */
    Flux<TaskAssignment> dispatchPending(LoadBalancingStrategy strategy);

    /**
     * Assignments for one worker, including those made before subscribing.
     */
    Flux<TaskAssignment> assignments(String agentId);

    /**
     * Record a worker's result and free its slot.
     */
    Mono<Void> reportResult(WorkerTaskResult result);

    Mono<TaskStatus> getTaskStatus(String taskId);

    Mono<WorkerTaskResult> getTaskResult(String taskId);

    /**
     * Withdraw a task.
     *
     * @return false when the task is unknown or already finished
     */
    Mono<Boolean> cancelTask(String taskId);

    SupervisorStatistics getStatistics();
}
