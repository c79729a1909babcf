package com.z254.loom.domain.repository;

import com.z254.loom.domain.model.TaskStatus;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.domain.model.WorkerTaskResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository interface for delegated tasks, their status and their results.
 * <p>
 * Lookups of unknown ids complete empty. Null arguments to {@link #save} and {@link #saveResult}
 * raise {@link TaskStoreException} immediately.
 */
public interface TaskStore {

    /**
     * Save a task. New tasks become PENDING; saving an existing id replaces the task and keeps its status.
     */
    Mono<WorkerTask> save(WorkerTask task);

    /**
     * Find a task by ID.
     */
    Mono<WorkerTask> get(String taskId);

    /**
     * Store a result and set the task status to COMPLETED or FAILED in the same update.
     */
    Mono<Void> saveResult(WorkerTaskResult result);

    /**
     * Find the result of a task.
     */
    Mono<WorkerTaskResult> getResult(String taskId);

    /**
     * Find the status of a task.
     */
    Mono<TaskStatus> getStatus(String taskId);

    /**
     * Move a task to a new status. Emits false when the task is unknown or already terminal.
     */
    Mono<Boolean> updateStatus(String taskId, TaskStatus status);

    /**
     * Find tasks by status.
     */
    Flux<WorkerTask> findByStatus(TaskStatus status);

    /**
     * Delete a task and its result.
     */
    Mono<Void> delete(String taskId);
}
