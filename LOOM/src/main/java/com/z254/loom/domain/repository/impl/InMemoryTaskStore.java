package com.z254.loom.domain.repository.impl;

import com.z254.loom.domain.model.TaskStatus;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.domain.model.WorkerTaskResult;
import com.z254.loom.domain.repository.TaskStore;
import com.z254.loom.domain.repository.TaskStoreException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of TaskStore for development and testing.
 * <p>
 * Task, status and result of one id live in a single map entry replaced through
 * {@link ConcurrentHashMap#compute}, so a result and its status are never observed apart and
 * concurrent writes to the same id resolve last-write-wins.
 */
@Slf4j
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, TaskRecord> records = new ConcurrentHashMap<>();

    @Override
    public Mono<WorkerTask> save(WorkerTask task) {
        if (task == null) {
            throw new TaskStoreException("Task must not be null");
        }
        return Mono.fromCallable(() -> {
            if (task.getTaskId() == null) {
                task.setTaskId(UUID.randomUUID().toString());
            }
            if (task.getCreatedAt() == null) {
                task.setCreatedAt(Instant.now());
            }
            records.compute(task.getTaskId(), (id, existing) -> existing == null
                    ? new TaskRecord(task, TaskStatus.PENDING, null, Instant.now())
                    : new TaskRecord(task, existing.status(), existing.result(), Instant.now()));
            return task;
        });
    }

    @Override
    public Mono<WorkerTask> get(String taskId) {
        return Mono.fromSupplier(() -> find(taskId))
                .filter(record -> record.task() != null)
                .map(TaskRecord::task);
    }

    @Override
    public Mono<Void> saveResult(WorkerTaskResult result) {
        if (result == null) {
            throw new TaskStoreException("Result must not be null");
        }
        if (result.getTaskId() == null) {
            throw new TaskStoreException("Result task id must not be null");
        }
        return Mono.fromRunnable(() -> {
            records.compute(result.getTaskId(), (id, existing) -> new TaskRecord(
                    existing != null ? existing.task() : null, result.toStatus(), result, Instant.now()));
            log.debug("Stored result for task {} (success={})", result.getTaskId(), result.isSuccess());
        });
    }

    @Override
    public Mono<WorkerTaskResult> getResult(String taskId) {
        return Mono.fromSupplier(() -> find(taskId))
                .filter(record -> record.result() != null)
                .map(TaskRecord::result);
    }

    @Override
    public Mono<TaskStatus> getStatus(String taskId) {
        return Mono.fromSupplier(() -> find(taskId))
                .map(TaskRecord::status);
    }

    @Override
    public Mono<Boolean> updateStatus(String taskId, TaskStatus status) {
        if (taskId == null || status == null) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> {
            AtomicBoolean applied = new AtomicBoolean();
            records.computeIfPresent(taskId, (id, existing) -> {
                if (existing.status().isTerminal()) {
                    return existing;
                }
                applied.set(true);
                return new TaskRecord(existing.task(), status, existing.result(), Instant.now());
            });
            if (!applied.get()) {
                log.debug("Ignored status change of task {} to {}", taskId, status);
            }
            return applied.get();
        });
    }

    @Override
    public Flux<WorkerTask> findByStatus(TaskStatus status) {
        return Flux.fromIterable(records.values())
                .filter(record -> record.status() == status && record.task() != null)
                .map(TaskRecord::task);
    }

    @Override
    public Mono<Void> delete(String taskId) {
        if (taskId != null) {
            records.remove(taskId);
        }
        return Mono.empty();
    }

    private TaskRecord find(String taskId) {
        return taskId != null ? records.get(taskId) : null;
    }

    private record TaskRecord(WorkerTask task, TaskStatus status, WorkerTaskResult result, Instant updatedAt) {
    }
}
