package com.z254.loom.delegation;

import com.z254.loom.domain.model.AgentInfo;
import com.z254.loom.domain.model.LoadBalancingStrategy;
import com.z254.loom.domain.model.SupervisorStatistics;
import com.z254.loom.domain.model.TaskAssignment;
import com.z254.loom.domain.model.TaskStatus;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.domain.model.WorkerTaskResult;
import com.z254.loom.domain.repository.TaskStore;
import com.z254.loom.observability.GraphMetrics;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Default supervisor backed by a {@link TaskStore}, a {@link TaskQueue} and a {@link WorkerPool}.
 * <p>
 * Assignments are pushed to per-worker sinks that buffer without bound until the worker subscribes
 * and stay open when a subscriber leaves, so a worker can reconnect. An assignment that cannot be
 * published is rolled back: the worker slot is released and the task returns to the queue as
 * PENDING.
 */
@Slf4j
public class SupervisorImpl implements Supervisor {

    private final TaskStore taskStore;
    private final TaskQueue taskQueue;
    private final WorkerPool workerPool;
    private final LoadBalancingStrategy defaultStrategy;
    private final GraphMetrics metrics;

    private final Map<String, Sinks.Many<TaskAssignment>> workerSinks = new ConcurrentHashMap<>();

    // taskId -> agentId of tasks assigned and not yet reported
    private final Map<String, String> assignedWorkers = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong reportedResults = new AtomicLong();
    private final AtomicLong totalExecutionNanos = new AtomicLong();
    private final Map<String, AtomicLong> tasksByType = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> tasksByAgent = new ConcurrentHashMap<>();

    public SupervisorImpl(TaskStore taskStore, TaskQueue taskQueue, WorkerPool workerPool) {
        this(taskStore, taskQueue, workerPool, LoadBalancingStrategy.PRIORITY_BASED, null);
    }

    public SupervisorImpl(TaskStore taskStore,
                          TaskQueue taskQueue,
                          WorkerPool workerPool,
                          LoadBalancingStrategy defaultStrategy,
                          GraphMetrics metrics) {
        this.taskStore = taskStore;
        this.taskQueue = taskQueue;
        this.workerPool = workerPool;
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : LoadBalancingStrategy.PRIORITY_BASED;
        this.metrics = metrics;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    @Override
    public Mono<List<String>> submitTasks(List<WorkerTask> tasks) {
        if (tasks == null) {
            return Mono.error(new IllegalArgumentException("Tasks must not be null"));
        }
        return Flux.fromIterable(tasks)
                .concatMap(this::persist)
                .collectList()
                .doOnNext(ids -> {
                    if (metrics != null) {
                        metrics.recordTasksSubmitted(ids.size());
                    }
                    log.info("Submitted {} task(s): {}", ids.size(), ids);
                });
    }

    @Override
    public Mono<String> submitTask(WorkerTask task) {
        return submitTasks(List.of(task))
                .map(ids -> ids.get(0));
    }

    private Mono<String> persist(WorkerTask task) {
        if (task.getTaskId() == null) {
            task.setTaskId(UUID.randomUUID().toString());
        }
        return taskStore.save(task)
                .map(saved -> {
                    taskQueue.enqueue(saved);
                    submitted.incrementAndGet();
                    tasksByType.computeIfAbsent(typeOf(saved), key -> new AtomicLong()).incrementAndGet();
                    return saved.getTaskId();
                });
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    @Override
    public Flux<TaskAssignment> dispatchPending(LoadBalancingStrategy strategy) {
        LoadBalancingStrategy effective = strategy != null ? strategy : defaultStrategy;
        return Flux.defer(() -> {
            AtomicBoolean drained = new AtomicBoolean();
            List<TaskQueue.QueuedTask> held = new ArrayList<>();
            return Mono.defer(() -> dispatchNext(effective, drained, held))
                    .repeat(() -> !drained.get())
                    .doFinally(signal -> held.forEach(taskQueue::requeue));
        });
    }

    private Mono<TaskAssignment> dispatchNext(LoadBalancingStrategy strategy, AtomicBoolean drained,
                                              List<TaskQueue.QueuedTask> held) {
        TaskQueue.QueuedTask queued = taskQueue.poll();
        if (queued == null) {
            drained.set(true);
            return Mono.empty();
        }
        WorkerTask task = queued.task();

        return taskStore.getStatus(task.getTaskId())
                .defaultIfEmpty(TaskStatus.PENDING)
                .flatMap(status -> {
                    if (status.isTerminal()) {
                        log.debug("Dropping task {} from the queue, it is {}", task.getTaskId(), status);
                        return Mono.empty();
                    }
                    if (status != TaskStatus.PENDING) {
                        held.add(queued);
                        return Mono.empty();
                    }
                    AgentInfo worker = workerPool.acquire(task, strategy);
                    if (worker == null) {
                        taskQueue.requeue(queued);
                        drained.set(true);
                        log.info("No worker available for task {}, {} task(s) left queued",
                                task.getTaskId(), taskQueue.size());
                        return Mono.empty();
                    }
                    return taskStore.updateStatus(task.getTaskId(), TaskStatus.IN_PROGRESS)
                            .flatMap(applied -> {
                                if (!applied) {
                                    workerPool.release(worker.getAgentId());
                                    return Mono.empty();
                                }
                                return assign(queued, worker, strategy, drained);
                            });
                });
    }

    private Mono<TaskAssignment> assign(TaskQueue.QueuedTask queued, AgentInfo worker,
                                        LoadBalancingStrategy strategy, AtomicBoolean drained) {
        WorkerTask task = queued.task();
        TaskAssignment assignment = TaskAssignment.builder()
                .task(task)
                .agentId(worker.getAgentId())
                .strategy(strategy)
                .assignedAt(Instant.now())
                .build();
        // Registered before publishing so a fast worker can report against it.
        assignedWorkers.put(task.getTaskId(), worker.getAgentId());

        Sinks.Many<TaskAssignment> sink = sinkFor(worker.getAgentId());
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(assignment);
        }
        if (result.isFailure()) {
            log.warn("Failed to publish assignment of task {} to worker {}: {}, returning it to the queue",
                    task.getTaskId(), worker.getAgentId(), result);
            assignedWorkers.remove(task.getTaskId());
            workerPool.release(worker.getAgentId());
            drained.set(true);
            return taskStore.updateStatus(task.getTaskId(), TaskStatus.PENDING)
                    .doOnNext(reverted -> {
                        if (reverted) {
                            taskQueue.requeue(queued);
                        }
                    })
                    .then(Mono.empty());
        }

        tasksByAgent.computeIfAbsent(worker.getAgentId(), key -> new AtomicLong()).incrementAndGet();
        log.info("Assigned task {} ({}) to worker {} using {}",
                task.getTaskId(), typeOf(task), worker.getAgentId(), strategy);
        return Mono.just(assignment);
    }

    @Override
    public Flux<TaskAssignment> assignments(String agentId) {
        return sinkFor(agentId).asFlux()
                .doOnSubscribe(s -> log.debug("Worker {} subscribed to assignments", agentId))
                .doOnCancel(() -> log.debug("Worker {} unsubscribed from assignments", agentId));
    }

    private Sinks.Many<TaskAssignment> sinkFor(String agentId) {
        return workerSinks.computeIfAbsent(agentId,
                key -> Sinks.many().multicast().onBackpressureBuffer(Integer.MAX_VALUE, false));
    }

    // ------------------------------------------------------------------
    // Results and lifecycle
    // ------------------------------------------------------------------

    @Override
    public Mono<Void> reportResult(WorkerTaskResult result) {
        if (result == null) {
            return Mono.error(new IllegalArgumentException("Result must not be null"));
        }
        return taskStore.saveResult(result)
                .doOnSuccess(ignored -> {
                    String agentId = assignedWorkers.remove(result.getTaskId());
                    if (agentId != null) {
                        workerPool.release(agentId);
                    }
                    if (result.isSuccess()) {
                        completed.incrementAndGet();
                    } else {
                        failed.incrementAndGet();
                    }
                    if (result.getExecutionTime() != null) {
                        reportedResults.incrementAndGet();
                        totalExecutionNanos.addAndGet(result.getExecutionTime().toNanos());
                    }
                    if (metrics != null) {
                        metrics.recordTaskResult(result.isSuccess());
                    }
                    log.info("Task {} {} by worker {}", result.getTaskId(),
                            result.isSuccess() ? "completed" : "failed", result.getWorkerAgentId());
                });
    }

    @Override
    public Mono<TaskStatus> getTaskStatus(String taskId) {
        return taskStore.getStatus(taskId);
    }

    @Override
    public Mono<WorkerTaskResult> getTaskResult(String taskId) {
        return taskStore.getResult(taskId);
    }

    @Override
    public Mono<Boolean> cancelTask(String taskId) {
        return taskStore.getStatus(taskId)
                .flatMap(status -> {
                    if (status.isTerminal()) {
                        return Mono.just(false);
                    }
                    return taskStore.updateStatus(taskId, TaskStatus.CANCELLED)
                            .doOnNext(applied -> {
                                if (applied) {
                                    taskQueue.remove(taskId);
                                    String agentId = assignedWorkers.remove(taskId);
                                    if (agentId != null) {
                                        workerPool.release(agentId);
                                    }
                                    cancelled.incrementAndGet();
                                    log.info("Cancelled task {}", taskId);
                                }
                            });
                })
                .defaultIfEmpty(false);
    }

    @Override
    public SupervisorStatistics getStatistics() {
        long reported = reportedResults.get();
        Duration average = reported > 0
                ? Duration.ofNanos(totalExecutionNanos.get() / reported)
                : Duration.ZERO;
        return SupervisorStatistics.builder()
                .totalSubmitted(submitted.get())
                .completed(completed.get())
                .failed(failed.get())
                .cancelled(cancelled.get())
                .pending(taskQueue.size())
                .inProgress(assignedWorkers.size())
                .averageExecutionTime(average)
                .tasksByType(snapshot(tasksByType))
                .tasksByAgent(snapshot(tasksByAgent))
                .build();
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private static String typeOf(WorkerTask task) {
        return task.getTaskType() != null ? task.getTaskType() : "unspecified";
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
        return counters.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
