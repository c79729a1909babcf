package com.z254.loom.delegation;

import com.z254.loom.domain.model.WorkerTask;

import java.time.Instant;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue of tasks waiting for a worker, ordered by priority (highest first), then by enqueue order.
 */
public class TaskQueue {

    private static final Comparator<QueuedTask> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedTask queued) -> queued.task().getPriority()).reversed()
            .thenComparingLong(QueuedTask::sequence);

    private final PriorityQueue<QueuedTask> queue = new PriorityQueue<>(DISPATCH_ORDER);
    private final AtomicLong sequence = new AtomicLong();

    public synchronized void enqueue(WorkerTask task) {
        queue.add(new QueuedTask(task, sequence.getAndIncrement(), Instant.now()));
    }

    /**
     * Take the next task, or null when the queue is empty.
     */
    public synchronized QueuedTask poll() {
        return queue.poll();
    }

    /**
     * Put a polled task back at its original position.
     */
    public synchronized void requeue(QueuedTask queued) {
        queue.add(queued);
    }

    public synchronized boolean remove(String taskId) {
        return queue.removeIf(queued -> taskId.equals(queued.task().getTaskId()));
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public record QueuedTask(WorkerTask task, long sequence, Instant enqueuedAt) {
    }
}
