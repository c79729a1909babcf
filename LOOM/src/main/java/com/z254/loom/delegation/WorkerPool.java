package com.z254.loom.delegation;

import com.z254.loom.delegation.loadbalancing.LoadBalancer;
import com.z254.loom.domain.model.AgentInfo;
import com.z254.loom.domain.model.AgentStatus;
import com.z254.loom.domain.model.LoadBalancingStrategy;
import com.z254.loom.domain.model.WorkerTask;
import com.z254.loom.observability.GraphMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of worker agents and their load.
 * <p>
 * Workers keep their registration order, which is the order the load balancer sees them in.
 * Selection and the matching load increment happen under one lock, so two concurrent
 * assignments cannot both claim a worker's last free slot.
 */
@Slf4j
public class WorkerPool {

    private final Map<String, AgentInfo> workers = new LinkedHashMap<>();
    private final LoadBalancer loadBalancer;
    private final LoadBalancingStrategy defaultStrategy;
    private final GraphMetrics metrics;

    public WorkerPool(LoadBalancer loadBalancer) {
        this(loadBalancer, LoadBalancingStrategy.PRIORITY_BASED, null);
    }

    public WorkerPool(LoadBalancer loadBalancer, LoadBalancingStrategy defaultStrategy, GraphMetrics metrics) {
        this.loadBalancer = loadBalancer;
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : LoadBalancingStrategy.PRIORITY_BASED;
        this.metrics = metrics;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    public synchronized void register(AgentInfo worker) {
        if (worker == null || worker.getAgentId() == null) {
            throw new IllegalArgumentException("Worker and its agent id must not be null");
        }
        if (worker.getLastHeartbeat() == null) {
            worker.setLastHeartbeat(Instant.now());
        }
        workers.put(worker.getAgentId(), worker);
        log.info("Registered worker {} ({}) with capacity {}",
                worker.getAgentId(), worker.getAgentType(), worker.getMaxConcurrentTasks());
    }

    public synchronized boolean deregister(String agentId) {
        boolean removed = workers.remove(agentId) != null;
        if (removed) {
            log.info("Deregistered worker {}", agentId);
        }
        return removed;
    }

    public synchronized Optional<AgentInfo> getWorker(String agentId) {
        return Optional.ofNullable(workers.get(agentId));
    }

    public synchronized List<AgentInfo> getWorkers() {
        return List.copyOf(workers.values());
    }

    /**
     * Workers that may receive tasks, in registration order.
     */
    public synchronized List<AgentInfo> getOnlineWorkers() {
        List<AgentInfo> online = new ArrayList<>();
        for (AgentInfo worker : workers.values()) {
            if (worker.isOnline()) {
                online.add(worker);
            }
        }
        return online;
    }

    public synchronized void setStatus(String agentId, AgentStatus status) {
        AgentInfo worker = workers.get(agentId);
        if (worker != null) {
            worker.setStatus(status);
            log.info("Worker {} is now {}", agentId, status);
        }
    }

    public synchronized void heartbeat(String agentId) {
        AgentInfo worker = workers.get(agentId);
        if (worker != null) {
            worker.setLastHeartbeat(Instant.now());
        }
    }

    public synchronized int size() {
        return workers.size();
    }

    // ------------------------------------------------------------------
    // Assignment
    // ------------------------------------------------------------------

    /**
     * Choose a worker for the task and count the task against it.
     * <p>
     * An online preferred worker with spare capacity wins; otherwise the load balancer decides.
     *
     * @return the worker, or null when no worker is online
     */
    public synchronized AgentInfo acquire(WorkerTask task, LoadBalancingStrategy strategy) {
        LoadBalancingStrategy effective = strategy != null ? strategy : defaultStrategy;
        List<AgentInfo> candidates = getOnlineWorkers();

        AgentInfo selected = preferredWorker(task, candidates);
        if (selected == null) {
            selected = loadBalancer.selectWorker(candidates, task, effective);
        }
        if (selected == null) {
            log.debug("No online worker for task {}", task != null ? task.getTaskId() : null);
            if (metrics != null) {
                metrics.recordWorkerUnavailable();
            }
            return null;
        }

        int load = selected.incrementTaskCount();
        refreshStatus(selected);
        if (metrics != null) {
            metrics.recordWorkerSelected(effective);
        }
        log.debug("Worker {} acquired for task {} (load {}/{})", selected.getAgentId(),
                task != null ? task.getTaskId() : null, load, selected.getMaxConcurrentTasks());
        return selected;
    }

    /**
     * Give back one task slot of a worker.
     */
    public synchronized void release(String agentId) {
        AgentInfo worker = workers.get(agentId);
        if (worker == null) {
            log.debug("Release for unknown worker {} ignored", agentId);
            return;
        }
        worker.decrementTaskCount();
        refreshStatus(worker);
    }

    public synchronized Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        int online = 0;
        int busy = 0;
        int load = 0;
        int capacity = 0;
        for (AgentInfo worker : workers.values()) {
            if (worker.isOnline()) {
                online++;
            }
            if (worker.getStatus() == AgentStatus.BUSY) {
                busy++;
            }
            load += worker.getCurrentTaskCount();
            capacity += worker.getMaxConcurrentTasks();
        }
        stats.put("totalWorkers", workers.size());
        stats.put("onlineWorkers", online);
        stats.put("busyWorkers", busy);
        stats.put("currentLoad", load);
        stats.put("totalCapacity", capacity);
        return stats;
    }

    private AgentInfo preferredWorker(WorkerTask task, List<AgentInfo> candidates) {
        if (task == null || task.getPreferredAgentId() == null) {
            return null;
        }
        return candidates.stream()
                .filter(worker -> task.getPreferredAgentId().equals(worker.getAgentId()))
                .filter(AgentInfo::hasSpareCapacity)
                .findFirst()
                .orElse(null);
    }

    private void refreshStatus(AgentInfo worker) {
        if (worker.getStatus() == AgentStatus.OFFLINE) {
            return;
        }
        worker.setStatus(worker.hasSpareCapacity() ? AgentStatus.AVAILABLE : AgentStatus.BUSY);
    }
}
