package com.z254.loom.delegation.loadbalancing;

import com.z254.loom.domain.model.AgentInfo;
import com.z254.loom.domain.model.LoadBalancingStrategy;
import com.z254.loom.domain.model.WorkerTask;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Load balancer implementing every {@link LoadBalancingStrategy}.
 * <p>
 * Round robin uses one cursor per balancer instance, advanced atomically on every call whatever
 * the list. Priority selection works on a snapshot of each worker's load so concurrent
 * assignments cannot change the ordering mid-comparison.
 */
@Slf4j
public class DefaultLoadBalancer implements LoadBalancer {

    private static final Comparator<LoadSnapshot> LEAST_LOADED = Comparator
            .comparingDouble(LoadSnapshot::loadRatio)
            .thenComparingInt(LoadSnapshot::taskCount);

    private final AtomicLong roundRobinCursor = new AtomicLong();
    private final LoadBalancingStrategy defaultStrategy;
    private final Random random;

    public DefaultLoadBalancer() {
        this(LoadBalancingStrategy.PRIORITY_BASED);
    }

    public DefaultLoadBalancer(LoadBalancingStrategy defaultStrategy) {
        this(defaultStrategy, new Random());
    }

    public DefaultLoadBalancer(LoadBalancingStrategy defaultStrategy, Random random) {
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : LoadBalancingStrategy.PRIORITY_BASED;
        this.random = random;
    }

    @Override
    public AgentInfo selectWorker(List<AgentInfo> availableWorkers, WorkerTask task, LoadBalancingStrategy strategy) {
        if (availableWorkers == null || availableWorkers.isEmpty()) {
            return null;
        }
        LoadBalancingStrategy effective = strategy != null ? strategy : defaultStrategy;
        return switch (effective) {
            case ROUND_ROBIN -> selectRoundRobin(availableWorkers);
            case CAPABILITY_BASED -> selectByCapability(availableWorkers, task);
            case PRIORITY_BASED -> selectByPriority(availableWorkers);
            case RANDOM -> availableWorkers.get(random.nextInt(availableWorkers.size()));
        };
    }

    public LoadBalancingStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    private AgentInfo selectRoundRobin(List<AgentInfo> workers) {
        long position = roundRobinCursor.getAndIncrement();
        return workers.get(Math.floorMod(position, workers.size()));
    }

    /**
     * Narrow to workers that support the required capability and still have room; without such
     * workers, fall back to priority selection over everyone.
     */
    private AgentInfo selectByCapability(List<AgentInfo> workers, WorkerTask task) {
        if (task == null || !task.hasRequiredCapability()) {
            return selectByPriority(workers);
        }
        String capability = task.getRequiredCapability();
        List<AgentInfo> capable = workers.stream()
                .filter(worker -> worker.supports(capability) && worker.hasSpareCapacity())
                .toList();
        if (capable.isEmpty()) {
            log.debug("No worker with spare capacity supports {}, falling back to priority selection", capability);
            return selectByPriority(workers);
        }
        return selectByPriority(capable);
    }

    private AgentInfo selectByPriority(List<AgentInfo> workers) {
        List<LoadSnapshot> snapshots = workers.stream()
                .map(LoadSnapshot::of)
                .toList();
        List<LoadSnapshot> withCapacity = snapshots.stream()
                .filter(LoadSnapshot::hasSpareCapacity)
                .toList();
        List<LoadSnapshot> candidates = withCapacity.isEmpty() ? snapshots : withCapacity;
        return candidates.stream()
                .min(LEAST_LOADED)
                .map(LoadSnapshot::worker)
                .orElse(null);
    }

    private record LoadSnapshot(AgentInfo worker, int taskCount, int maxTasks) {

        static LoadSnapshot of(AgentInfo worker) {
            return new LoadSnapshot(worker, worker.getCurrentTaskCount(), worker.getMaxConcurrentTasks());
        }

        boolean hasSpareCapacity() {
            return taskCount < maxTasks;
        }

        double loadRatio() {
            return maxTasks > 0 ? (double) taskCount / maxTasks : Double.POSITIVE_INFINITY;
        }
    }
}
