package com.z254.loom.delegation.loadbalancing;

import com.z254.loom.domain.model.AgentInfo;
import com.z254.loom.domain.model.LoadBalancingStrategy;
import com.z254.loom.domain.model.WorkerTask;

import java.util.List;

/**
 * Chooses the worker that should run a task.
 */
public interface LoadBalancer {

    /**
     * Select a worker.
     *
     * @param availableWorkers candidates, in a stable order
     * @param task             the task to place
     * @param strategy         selection policy, or null for the balancer's default
     * @return the chosen worker; null only when there are no candidates
     */
    AgentInfo selectWorker(List<AgentInfo> availableWorkers, WorkerTask task, LoadBalancingStrategy strategy);
}
