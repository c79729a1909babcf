package com.z254.loom.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.loom.checkpoint.CheckpointStore;
import com.z254.loom.checkpoint.InMemoryCheckpointStore;
import com.z254.loom.delegation.DelegationNodeFactory;
import com.z254.loom.delegation.Supervisor;
import com.z254.loom.delegation.SupervisorImpl;
import com.z254.loom.delegation.TaskQueue;
import com.z254.loom.delegation.WorkerPool;
import com.z254.loom.delegation.loadbalancing.DefaultLoadBalancer;
import com.z254.loom.delegation.loadbalancing.LoadBalancer;
import com.z254.loom.domain.repository.TaskStore;
import com.z254.loom.domain.repository.impl.InMemoryTaskStore;
import com.z254.loom.graph.GraphRuntime;
import com.z254.loom.observability.GraphEventLogger;
import com.z254.loom.observability.GraphMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for LOOM.
 *
 * <p>Provides:</p>
 * <ul>
 *   <li>In-memory checkpoint and task stores</li>
 *   <li>Load balancer, worker pool, task queue and supervisor for delegation</li>
 *   <li>A factory for delegation graph nodes</li>
 *   <li>Micrometer metrics and structured event logging for graph runs</li>
 *   <li>A {@link GraphRuntime} that wires the above into compiled graphs</li>
 * </ul>
 *
 * <p>Every bean backs off when the application defines its own.</p>
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * loom:
 *   enabled: true
 *   graph:
 *     max-steps: 100
 *     timeout: 5m
 *     checkpoint-enabled: false
 *   delegation:
 *     default-strategy: PRIORITY_BASED
 *     poll-interval: 1s
 *     max-wait: 5m
 *   observability:
 *     event-logging-enabled: true
 * }</pre>
 */
@AutoConfiguration
@EnableConfigurationProperties(LoomProperties.class)
@ConditionalOnProperty(prefix = "loom", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LoomAutoConfiguration {

    // ==================== Observability ====================

    @Bean
    @ConditionalOnMissingBean
    public GraphMetrics graphMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new GraphMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphEventLogger graphEventLogger(ObjectProvider<ObjectMapper> objectMapper) {
        return new GraphEventLogger(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    // ==================== Graph execution ====================

    @Bean
    @ConditionalOnMissingBean
    public CheckpointStore checkpointStore(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new InMemoryCheckpointStore(mapper) : new InMemoryCheckpointStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphRuntime graphRuntime(CheckpointStore checkpointStore,
                                     GraphMetrics graphMetrics,
                                     GraphEventLogger graphEventLogger,
                                     LoomProperties properties) {
        GraphEventLogger eventLogger = properties.getObservability().isEventLoggingEnabled()
                ? graphEventLogger
                : null;
        return new GraphRuntime(checkpointStore, graphMetrics, eventLogger, properties.getGraph());
    }

    // ==================== Delegation ====================

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore() {
        return new InMemoryTaskStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public LoadBalancer loadBalancer(LoomProperties properties) {
        return new DefaultLoadBalancer(properties.getDelegation().getDefaultStrategy());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerPool workerPool(LoadBalancer loadBalancer, GraphMetrics graphMetrics, LoomProperties properties) {
        return new WorkerPool(loadBalancer, properties.getDelegation().getDefaultStrategy(), graphMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueue taskQueue() {
        return new TaskQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public Supervisor supervisor(TaskStore taskStore,
                                 TaskQueue taskQueue,
                                 WorkerPool workerPool,
                                 GraphMetrics graphMetrics,
                                 LoomProperties properties) {
        return new SupervisorImpl(taskStore, taskQueue, workerPool,
                properties.getDelegation().getDefaultStrategy(), graphMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public DelegationNodeFactory delegationNodeFactory(Supervisor supervisor, LoomProperties properties) {
        return new DelegationNodeFactory(supervisor, properties.getDelegation());
    }
}
