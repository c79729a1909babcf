package com.z254.loom.config;

import com.z254.loom.checkpoint.CheckpointStore;
import com.z254.loom.delegation.DelegationNodeFactory;
import com.z254.loom.delegation.Supervisor;
import com.z254.loom.delegation.WorkerPool;
import com.z254.loom.delegation.loadbalancing.DefaultLoadBalancer;
import com.z254.loom.delegation.loadbalancing.LoadBalancer;
import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.LoadBalancingStrategy;
import com.z254.loom.domain.repository.TaskStore;
import com.z254.loom.domain.repository.impl.InMemoryTaskStore;
import com.z254.loom.graph.CompiledGraph;
import com.z254.loom.graph.GraphBuilder;
import com.z254.loom.graph.GraphExecutionOptions;
import com.z254.loom.graph.GraphRuntime;
import com.z254.loom.graph.NodeHandler;
import com.z254.loom.observability.GraphEventLogger;
import com.z254.loom.observability.GraphMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LoomAutoConfiguration}.
 */
class LoomAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LoomAutoConfiguration.class));

    @Test
    void shouldRegisterDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(GraphRuntime.class);
            assertThat(context).hasSingleBean(GraphMetrics.class);
            assertThat(context).hasSingleBean(GraphEventLogger.class);
            assertThat(context).hasSingleBean(CheckpointStore.class);
            assertThat(context).hasSingleBean(TaskStore.class);
            assertThat(context).hasSingleBean(WorkerPool.class);
            assertThat(context).hasSingleBean(Supervisor.class);
            assertThat(context).hasSingleBean(DelegationNodeFactory.class);
            assertThat(context.getBean(LoadBalancer.class)).isInstanceOf(DefaultLoadBalancer.class);
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "loom.graph.max-steps=7",
                        "loom.graph.timeout=30s",
                        "loom.graph.checkpoint-enabled=true",
                        "loom.delegation.default-strategy=round_robin",
                        "loom.delegation.poll-interval=250ms")
                .run(context -> {
                    GraphExecutionOptions options = context.getBean(GraphRuntime.class).defaultOptions();
                    assertThat(options.getMaxSteps()).isEqualTo(7);
                    assertThat(options.getTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(options.isCheckpointEnabled()).isTrue();

                    LoomProperties properties = context.getBean(LoomProperties.class);
                    assertThat(properties.getDelegation().getDefaultStrategy())
                            .isEqualTo(LoadBalancingStrategy.ROUND_ROBIN);
                    assertThat(properties.getDelegation().getPollInterval()).isEqualTo(Duration.ofMillis(250));
                    assertThat(((DefaultLoadBalancer) context.getBean(LoadBalancer.class)).getDefaultStrategy())
                            .isEqualTo(LoadBalancingStrategy.ROUND_ROBIN);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("loom.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(GraphRuntime.class);
                    assertThat(context).doesNotHaveBean(Supervisor.class);
                });
    }

    @Test
    void shouldKeepUserProvidedBeans() {
        InMemoryTaskStore custom = new InMemoryTaskStore();

        contextRunner
                .withBean(TaskStore.class, () -> custom)
                .run(context -> assertThat(context.getBean(TaskStore.class)).isSameAs(custom));
    }

    @Test
    void shouldRecordMetricsIntoTheApplicationRegistry() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    CompiledGraph graph = context.getBean(GraphRuntime.class).compile(GraphBuilder.create("ping")
                            .addNode("ping", NodeHandler.of(state -> state.withValue("pong", true)))
                            .setEntryPoint("ping"));

                    graph.invoke(AgentState.empty()).block();

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get("loom.graph.runs.completed").counter().count()).isEqualTo(1.0);
                });
    }
}
