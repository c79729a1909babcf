package com.z254.loom.config;

import com.z254.loom.domain.model.LoadBalancingStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for LOOM.
 */
@Data
@ConfigurationProperties(prefix = "loom")
public class LoomProperties {

    private boolean enabled = true;
    private GraphProperties graph = new GraphProperties();
    private DelegationProperties delegation = new DelegationProperties();
    private ObservabilityProperties observability = new ObservabilityProperties();

    @Data
    public static class GraphProperties {
        private int maxSteps = 100;
        private Duration timeout;
        private boolean checkpointEnabled = false;
    }

    @Data
    public static class DelegationProperties {
        private LoadBalancingStrategy defaultStrategy = LoadBalancingStrategy.PRIORITY_BASED;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration maxWait = Duration.ofMinutes(5);
    }

    @Data
    public static class ObservabilityProperties {
        private boolean eventLoggingEnabled = true;
    }
}
