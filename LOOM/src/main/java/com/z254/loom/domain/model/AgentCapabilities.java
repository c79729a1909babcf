package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * What a worker agent advertises it can do, and how much at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentCapabilities {

    /**
     * Tool names the worker can call.
     */
    @Builder.Default
    private Set<String> supportedTools = new HashSet<>();

    /**
     * Intents the worker can handle.
     */
    @Builder.Default
    private Set<String> supportedIntents = new HashSet<>();

    /**
     * Upper bound on tasks the worker runs concurrently.
     */
    @Builder.Default
    private int maxConcurrentTasks = 1;

    /**
     * True when the capability is listed among the tools or the intents.
     */
    public boolean supports(String capability) {
        if (capability == null) {
            return false;
        }
        return (supportedTools != null && supportedTools.contains(capability))
                || (supportedIntents != null && supportedIntents.contains(capability));
    }
}
