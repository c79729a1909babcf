package com.z254.loom.domain.model;

/**
 * Availability of a worker agent.
 */
public enum AgentStatus {
    AVAILABLE,
    BUSY,
    OFFLINE
}
