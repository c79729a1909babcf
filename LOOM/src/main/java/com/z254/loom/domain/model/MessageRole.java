package com.z254.loom.domain.model;

/**
 * Author of a message in the agent state history.
 */
public enum MessageRole {
    /**
     * Instructions that frame the conversation.
     */
    SYSTEM,

    /**
     * Input provided by a human or calling system.
     */
    USER,

    /**
     * Output produced by an agent node.
     */
    ASSISTANT,

    /**
     * Output returned by a tool invocation.
     */
    TOOL
}
