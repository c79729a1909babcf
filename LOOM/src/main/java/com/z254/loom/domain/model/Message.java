package com.z254.loom.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the ordered message history carried by {@link AgentState}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    /**
     * Who produced the message.
     */
    private MessageRole role;

    /**
     * Message text.
     */
    private String content;

    /**
     * Optional name of the producer (tool name, agent id).
     */
    private String name;

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static Message tool(String name, String content) {
        return Message.builder().role(MessageRole.TOOL).name(name).content(content).build();
    }
}
