package me.golemcore.editor.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Role-tagged message of the transcript sent to the oracle.
 */
@Data
@Builder
public class Message {

    private String role; // system, user, assistant
    private String content;

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role("assistant").content(content).build();
    }

    public boolean isSystemMessage() {
        return "system".equals(role);
    }

    public boolean isAssistantMessage() {
        return "assistant".equals(role);
    }
}
