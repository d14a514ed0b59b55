package com.taskboard.providers.chat;

/**
 * One role-tagged message sent to the model.
 */
public class ChatTurn {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;

    public ChatTurn(String role, String content) {
        this.role = role;
        this.content = content;
    }

    public static ChatTurn system(String content) {
        return new ChatTurn(SYSTEM, content);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(USER, content);
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }
}
