package com.ai.leadqualifier.provider;

/**
 * Role/content pair in the chat format the generation backends accept.
 */
public final class ChatMessage {

    public static final String SYSTEM = "system";
    public static final String USER = "user";

    private final String role;
    private final String content;

    public ChatMessage(String role, String content) {
        this.role = role;
        this.content = content != null ? content : "";
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return role + ": " + content;
    }
}
