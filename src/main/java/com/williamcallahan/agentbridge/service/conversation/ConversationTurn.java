package com.williamcallahan.agentbridge.service.conversation;

/**
 * One message of a conversation with its content already flattened to text.
 *
 * @param role speaker role, e.g. {@code user} or {@code assistant}
 * @param content text content, never null
 */
public record ConversationTurn(String role, String content) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    static final String ROLE_UNKNOWN = "unknown";

    public ConversationTurn {
        role = role == null || role.isBlank() ? ROLE_UNKNOWN : role;
        content = content == null ? "" : content;
    }

    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }
}
