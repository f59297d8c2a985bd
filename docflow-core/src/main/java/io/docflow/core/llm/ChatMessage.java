package io.docflow.core.llm;

import java.util.Objects;

/// One message of an LLM conversation.
///
/// @param role `system`, `user` or `assistant`, not null
/// @param content message text, not null
public record ChatMessage(String role, String content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage("assistant", content);
    }
}
