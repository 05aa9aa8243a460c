package io.github.chirino.recall.model;

import java.time.OffsetDateTime;

/**
 * A single entry of a chat's message log.
 *
 * <p>Ids are global and monotonic; they are ordered within a chat but not contiguous, so
 * neighbors must be looked up by log order rather than by id arithmetic.
 */
public record ChatMessage(
        long id,
        long chatId,
        MessageRole role,
        MessageKind kind,
        String content,
        Long platformMessageId,
        Long replyToId,
        String replyToSnippet,
        OffsetDateTime createdAt) {

    public ChatMessage {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (kind == null) {
            kind = MessageKind.TEXT;
        }
        if (content == null) {
            content = "";
        }
    }

    public boolean isUser() {
        return role == MessageRole.USER;
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }
}
