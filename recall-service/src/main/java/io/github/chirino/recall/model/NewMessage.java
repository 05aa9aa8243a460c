package io.github.chirino.recall.model;

import java.time.OffsetDateTime;

/** Input for appending to the message log. A null {@code createdAt} means "now". */
public record NewMessage(
        long chatId,
        MessageRole role,
        MessageKind kind,
        String content,
        Long platformMessageId,
        Long replyToId,
        String replyToSnippet,
        OffsetDateTime createdAt) {

    private static final int SNIPPET_LIMIT = 30;

    public static NewMessage text(long chatId, MessageRole role, String content) {
        return new NewMessage(chatId, role, MessageKind.TEXT, content, null, null, null, null);
    }

    public NewMessage at(OffsetDateTime timestamp) {
        return new NewMessage(
                chatId,
                role,
                kind,
                content,
                platformMessageId,
                replyToId,
                replyToSnippet,
                timestamp);
    }

    /** Shortens quoted reply text the way it is stored alongside the message. */
    public static String snippet(String quoted) {
        if (quoted == null) {
            return null;
        }
        return quoted.length() > SNIPPET_LIMIT ? quoted.substring(0, SNIPPET_LIMIT) + ".." : quoted;
    }
}
