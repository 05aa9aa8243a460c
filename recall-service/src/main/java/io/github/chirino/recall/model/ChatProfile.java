package io.github.chirino.recall.model;

import java.time.OffsetDateTime;

/**
 * Compressed long-term profile of a chat together with the archive pointer.
 *
 * <p>{@code lastFoldedId} is the id of the newest message already folded into {@code
 * profileText}; it only ever moves forward.
 */
public record ChatProfile(
        long chatId, String profileText, long lastFoldedId, OffsetDateTime updatedAt) {

    public static ChatProfile empty(long chatId) {
        return new ChatProfile(chatId, "", 0L, null);
    }

    public boolean hasProfile() {
        return profileText != null && !profileText.isBlank();
    }
}
