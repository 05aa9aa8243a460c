package io.github.chirino.recall.service;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.vector.RetrievalResult;
import io.github.chirino.recall.window.WindowStats;
import java.util.List;

/**
 * Everything the memory subsystem contributes to one model call.
 *
 * @param profileText long-term profile, empty when none exists yet
 * @param window recent messages, oldest first
 * @param recall semantically related earlier messages outside the window
 */
public record AssembledContext(
        long chatId,
        String profileText,
        List<ChatMessage> window,
        RetrievalResult recall,
        WindowStats stats) {

    public boolean hasProfile() {
        return profileText != null && !profileText.isBlank();
    }
}
