package io.github.chirino.recall.window;

import io.github.chirino.recall.model.ChatMessage;
import java.util.List;

/** Messages selected for the live context, oldest first, with their combined token cost. */
public record ActiveWindow(List<ChatMessage> messages, int totalTokens) {

    public static ActiveWindow empty() {
        return new ActiveWindow(List.of(), 0);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /** Id of the oldest selected message, or 0 when the window is empty. */
    public long startId() {
        return messages.isEmpty() ? 0L : messages.get(0).id();
    }

    public long endId() {
        return messages.isEmpty() ? 0L : messages.get(messages.size() - 1).id();
    }
}
