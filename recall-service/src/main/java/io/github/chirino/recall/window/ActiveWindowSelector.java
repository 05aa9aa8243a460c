package io.github.chirino.recall.window;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.store.ChatStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Selects the newest messages of a chat that fit into a token budget.
 *
 * <p>Only the most recent {@code candidate-cap} messages are considered. The newest message is
 * always part of the window, even when it alone exceeds the budget.
 */
@ApplicationScoped
public class ActiveWindowSelector {

    private static final Logger LOG = Logger.getLogger(ActiveWindowSelector.class);

    @ConfigProperty(name = "chat-recall.window.candidate-cap", defaultValue = "200")
    int candidateCap;

    @Inject ChatStoreSelector storeSelector;

    @Inject MessageRenderer renderer;

    public ActiveWindow selectWindow(long chatId, int targetTokens) {
        return selectWindow(chatId, targetTokens, 0L);
    }

    /**
     * Like {@link #selectWindow(long, int)} but never reaches back to messages with {@code id <=
     * floorId} (already folded into the profile), except for the newest message.
     */
    public ActiveWindow selectWindow(long chatId, int targetTokens, long floorId) {
        List<ChatMessage> candidates = store().listRecent(chatId, Math.max(1, candidateCap));
        if (candidates.isEmpty()) {
            return ActiveWindow.empty();
        }

        List<ChatMessage> selected = new ArrayList<>();
        int total = 0;
        for (ChatMessage message : candidates) {
            if (!selected.isEmpty() && message.id() <= floorId) {
                break;
            }
            int cost = renderer.cost(message);
            if (!selected.isEmpty() && total + cost > targetTokens) {
                break;
            }
            selected.add(message);
            total += cost;
        }
        Collections.reverse(selected);

        LOG.debugf(
                "Window for chat %d: %d of %d candidates, %d/%d tokens",
                chatId, selected.size(), candidates.size(), total, targetTokens);
        return new ActiveWindow(List.copyOf(selected), total);
    }

    /**
     * Computes window and buffer token counts. The buffer is every message strictly between {@code
     * lastArchivedId} and the first message of the window.
     */
    public WindowStats computeStats(long chatId, int targetTokens, long lastArchivedId) {
        ActiveWindow window = selectWindow(chatId, targetTokens, lastArchivedId);
        if (window.isEmpty()) {
            return new WindowStats(chatId, targetTokens, 0, 0, 0L, 0, 0, lastArchivedId);
        }
        List<ChatMessage> buffer = bufferMessages(chatId, lastArchivedId, window);
        int bufferTokens = 0;
        for (ChatMessage message : buffer) {
            bufferTokens += renderer.cost(message);
        }
        return new WindowStats(
                chatId,
                targetTokens,
                window.totalTokens(),
                window.messages().size(),
                window.startId(),
                bufferTokens,
                buffer.size(),
                lastArchivedId);
    }

    /** Messages older than the window that are not yet folded, ascending. */
    public List<ChatMessage> bufferMessages(long chatId, long lastArchivedId, ActiveWindow window) {
        if (window.isEmpty()) {
            return List.of();
        }
        return store().listRange(chatId, lastArchivedId, window.startId());
    }

    private ChatStore store() {
        return storeSelector.getStore();
    }
}
