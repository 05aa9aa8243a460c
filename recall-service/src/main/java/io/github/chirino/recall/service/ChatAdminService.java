package io.github.chirino.recall.service;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.config.VectorStoreSelector;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.store.ChatStore;
import io.github.chirino.recall.store.ResourceNotFoundException;
import io.github.chirino.recall.vector.SemanticIndexer;
import io.github.chirino.recall.vector.SyncResult;
import io.github.chirino.recall.window.ActiveWindowSelector;
import io.github.chirino.recall.window.WindowStats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/** Administrative operations on a chat's memory. */
@ApplicationScoped
public class ChatAdminService {

    private static final Logger LOG = Logger.getLogger(ChatAdminService.class);

    /** Counts of what a reset removed. */
    public record ResetSummary(long chatId, long messagesDeleted, long vectorsDeleted) {}

    @Inject ChatStoreSelector storeSelector;

    @Inject VectorStoreSelector vectorStoreSelector;

    @Inject ChatRegistry registry;

    @Inject SemanticIndexer indexer;

    @Inject ActiveWindowSelector windowSelector;

    @Inject MemorySettings settings;

    @Inject ContextAssembler assembler;

    /** Appends a message; an assistant reply completes a turn and schedules an archive pass. */
    public ChatMessage appendMessage(NewMessage message) {
        ChatMessage stored =
                registry.withChatLock(message.chatId(), () -> store().appendMessage(message));
        if (stored.isAssistant()) {
            assembler.onTurnCompleted(stored.chatId());
        }
        return stored;
    }

    /**
     * Replaces the content of a message and drops the index entries derived from it.
     *
     * @throws ResourceNotFoundException if the message does not belong to the chat
     */
    public ChatMessage patchContent(long chatId, long messageId, String content) {
        return registry.withChatLock(
                chatId,
                () -> {
                    store().findMessage(messageId)
                            .filter(m -> m.chatId() == chatId)
                            .orElseThrow(
                                    () ->
                                            ResourceNotFoundException.messageInChat(
                                                    chatId, messageId));
                    ChatMessage updated = store().patchContent(messageId, content);
                    indexer.invalidate(updated);
                    return updated;
                });
    }

    /** Wipes every trace of the chat: vectors, profile, messages and in-process state. */
    public ResetSummary reset(long chatId) {
        ResetSummary summary =
                registry.withChatLock(
                        chatId,
                        () -> {
                            long vectors = indexer.clearChat(chatId);
                            store().deleteProfile(chatId);
                            long messages = store().deleteChat(chatId);
                            registry.resetState(chatId);
                            return new ResetSummary(chatId, messages, vectors);
                        });
        LOG.infof(
                "Reset chat %d: %d messages, %d vectors removed",
                chatId, summary.messagesDeleted(), summary.vectorsDeleted());
        return summary;
    }

    public SyncResult rebuildIndex(long chatId) {
        return indexer.rebuildChat(chatId);
    }

    public long clearAllIndexes() {
        return indexer.clearAll();
    }

    public ChatStats stats(long chatId) {
        ChatProfile profile =
                store().getProfile(chatId).orElseGet(() -> ChatProfile.empty(chatId));
        WindowStats window =
                windowSelector.computeStats(
                        chatId, settings.windowTokens(), profile.lastFoldedId());
        return new ChatStats(
                chatId,
                store().countMessages(chatId),
                vectorStoreSelector.getVectorStore().countByChat(chatId),
                registry.handle(chatId).getArchiveState(),
                profile.hasProfile(),
                profile.updatedAt(),
                window);
    }

    private ChatStore store() {
        return storeSelector.getStore();
    }
}
