package io.github.chirino.recall.service;

import io.github.chirino.recall.archive.ArchiveOutcome;
import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.vector.ContextRetriever;
import io.github.chirino.recall.vector.RetrievalResult;
import io.github.chirino.recall.window.ActiveWindow;
import io.github.chirino.recall.window.ActiveWindowSelector;
import io.github.chirino.recall.window.WindowStats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/** Builds the memory part of a model call and kicks off archiving once a turn completes. */
@ApplicationScoped
public class ContextAssembler {

    @Inject ChatStoreSelector storeSelector;

    @Inject ActiveWindowSelector windowSelector;

    @Inject ContextRetriever retriever;

    @Inject MemorySettings settings;

    @Inject BackgroundJobs backgroundJobs;

    /**
     * @param queryText text the recall search runs against, usually the incoming user message
     * @param excludeIds messages the caller already shows; window messages are always excluded
     */
    public AssembledContext assemble(long chatId, String queryText, Set<Long> excludeIds) {
        ChatProfile profile =
                storeSelector
                        .getStore()
                        .getProfile(chatId)
                        .orElseGet(() -> ChatProfile.empty(chatId));
        int targetTokens = settings.windowTokens();
        ActiveWindow window =
                windowSelector.selectWindow(chatId, targetTokens, profile.lastFoldedId());

        Set<Long> excluded = new HashSet<>();
        if (excludeIds != null) {
            excluded.addAll(excludeIds);
        }
        for (ChatMessage message : window.messages()) {
            excluded.add(message.id());
        }
        RetrievalResult recall = retriever.search(chatId, queryText, excluded);

        WindowStats stats =
                windowSelector.computeStats(chatId, targetTokens, profile.lastFoldedId());
        return new AssembledContext(
                chatId,
                profile.profileText() == null ? "" : profile.profileText(),
                window.messages(),
                recall,
                stats);
    }

    public CompletableFuture<ArchiveOutcome> onTurnCompleted(long chatId) {
        return backgroundJobs.scheduleArchive(chatId);
    }
}
