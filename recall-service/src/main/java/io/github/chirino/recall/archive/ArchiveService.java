package io.github.chirino.recall.archive;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.service.ChatHandle;
import io.github.chirino.recall.service.ChatRegistry;
import io.github.chirino.recall.store.ChatStore;
import io.github.chirino.recall.window.ActiveWindow;
import io.github.chirino.recall.window.ActiveWindowSelector;
import io.github.chirino.recall.window.MessageRenderer;
import io.github.chirino.recall.window.WindowStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Folds messages that dropped out of the active window into the chat profile.
 *
 * <p>A pass fires when the buffer reaches {@link MemorySettings#bufferTriggerTokens()} or when the
 * buffer is non-empty and the newest message is older than {@link MemorySettings#idleThreshold()}.
 * At most one compaction runs per chat; callers arriving while one is in flight, or within the
 * debounce interval of the previous attempt, are dropped rather than queued. A failed compaction
 * leaves the pointer untouched so the same buffer is retried on the next pass.
 */
@ApplicationScoped
public class ArchiveService {

    private static final Logger LOG = Logger.getLogger(ArchiveService.class);

    static final String METRIC = "chat.recall.archive.passes";

    static final String SUMMARIZE_METRIC = "chat.recall.summarize";

    @Inject ChatStoreSelector storeSelector;

    @Inject ActiveWindowSelector windowSelector;

    @Inject MessageRenderer renderer;

    @Inject MemorySettings settings;

    @Inject ChatRegistry registry;

    @Inject Summarizer summarizer;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "chat-recall.summary.debounce", defaultValue = "PT5S")
    Duration debounce;

    Clock clock = Clock.systemUTC();

    public ArchiveOutcome maybeArchive(long chatId) {
        ArchiveOutcome outcome = evaluate(chatId);
        meterRegistry
                .counter(METRIC, "outcome", outcome.status().name().toLowerCase())
                .increment();
        return outcome;
    }

    private ArchiveOutcome evaluate(long chatId) {
        ChatHandle handle = registry.handle(chatId);
        ChatProfile profile = loadProfile(chatId);
        if (handle.getArchiveState() == ArchiveState.COMPACTING) {
            return ArchiveOutcome.skipped(
                    ArchiveOutcome.Status.SKIPPED_IN_FLIGHT, profile.lastFoldedId());
        }

        Instant now = clock.instant();
        int targetTokens = settings.windowTokens();
        WindowStats stats =
                windowSelector.computeStats(chatId, targetTokens, profile.lastFoldedId());
        TriggerReason reason = triggerReason(chatId, stats, now);
        if (reason == null) {
            handle.settleArchiveState(
                    stats.hasBuffer() ? ArchiveState.BUFFER_GROWING : ArchiveState.IDLE);
            return ArchiveOutcome.notTriggered(profile.lastFoldedId());
        }

        if (Duration.between(handle.getLastArchiveAttempt(), now).compareTo(debounce) < 0) {
            LOG.debugf("Archive for chat %d debounced", chatId);
            return ArchiveOutcome.skipped(
                    ArchiveOutcome.Status.SKIPPED_DEBOUNCED, profile.lastFoldedId());
        }
        if (!handle.tryBeginCompaction()) {
            return ArchiveOutcome.skipped(
                    ArchiveOutcome.Status.SKIPPED_IN_FLIGHT, profile.lastFoldedId());
        }
        handle.setLastArchiveAttempt(now);
        LOG.debugf("Chat %d entered COMPACTING (%s)", chatId, reason);

        try {
            ArchiveOutcome outcome = compact(chatId, targetTokens, reason);
            handle.endCompaction(
                    outcome.isCompacted() ? ArchiveState.IDLE : ArchiveState.BUFFER_GROWING);
            return outcome;
        } catch (RuntimeException e) {
            handle.endCompaction(ArchiveState.BUFFER_GROWING);
            LOG.warnf(e, "Archive pass for chat %d failed", chatId);
            return ArchiveOutcome.failed(reason, profile.lastFoldedId());
        }
    }

    private TriggerReason triggerReason(long chatId, WindowStats stats, Instant now) {
        if (!stats.hasBuffer()) {
            return null;
        }
        if (stats.bufferTokens() >= settings.bufferTriggerTokens()) {
            return TriggerReason.THRESHOLD;
        }
        Optional<ChatMessage> newest = store().newestMessage(chatId);
        if (newest.isPresent() && newest.get().createdAt() != null) {
            Duration quiet = Duration.between(newest.get().createdAt().toInstant(), now);
            if (quiet.compareTo(settings.idleThreshold()) > 0) {
                return TriggerReason.IDLE;
            }
        }
        return null;
    }

    // The summarizer runs without the chat lock so appends are never held up by it. The buffer is
    // recomputed from the stored pointer, and the commit re-checks that pointer under the lock.
    private ArchiveOutcome compact(long chatId, int targetTokens, TriggerReason reason) {
        ChatProfile profile = loadProfile(chatId);
        ActiveWindow window =
                windowSelector.selectWindow(chatId, targetTokens, profile.lastFoldedId());
        List<ChatMessage> buffer =
                windowSelector.bufferMessages(chatId, profile.lastFoldedId(), window);
        if (buffer.isEmpty()) {
            return ArchiveOutcome.notTriggered(profile.lastFoldedId());
        }

        StringBuilder transcript = new StringBuilder();
        for (ChatMessage message : buffer) {
            if (transcript.length() > 0) {
                transcript.append('\n');
            }
            transcript.append(renderer.transcriptLine(message));
        }

        String newProfile;
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            newProfile = summarizer.summarize(profile.profileText(), transcript.toString());
        } catch (SummarizationFailedException e) {
            LOG.warnf(
                    "Compaction of %d messages for chat %d failed: %s",
                    buffer.size(), chatId, e.getMessage());
            return ArchiveOutcome.failed(reason, profile.lastFoldedId());
        } finally {
            sample.stop(meterRegistry.timer(SUMMARIZE_METRIC));
        }
        if (newProfile == null || newProfile.isBlank()) {
            LOG.warnf("Summarizer returned a blank profile for chat %d", chatId);
            return ArchiveOutcome.failed(reason, profile.lastFoldedId());
        }

        long lastFoldedId = buffer.get(buffer.size() - 1).id();
        return registry.withChatLock(
                chatId,
                () -> commit(chatId, profile, newProfile, lastFoldedId, buffer.size(), reason));
    }

    // Caller holds the chat lock. A reset deletes the folded messages and a competing fold moves
    // the pointer; either way the new profile no longer describes the stored chat.
    private ArchiveOutcome commit(
            long chatId,
            ChatProfile previous,
            String newProfile,
            long lastFoldedId,
            int folded,
            TriggerReason reason) {
        ChatProfile current = loadProfile(chatId);
        boolean lastStillStored =
                store().findMessage(lastFoldedId).filter(m -> m.chatId() == chatId).isPresent();
        if (current.lastFoldedId() != previous.lastFoldedId() || !lastStillStored) {
            LOG.infof(
                    "Chat %d changed while compacting, discarding profile up to %d",
                    chatId, lastFoldedId);
            return ArchiveOutcome.discarded(reason, current.lastFoldedId());
        }
        store().upsertProfile(
                new ChatProfile(
                        chatId,
                        newProfile,
                        lastFoldedId,
                        OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC)));
        LOG.infof(
                "Compacted %d messages of chat %d (%s), pointer now %d",
                folded, chatId, reason, lastFoldedId);
        return ArchiveOutcome.compacted(reason, lastFoldedId, folded);
    }

    private ChatProfile loadProfile(long chatId) {
        return store().getProfile(chatId).orElseGet(() -> ChatProfile.empty(chatId));
    }

    private ChatStore store() {
        return storeSelector.getStore();
    }
}
