package io.github.chirino.recall.vector;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.config.VectorStoreSelector;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.service.ChatHandle;
import io.github.chirino.recall.service.ChatRegistry;
import io.github.chirino.recall.store.ChatStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Keeps the vector index of a chat in step with its message log.
 *
 * <p>Each assistant message is an anchor. Its embedding covers the reply together with the user
 * turns that prompted it (see {@link ContextFusion}). A failed embedding call puts the chat into a
 * cooldown during which sync requests return immediately.
 */
@ApplicationScoped
public class SemanticIndexer {

    private static final Logger LOG = Logger.getLogger(SemanticIndexer.class);

    static final String INDEXED_METRIC = "chat.recall.index.anchors";

    @Inject ChatStoreSelector storeSelector;

    @Inject VectorStoreSelector vectorStoreSelector;

    @Inject EmbeddingGateway embeddingGateway;

    @Inject MemorySettings settings;

    @Inject ChatRegistry registry;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "chat-recall.indexing.batch-size", defaultValue = "50")
    int batchSize;

    @ConfigProperty(name = "chat-recall.indexing.fusion-look-back", defaultValue = "3")
    int fusionLookBack;

    @ConfigProperty(name = "chat-recall.indexing.rebuild-max-batches", defaultValue = "1000")
    int rebuildMaxBatches;

    Clock clock = Clock.systemUTC();

    /** Embeds the next batch of unindexed anchors of the chat. Idempotent. */
    public SyncResult syncChat(long chatId) {
        if (!embeddingGateway.isEnabled()) {
            return SyncResult.of(SyncResult.Status.DISABLED);
        }
        ChatHandle handle = registry.handle(chatId);
        Instant now = clock.instant();
        if (handle.isIndexCoolingDown(now)) {
            LOG.debugf(
                    "Index sync for chat %d skipped, cooling down until %s",
                    chatId, handle.getIndexCooldownUntil());
            return SyncResult.of(SyncResult.Status.SKIPPED_COOLDOWN);
        }
        if (!handle.tryBeginIndexing()) {
            return SyncResult.of(SyncResult.Status.SKIPPED_IN_FLIGHT);
        }
        try {
            return syncBatch(chatId, handle, now);
        } finally {
            handle.endIndexing();
        }
    }

    private SyncResult syncBatch(long chatId, ChatHandle handle, Instant now) {
        List<Long> anchorIds = vectors().findUnindexedAnchors(chatId, Math.max(1, batchSize));
        if (anchorIds.isEmpty()) {
            handle.clearIndexCooldown();
            return SyncResult.of(SyncResult.Status.UP_TO_DATE);
        }

        List<Long> embedIds = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Long> emptyIds = new ArrayList<>();
        for (ChatMessage anchor : store().findByIds(chatId, anchorIds)) {
            List<ChatMessage> preceding =
                    store().listBefore(chatId, anchor.id(), Math.max(0, fusionLookBack));
            String fused = ContextFusion.fuse(anchor, preceding);
            if (fused.isEmpty()) {
                emptyIds.add(anchor.id());
            } else {
                embedIds.add(anchor.id());
                texts.add(fused);
            }
        }

        EmbeddingResult embeddings = embeddingGateway.embedAll(texts);
        if (!embeddings.isAvailable()) {
            Instant until = now.plus(settings.indexCooldown());
            handle.startIndexCooldown(until);
            LOG.warnf(
                    "Index sync for chat %d failed, cooling down until %s: %s",
                    chatId, until, embeddings.failure());
            return SyncResult.of(SyncResult.Status.EMBEDDING_UNAVAILABLE);
        }

        // Writes run under the chat lock so a concurrent reset cannot leave orphan entries.
        int[] written = new int[2];
        registry.withChatLock(
                chatId,
                () -> {
                    Set<Long> alive = new HashSet<>();
                    for (ChatMessage message : store().findByIds(chatId, anchorIds)) {
                        alive.add(message.id());
                    }
                    for (int i = 0; i < embedIds.size(); i++) {
                        if (alive.contains(embedIds.get(i))) {
                            vectors().upsert(chatId, embedIds.get(i), embeddings.vectors().get(i));
                            written[0]++;
                        }
                    }
                    for (Long id : emptyIds) {
                        if (alive.contains(id)) {
                            vectors().markSkipped(chatId, id);
                            written[1]++;
                        }
                    }
                });
        handle.clearIndexCooldown();
        meterRegistry.counter(INDEXED_METRIC).increment(written[0]);
        LOG.infof(
                "Indexed %d anchors of chat %d (%d without content)",
                written[0], chatId, written[1]);
        return SyncResult.indexed(written[0], written[1]);
    }

    /** Drops the chat's vector entries and ends any cooldown. */
    public long clearChat(long chatId) {
        long removed = vectors().deleteByChat(chatId);
        registry.handle(chatId).clearIndexCooldown();
        LOG.infof("Cleared %d vector entries of chat %d", removed, chatId);
        return removed;
    }

    public long clearAll() {
        long removed = vectors().deleteAll();
        registry.clearIndexCooldowns();
        LOG.infof("Cleared all %d vector entries", removed);
        return removed;
    }

    /** Clears the chat's index and re-embeds every anchor. */
    public SyncResult rebuildChat(long chatId) {
        clearChat(chatId);
        int indexed = 0;
        int skipped = 0;
        SyncResult last = SyncResult.of(SyncResult.Status.UP_TO_DATE);
        for (int batch = 0; batch < rebuildMaxBatches; batch++) {
            last = syncChat(chatId);
            indexed += last.indexed();
            skipped += last.skipped();
            if (!last.hasMore()) {
                break;
            }
        }
        if (last.status() == SyncResult.Status.INDEXED
                || last.status() == SyncResult.Status.UP_TO_DATE) {
            return indexed + skipped == 0
                    ? SyncResult.of(SyncResult.Status.UP_TO_DATE)
                    : SyncResult.indexed(indexed, skipped);
        }
        return new SyncResult(last.status(), indexed, skipped);
    }

    /**
     * Drops index entries whose fused text covers the given message so the next sync embeds them
     * again: the message itself and, for a user message, the assistant reply that follows it.
     */
    public void invalidate(ChatMessage changed) {
        vectors().deleteMessage(changed.id());
        if (!changed.isUser()) {
            return;
        }
        for (ChatMessage next :
                store().listAfter(changed.chatId(), changed.id(), Math.max(1, fusionLookBack))) {
            if (next.isAssistant()) {
                vectors().deleteMessage(next.id());
                return;
            }
            if (!next.isUser()) {
                return;
            }
        }
    }

    private ChatStore store() {
        return storeSelector.getStore();
    }

    private VectorStore vectors() {
        return vectorStoreSelector.getVectorStore();
    }
}
