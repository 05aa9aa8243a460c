package io.github.chirino.recall.vector;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.model.ChatMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Brute-force vector index used together with the in-memory message store. */
@ApplicationScoped
public class InMemoryVectorStore implements VectorStore {

    private record Entry(long chatId, float[] embedding) {}

    @Inject ChatStoreSelector storeSelector;

    private final Map<Long, Entry> vectors = new ConcurrentHashMap<>();
    private final Map<Long, Long> skipped = new ConcurrentHashMap<>();

    @Override
    public List<Long> findUnindexedAnchors(long chatId, int limit) {
        List<Long> anchors = new ArrayList<>();
        for (ChatMessage message :
                storeSelector.getStore().listRange(chatId, 0L, Long.MAX_VALUE)) {
            if (anchors.size() >= limit) {
                break;
            }
            if (message.isAssistant()
                    && !vectors.containsKey(message.id())
                    && !skipped.containsKey(message.id())) {
                anchors.add(message.id());
            }
        }
        return anchors;
    }

    @Override
    public void upsert(long chatId, long messageId, float[] embedding) {
        vectors.put(messageId, new Entry(chatId, embedding.clone()));
    }

    @Override
    public void markSkipped(long chatId, long messageId) {
        skipped.put(messageId, chatId);
    }

    @Override
    public List<VectorMatch> search(
            long chatId, float[] query, Set<Long> excludeIds, int limit, double maxDistance) {
        List<VectorMatch> matches = new ArrayList<>();
        for (Map.Entry<Long, Entry> e : vectors.entrySet()) {
            if (e.getValue().chatId() != chatId || excludeIds.contains(e.getKey())) {
                continue;
            }
            double distance = VectorProjection.cosineDistance(query, e.getValue().embedding());
            if (distance < maxDistance) {
                matches.add(new VectorMatch(e.getKey(), distance));
            }
        }
        matches.sort(
                Comparator.comparingDouble(VectorMatch::distance)
                        .thenComparingLong(VectorMatch::messageId));
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    @Override
    public long deleteByChat(long chatId) {
        long before = vectors.size();
        vectors.values().removeIf(entry -> entry.chatId() == chatId);
        skipped.values().removeIf(id -> id == chatId);
        return before - vectors.size();
    }

    @Override
    public void deleteMessage(long messageId) {
        vectors.remove(messageId);
        skipped.remove(messageId);
    }

    @Override
    public long deleteAll() {
        long before = vectors.size();
        vectors.clear();
        skipped.clear();
        return before;
    }

    @Override
    public long countByChat(long chatId) {
        return vectors.values().stream().filter(entry -> entry.chatId() == chatId).count();
    }
}
