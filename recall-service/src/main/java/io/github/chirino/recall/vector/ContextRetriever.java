package io.github.chirino.recall.vector;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.config.VectorStoreSelector;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.store.ChatStore;
import io.github.chirino.recall.window.ContentTruncator;
import io.github.chirino.recall.window.MessageRenderer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Finds earlier parts of a chat that are semantically related to a query.
 *
 * <p>Each match is widened to {@code padding} messages on either side, which also recovers
 * messages that were never indexed themselves. Overlapping neighborhoods are merged and the
 * resulting clusters are rendered oldest first.
 */
@ApplicationScoped
public class ContextRetriever {

    private static final Logger LOG = Logger.getLogger(ContextRetriever.class);

    static final String HEADER = "Relevant earlier conversation:";
    static final String SEPARATOR = "\n--- context skip ---\n";

    @Inject ChatStoreSelector storeSelector;

    @Inject VectorStoreSelector vectorStoreSelector;

    @Inject EmbeddingGateway embeddingGateway;

    @Inject MemorySettings settings;

    @Inject MessageRenderer renderer;

    @Inject ContentTruncator truncator;

    @ConfigProperty(name = "chat-recall.rag.min-query-length", defaultValue = "3")
    int minQueryLength;

    public RetrievalResult search(long chatId, String queryText, Set<Long> excludeIds) {
        return search(
                chatId,
                queryText,
                excludeIds,
                settings.topK(),
                settings.neighborhoodPadding());
    }

    public RetrievalResult search(
            long chatId, String queryText, Set<Long> excludeIds, int topK, int padding) {
        if (!embeddingGateway.isEnabled()) {
            return RetrievalResult.of(RetrievalResult.Status.DISABLED);
        }
        String query = ContentSanitizer.sanitize(queryText);
        if (query.length() < minQueryLength) {
            return RetrievalResult.of(RetrievalResult.Status.QUERY_TOO_SHORT);
        }
        EmbeddingResult embedding = embeddingGateway.embed(query);
        if (!embedding.isAvailable()) {
            return RetrievalResult.of(RetrievalResult.Status.EMBEDDING_UNAVAILABLE);
        }

        Set<Long> excluded = excludeIds == null ? Set.of() : excludeIds;
        List<VectorMatch> matches =
                vectors()
                        .search(
                                chatId,
                                embedding.first(),
                                excluded,
                                Math.max(1, topK),
                                settings.similarityThreshold());
        if (matches.isEmpty()) {
            return RetrievalResult.of(RetrievalResult.Status.NO_MATCH);
        }

        int width = Math.max(0, padding);
        List<ClusterMerger.Neighborhood> neighborhoods = new ArrayList<>(matches.size());
        for (VectorMatch match : matches) {
            List<Long> ids = new ArrayList<>();
            for (ChatMessage before : store().listBefore(chatId, match.messageId(), width)) {
                ids.add(before.id());
            }
            Collections.reverse(ids);
            ids.add(match.messageId());
            for (ChatMessage after : store().listAfter(chatId, match.messageId(), width)) {
                ids.add(after.id());
            }
            neighborhoods.add(
                    new ClusterMerger.Neighborhood(match.messageId(), match.distance(), ids));
        }
        List<ClusterMerger.Cluster> clusters = ClusterMerger.merge(neighborhoods);

        Set<Long> allIds = new HashSet<>();
        clusters.forEach(cluster -> allIds.addAll(cluster.messageIds()));
        Map<Long, ChatMessage> messages = new HashMap<>();
        for (ChatMessage message : store().findByIds(chatId, allIds)) {
            messages.put(message.id(), message);
        }

        List<String> blocks = new ArrayList<>(clusters.size());
        for (ClusterMerger.Cluster cluster : clusters) {
            String rendered = renderCluster(cluster, messages, excluded);
            if (!rendered.isEmpty()) {
                blocks.add(rendered);
            }
        }
        if (blocks.isEmpty()) {
            return RetrievalResult.of(RetrievalResult.Status.NO_MATCH);
        }
        LOG.debugf(
                "Recall for chat %d: %d matches in %d clusters",
                chatId, matches.size(), clusters.size());
        return new RetrievalResult(
                RetrievalResult.Status.MATCHED,
                HEADER + "\n" + String.join(SEPARATOR, blocks),
                clusters);
    }

    // Messages already in the caller's context are left out; anchors never are.
    private String renderCluster(
            ClusterMerger.Cluster cluster, Map<Long, ChatMessage> messages, Set<Long> excluded) {
        StringBuilder block = new StringBuilder();
        for (Long id : cluster.messageIds()) {
            ChatMessage message = messages.get(id);
            Double distance = cluster.anchorDistances().get(id);
            if (message == null || (distance == null && excluded.contains(id))) {
                continue;
            }
            if (block.length() > 0) {
                block.append('\n');
            }
            block.append('[')
                    .append(renderer.shortTime(message.createdAt()))
                    .append("] ")
                    .append(message.role().label())
                    .append(": ")
                    .append(truncator.truncate(ContentSanitizer.sanitize(message.content())));
            if (distance != null) {
                block.append(String.format(Locale.ROOT, " <<< match (distance %.3f)", distance));
            }
        }
        return block.toString();
    }

    private ChatStore store() {
        return storeSelector.getStore();
    }

    private VectorStore vectors() {
        return vectorStoreSelector.getVectorStore();
    }
}
