package io.github.chirino.recall.vector;

import java.util.List;
import java.util.Set;

/**
 * Vector index keyed by anchor message id. Entries are derived state and can be dropped and
 * rebuilt from the message log at any time.
 */
public interface VectorStore {

    /**
     * Assistant messages of the chat that have neither a vector entry nor a skip marker, oldest
     * first.
     */
    List<Long> findUnindexedAnchors(long chatId, int limit);

    void upsert(long chatId, long messageId, float[] embedding);

    /** Records that an anchor has nothing to embed so incremental syncs pass over it. */
    void markSkipped(long chatId, long messageId);

    /**
     * Nearest entries of the chat with distance strictly below {@code maxDistance}, ordered by
     * distance and then by message id.
     */
    List<VectorMatch> search(
            long chatId, float[] query, Set<Long> excludeIds, int limit, double maxDistance);

    /** Drops vector entries and skip markers of the chat; returns the number of vectors removed. */
    long deleteByChat(long chatId);

    /** Drops the vector entry and skip marker of one message. */
    void deleteMessage(long messageId);

    /** Drops every vector entry and skip marker; returns the number of vectors removed. */
    long deleteAll();

    long countByChat(long chatId);
}
