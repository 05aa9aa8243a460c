package io.github.chirino.recall.vector;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.Set;

/**
 * pgvector-backed index over the {@code vector_index} table, searched with the {@code <=>} cosine
 * distance operator.
 */
@ApplicationScoped
public class PgVectorStore implements VectorStore {

    @Inject EntityManager entityManager;

    @Override
    @Transactional
    public List<Long> findUnindexedAnchors(long chatId, int limit) {
        @SuppressWarnings("unchecked")
        List<Number> rows =
                entityManager
                        .createNativeQuery(
                                """
                                SELECT m.id FROM messages m
                                WHERE m.chat_id = ?1
                                  AND m.role = 'ASSISTANT'
                                  AND NOT EXISTS
                                      (SELECT 1 FROM vector_index v WHERE v.message_id = m.id)
                                  AND NOT EXISTS
                                      (SELECT 1 FROM vector_index_skips s WHERE s.message_id = m.id)
                                ORDER BY m.id
                                LIMIT ?2
                                """)
                        .setParameter(1, chatId)
                        .setParameter(2, limit)
                        .getResultList();
        return rows.stream().map(Number::longValue).toList();
    }

    @Override
    @Transactional
    public void upsert(long chatId, long messageId, float[] embedding) {
        entityManager
                .createNativeQuery(
                        "INSERT INTO vector_index (message_id, chat_id, embedding) VALUES (?1, ?2,"
                                + " CAST(?3 AS vector)) ON CONFLICT (message_id) DO UPDATE SET"
                                + " embedding = EXCLUDED.embedding, created_at = NOW()")
                .setParameter(1, messageId)
                .setParameter(2, chatId)
                .setParameter(3, VectorProjection.toPgVectorLiteral(embedding))
                .executeUpdate();
    }

    @Override
    @Transactional
    public void markSkipped(long chatId, long messageId) {
        entityManager
                .createNativeQuery(
                        "INSERT INTO vector_index_skips (message_id, chat_id) VALUES (?1, ?2)"
                                + " ON CONFLICT (message_id) DO NOTHING")
                .setParameter(1, messageId)
                .setParameter(2, chatId)
                .executeUpdate();
    }

    @Override
    @Transactional
    public List<VectorMatch> search(
            long chatId, float[] query, Set<Long> excludeIds, int limit, double maxDistance) {
        String exclusion = excludeIds.isEmpty() ? "" : " AND v.message_id NOT IN (:excluded)";
        String sql =
                """
                SELECT message_id, distance FROM (
                    SELECT v.message_id, v.embedding <=> CAST(:query AS vector) AS distance
                    FROM vector_index v
                    WHERE v.chat_id = :chatId%s
                ) ranked
                WHERE distance < :maxDistance
                ORDER BY distance, message_id
                LIMIT :limit
                """
                        .formatted(exclusion);
        Query nativeQuery =
                entityManager
                        .createNativeQuery(sql)
                        .setParameter("query", VectorProjection.toPgVectorLiteral(query))
                        .setParameter("chatId", chatId)
                        .setParameter("maxDistance", maxDistance)
                        .setParameter("limit", limit);
        if (!excludeIds.isEmpty()) {
            nativeQuery.setParameter("excluded", excludeIds);
        }
        @SuppressWarnings("unchecked")
        List<Object[]> rows = nativeQuery.getResultList();
        return rows.stream()
                .map(
                        row ->
                                new VectorMatch(
                                        ((Number) row[0]).longValue(),
                                        ((Number) row[1]).doubleValue()))
                .toList();
    }

    @Override
    @Transactional
    public long deleteByChat(long chatId) {
        entityManager
                .createNativeQuery("DELETE FROM vector_index_skips WHERE chat_id = ?1")
                .setParameter(1, chatId)
                .executeUpdate();
        return entityManager
                .createNativeQuery("DELETE FROM vector_index WHERE chat_id = ?1")
                .setParameter(1, chatId)
                .executeUpdate();
    }

    @Override
    @Transactional
    public void deleteMessage(long messageId) {
        entityManager
                .createNativeQuery("DELETE FROM vector_index_skips WHERE message_id = ?1")
                .setParameter(1, messageId)
                .executeUpdate();
        entityManager
                .createNativeQuery("DELETE FROM vector_index WHERE message_id = ?1")
                .setParameter(1, messageId)
                .executeUpdate();
    }

    @Override
    @Transactional
    public long deleteAll() {
        entityManager.createNativeQuery("DELETE FROM vector_index_skips").executeUpdate();
        return entityManager.createNativeQuery("DELETE FROM vector_index").executeUpdate();
    }

    @Override
    @Transactional
    public long countByChat(long chatId) {
        Number count =
                (Number)
                        entityManager
                                .createNativeQuery(
                                        "SELECT COUNT(*) FROM vector_index WHERE chat_id = ?1")
                                .setParameter(1, chatId)
                                .getSingleResult();
        return count.longValue();
    }
}
