package io.github.chirino.recall.persistence.repo;

import io.github.chirino.recall.persistence.entity.ChatProfileEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;

@ApplicationScoped
public class ChatProfileRepository implements PanacheRepositoryBase<ChatProfileEntity, Long> {

    /**
     * Inserts or replaces the profile row. The pointer never moves backwards: a stale writer that
     * carries a smaller {@code lastFoldedId} leaves the stored row untouched.
     */
    public int upsert(long chatId, String profileText, long lastFoldedId, OffsetDateTime now) {
        return getEntityManager()
                .createNativeQuery(
                        "INSERT INTO chat_profiles (chat_id, profile_text, last_folded_id,"
                                + " updated_at) VALUES (?1, ?2, ?3, ?4) ON CONFLICT (chat_id) DO"
                                + " UPDATE SET profile_text = EXCLUDED.profile_text,"
                                + " last_folded_id = EXCLUDED.last_folded_id,"
                                + " updated_at = EXCLUDED.updated_at"
                                + " WHERE chat_profiles.last_folded_id <= EXCLUDED.last_folded_id")
                .setParameter(1, chatId)
                .setParameter(2, profileText)
                .setParameter(3, lastFoldedId)
                .setParameter(4, now)
                .executeUpdate();
    }
}
