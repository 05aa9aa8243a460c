package io.github.chirino.recall.persistence.repo;

import io.github.chirino.recall.persistence.entity.SettingEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class SettingRepository implements PanacheRepositoryBase<SettingEntity, String> {

    public void upsert(String key, String value) {
        getEntityManager()
                .createNativeQuery(
                        "INSERT INTO settings (key, value) VALUES (?1, ?2)"
                                + " ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value")
                .setParameter(1, key)
                .setParameter(2, value)
                .executeUpdate();
    }
}
