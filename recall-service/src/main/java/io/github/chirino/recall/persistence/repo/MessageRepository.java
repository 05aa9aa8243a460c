package io.github.chirino.recall.persistence.repo;

import io.github.chirino.recall.persistence.entity.MessageEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Page;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Collection;
import java.util.List;

@ApplicationScoped
public class MessageRepository implements PanacheRepositoryBase<MessageEntity, Long> {

    public List<MessageEntity> listRecent(long chatId, int limit) {
        return find("chatId = ?1 order by id desc", chatId).page(Page.ofSize(limit)).list();
    }

    public List<MessageEntity> listRange(long chatId, long afterId, long beforeId) {
        return list("chatId = ?1 and id > ?2 and id < ?3 order by id", chatId, afterId, beforeId);
    }

    public List<MessageEntity> listBefore(long chatId, long messageId, int limit) {
        return find("chatId = ?1 and id < ?2 order by id desc", chatId, messageId)
                .page(Page.ofSize(limit))
                .list();
    }

    public List<MessageEntity> listAfter(long chatId, long messageId, int limit) {
        return find("chatId = ?1 and id > ?2 order by id", chatId, messageId)
                .page(Page.ofSize(limit))
                .list();
    }

    public List<MessageEntity> findByIds(long chatId, Collection<Long> ids) {
        return list("chatId = ?1 and id in ?2 order by id", chatId, ids);
    }

    public MessageEntity newest(long chatId) {
        return find("chatId = ?1 order by id desc", chatId).firstResult();
    }

    public List<Long> listChatIds() {
        return getEntityManager()
                .createQuery(
                        "select distinct m.chatId from MessageEntity m order by m.chatId",
                        Long.class)
                .getResultList();
    }

    public long countByChat(long chatId) {
        return count("chatId", chatId);
    }

    public long deleteByChat(long chatId) {
        return delete("chatId", chatId);
    }
}
