package io.github.chirino.recall.store.impl;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.persistence.entity.ChatProfileEntity;
import io.github.chirino.recall.persistence.entity.MessageEntity;
import io.github.chirino.recall.persistence.entity.SettingEntity;
import io.github.chirino.recall.persistence.repo.ChatProfileRepository;
import io.github.chirino.recall.persistence.repo.MessageRepository;
import io.github.chirino.recall.persistence.repo.SettingRepository;
import io.github.chirino.recall.store.ChatStore;
import io.github.chirino.recall.store.ResourceNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

@ApplicationScoped
public class PostgresChatStore implements ChatStore {

    private static final Logger LOG = Logger.getLogger(PostgresChatStore.class);

    @Inject MessageRepository messageRepository;
    @Inject ChatProfileRepository profileRepository;
    @Inject SettingRepository settingRepository;

    @Override
    @Transactional
    public ChatMessage appendMessage(NewMessage message) {
        MessageEntity entity = new MessageEntity();
        entity.setChatId(message.chatId());
        entity.setRole(message.role());
        entity.setKind(message.kind());
        entity.setContent(message.content() == null ? "" : message.content());
        entity.setPlatformMessageId(message.platformMessageId());
        entity.setReplyToId(message.replyToId());
        entity.setReplyToSnippet(message.replyToSnippet());
        entity.setCreatedAt(message.createdAt());
        messageRepository.persistAndFlush(entity);
        return toMessage(entity);
    }

    @Override
    @Transactional
    public ChatMessage patchContent(long messageId, String content) {
        MessageEntity entity = messageRepository.findById(messageId);
        if (entity == null) {
            throw ResourceNotFoundException.message(messageId);
        }
        entity.setContent(content == null ? "" : content);
        LOG.debugf("Patched content of message %d in chat %d", messageId, entity.getChatId());
        return toMessage(entity);
    }

    @Override
    @Transactional
    public Optional<ChatMessage> findMessage(long messageId) {
        return messageRepository.findByIdOptional(messageId).map(PostgresChatStore::toMessage);
    }

    @Override
    @Transactional
    public List<ChatMessage> listRecent(long chatId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return toMessages(messageRepository.listRecent(chatId, limit));
    }

    @Override
    @Transactional
    public List<ChatMessage> listRange(long chatId, long afterId, long beforeId) {
        if (beforeId <= afterId + 1) {
            return List.of();
        }
        return toMessages(messageRepository.listRange(chatId, afterId, beforeId));
    }

    @Override
    @Transactional
    public List<ChatMessage> listBefore(long chatId, long messageId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return toMessages(messageRepository.listBefore(chatId, messageId, limit));
    }

    @Override
    @Transactional
    public List<ChatMessage> listAfter(long chatId, long messageId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return toMessages(messageRepository.listAfter(chatId, messageId, limit));
    }

    @Override
    @Transactional
    public List<ChatMessage> findByIds(long chatId, Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return toMessages(messageRepository.findByIds(chatId, ids));
    }

    @Override
    @Transactional
    public Optional<ChatMessage> newestMessage(long chatId) {
        return Optional.ofNullable(messageRepository.newest(chatId))
                .map(PostgresChatStore::toMessage);
    }

    @Override
    @Transactional
    public List<Long> listChatIds() {
        return messageRepository.listChatIds();
    }

    @Override
    @Transactional
    public long countMessages(long chatId) {
        return messageRepository.countByChat(chatId);
    }

    @Override
    @Transactional
    public long deleteChat(long chatId) {
        long deleted = messageRepository.deleteByChat(chatId);
        LOG.infof("Deleted %d messages of chat %d", deleted, chatId);
        return deleted;
    }

    @Override
    @Transactional
    public Optional<ChatProfile> getProfile(long chatId) {
        return profileRepository.findByIdOptional(chatId).map(PostgresChatStore::toProfile);
    }

    @Override
    @Transactional
    public void upsertProfile(ChatProfile profile) {
        OffsetDateTime updatedAt =
                profile.updatedAt() != null
                        ? profile.updatedAt()
                        : OffsetDateTime.now(ZoneOffset.UTC);
        int rows =
                profileRepository.upsert(
                        profile.chatId(),
                        profile.profileText() == null ? "" : profile.profileText(),
                        profile.lastFoldedId(),
                        updatedAt);
        if (rows == 0) {
            LOG.warnf(
                    "Ignored profile update for chat %d: stored pointer is ahead of %d",
                    profile.chatId(), profile.lastFoldedId());
        }
    }

    @Override
    @Transactional
    public void deleteProfile(long chatId) {
        profileRepository.deleteById(chatId);
    }

    @Override
    @Transactional
    public Optional<String> getSetting(String key) {
        return settingRepository.findByIdOptional(key).map(SettingEntity::getValue);
    }

    @Override
    @Transactional
    public void putSetting(String key, String value) {
        if (value == null) {
            settingRepository.deleteById(key);
            return;
        }
        settingRepository.upsert(key, value);
    }

    @Override
    @Transactional
    public Map<String, String> listSettings() {
        Map<String, String> result = new LinkedHashMap<>();
        settingRepository
                .listAll()
                .stream()
                .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                .forEach(s -> result.put(s.getKey(), s.getValue()));
        return result;
    }

    private static List<ChatMessage> toMessages(List<MessageEntity> entities) {
        return entities.stream().map(PostgresChatStore::toMessage).toList();
    }

    private static ChatMessage toMessage(MessageEntity entity) {
        return new ChatMessage(
                entity.getId(),
                entity.getChatId(),
                entity.getRole(),
                entity.getKind(),
                entity.getContent(),
                entity.getPlatformMessageId(),
                entity.getReplyToId(),
                entity.getReplyToSnippet(),
                entity.getCreatedAt());
    }

    private static ChatProfile toProfile(ChatProfileEntity entity) {
        return new ChatProfile(
                entity.getChatId(),
                entity.getProfileText(),
                entity.getLastFoldedId(),
                entity.getUpdatedAt());
    }
}
