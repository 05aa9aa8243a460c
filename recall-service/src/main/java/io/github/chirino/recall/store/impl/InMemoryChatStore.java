package io.github.chirino.recall.store.impl;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.store.ChatStore;
import io.github.chirino.recall.store.ResourceNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed store used when {@code chat-recall.datastore.type=memory}. Nothing survives a
 * restart.
 */
@ApplicationScoped
public class InMemoryChatStore implements ChatStore {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, ConcurrentSkipListMap<Long, ChatMessage>> chats =
            new ConcurrentHashMap<>();
    private final Map<Long, Long> chatByMessage = new ConcurrentHashMap<>();
    private final Map<Long, ChatProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, String> settings = new ConcurrentHashMap<>();

    Clock clock = Clock.systemUTC();

    @Override
    public ChatMessage appendMessage(NewMessage message) {
        long id = sequence.incrementAndGet();
        OffsetDateTime createdAt =
                message.createdAt() != null ? message.createdAt() : OffsetDateTime.now(clock);
        ChatMessage stored =
                new ChatMessage(
                        id,
                        message.chatId(),
                        message.role(),
                        message.kind(),
                        message.content(),
                        message.platformMessageId(),
                        message.replyToId(),
                        message.replyToSnippet(),
                        createdAt);
        log(message.chatId()).put(id, stored);
        chatByMessage.put(id, message.chatId());
        return stored;
    }

    @Override
    public ChatMessage patchContent(long messageId, String content) {
        Long chatId = chatByMessage.get(messageId);
        if (chatId == null) {
            throw ResourceNotFoundException.message(messageId);
        }
        ChatMessage updated =
                log(chatId)
                        .computeIfPresent(
                                messageId,
                                (id, m) ->
                                        new ChatMessage(
                                                m.id(),
                                                m.chatId(),
                                                m.role(),
                                                m.kind(),
                                                content,
                                                m.platformMessageId(),
                                                m.replyToId(),
                                                m.replyToSnippet(),
                                                m.createdAt()));
        if (updated == null) {
            throw ResourceNotFoundException.message(messageId);
        }
        return updated;
    }

    @Override
    public Optional<ChatMessage> findMessage(long messageId) {
        Long chatId = chatByMessage.get(messageId);
        if (chatId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(log(chatId).get(messageId));
    }

    @Override
    public List<ChatMessage> listRecent(long chatId, int limit) {
        return take(log(chatId).descendingMap(), limit);
    }

    @Override
    public List<ChatMessage> listRange(long chatId, long afterId, long beforeId) {
        if (beforeId <= afterId + 1) {
            return List.of();
        }
        return new ArrayList<>(log(chatId).subMap(afterId, false, beforeId, false).values());
    }

    @Override
    public List<ChatMessage> listBefore(long chatId, long messageId, int limit) {
        return take(log(chatId).headMap(messageId, false).descendingMap(), limit);
    }

    @Override
    public List<ChatMessage> listAfter(long chatId, long messageId, int limit) {
        return take(log(chatId).tailMap(messageId, false), limit);
    }

    @Override
    public List<ChatMessage> findByIds(long chatId, Collection<Long> ids) {
        NavigableMap<Long, ChatMessage> log = log(chatId);
        TreeMap<Long, ChatMessage> found = new TreeMap<>();
        for (Long id : ids) {
            ChatMessage message = id == null ? null : log.get(id);
            if (message != null) {
                found.put(id, message);
            }
        }
        return new ArrayList<>(found.values());
    }

    @Override
    public Optional<ChatMessage> newestMessage(long chatId) {
        var last = log(chatId).lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<Long> listChatIds() {
        List<Long> ids = new ArrayList<>();
        chats.forEach(
                (chatId, log) -> {
                    if (!log.isEmpty()) {
                        ids.add(chatId);
                    }
                });
        Collections.sort(ids);
        return ids;
    }

    @Override
    public long countMessages(long chatId) {
        return log(chatId).size();
    }

    @Override
    public long deleteChat(long chatId) {
        ConcurrentSkipListMap<Long, ChatMessage> removed = chats.remove(chatId);
        if (removed == null) {
            return 0;
        }
        removed.keySet().forEach(chatByMessage::remove);
        return removed.size();
    }

    @Override
    public Optional<ChatProfile> getProfile(long chatId) {
        return Optional.ofNullable(profiles.get(chatId));
    }

    @Override
    public void upsertProfile(ChatProfile profile) {
        profiles.merge(
                profile.chatId(),
                profile,
                (stored, update) ->
                        update.lastFoldedId() >= stored.lastFoldedId() ? update : stored);
    }

    @Override
    public void deleteProfile(long chatId) {
        profiles.remove(chatId);
    }

    @Override
    public Optional<String> getSetting(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    @Override
    public void putSetting(String key, String value) {
        if (value == null) {
            settings.remove(key);
        } else {
            settings.put(key, value);
        }
    }

    @Override
    public Map<String, String> listSettings() {
        return Collections.unmodifiableMap(new TreeMap<>(settings));
    }

    private ConcurrentSkipListMap<Long, ChatMessage> log(long chatId) {
        return chats.computeIfAbsent(chatId, k -> new ConcurrentSkipListMap<>());
    }

    private static List<ChatMessage> take(Map<Long, ChatMessage> ordered, int limit) {
        List<ChatMessage> result = new ArrayList<>(Math.min(Math.max(limit, 0), 256));
        for (ChatMessage message : ordered.values()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(message);
        }
        return result;
    }
}
