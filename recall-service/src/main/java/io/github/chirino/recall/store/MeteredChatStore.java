package io.github.chirino.recall.store;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.NewMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decorator that wraps a ChatStore implementation with timing metrics. All operations are recorded
 * using Micrometer timers with the metric name "chat.recall.store.operation" and an "operation"
 * tag identifying the method.
 */
public class MeteredChatStore implements ChatStore {

    static final String METRIC = "chat.recall.store.operation";

    private final MeterRegistry registry;
    private final ChatStore delegate;

    public MeteredChatStore(MeterRegistry registry, ChatStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    public ChatStore getDelegate() {
        return delegate;
    }

    @Override
    public ChatMessage appendMessage(NewMessage message) {
        return registry.timer(METRIC, "operation", "appendMessage")
                .record(() -> delegate.appendMessage(message));
    }

    @Override
    public ChatMessage patchContent(long messageId, String content) {
        return registry.timer(METRIC, "operation", "patchContent")
                .record(() -> delegate.patchContent(messageId, content));
    }

    @Override
    public Optional<ChatMessage> findMessage(long messageId) {
        return registry.timer(METRIC, "operation", "findMessage")
                .record(() -> delegate.findMessage(messageId));
    }

    @Override
    public List<ChatMessage> listRecent(long chatId, int limit) {
        return registry.timer(METRIC, "operation", "listRecent")
                .record(() -> delegate.listRecent(chatId, limit));
    }

    @Override
    public List<ChatMessage> listRange(long chatId, long afterId, long beforeId) {
        return registry.timer(METRIC, "operation", "listRange")
                .record(() -> delegate.listRange(chatId, afterId, beforeId));
    }

    @Override
    public List<ChatMessage> listBefore(long chatId, long messageId, int limit) {
        return registry.timer(METRIC, "operation", "listBefore")
                .record(() -> delegate.listBefore(chatId, messageId, limit));
    }

    @Override
    public List<ChatMessage> listAfter(long chatId, long messageId, int limit) {
        return registry.timer(METRIC, "operation", "listAfter")
                .record(() -> delegate.listAfter(chatId, messageId, limit));
    }

    @Override
    public List<ChatMessage> findByIds(long chatId, Collection<Long> ids) {
        return registry.timer(METRIC, "operation", "findByIds")
                .record(() -> delegate.findByIds(chatId, ids));
    }

    @Override
    public Optional<ChatMessage> newestMessage(long chatId) {
        return registry.timer(METRIC, "operation", "newestMessage")
                .record(() -> delegate.newestMessage(chatId));
    }

    @Override
    public List<Long> listChatIds() {
        return registry.timer(METRIC, "operation", "listChatIds").record(delegate::listChatIds);
    }

    @Override
    public long countMessages(long chatId) {
        return registry.timer(METRIC, "operation", "countMessages")
                .record(() -> delegate.countMessages(chatId));
    }

    @Override
    public long deleteChat(long chatId) {
        return registry.timer(METRIC, "operation", "deleteChat")
                .record(() -> delegate.deleteChat(chatId));
    }

    @Override
    public Optional<ChatProfile> getProfile(long chatId) {
        return registry.timer(METRIC, "operation", "getProfile")
                .record(() -> delegate.getProfile(chatId));
    }

    @Override
    public void upsertProfile(ChatProfile profile) {
        registry.timer(METRIC, "operation", "upsertProfile")
                .record(() -> delegate.upsertProfile(profile));
    }

    @Override
    public void deleteProfile(long chatId) {
        registry.timer(METRIC, "operation", "deleteProfile")
                .record(() -> delegate.deleteProfile(chatId));
    }

    @Override
    public Optional<String> getSetting(String key) {
        return registry.timer(METRIC, "operation", "getSetting")
                .record(() -> delegate.getSetting(key));
    }

    @Override
    public void putSetting(String key, String value) {
        registry.timer(METRIC, "operation", "putSetting")
                .record(() -> delegate.putSetting(key, value));
    }

    @Override
    public Map<String, String> listSettings() {
        return registry.timer(METRIC, "operation", "listSettings").record(delegate::listSettings);
    }
}
