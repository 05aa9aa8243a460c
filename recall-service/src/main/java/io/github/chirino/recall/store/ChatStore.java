package io.github.chirino.recall.store;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.NewMessage;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only message log plus the per-chat derived profile and the key/value settings table.
 *
 * <p>All list operations follow log order (ascending message id) unless stated otherwise. The log
 * is the single source of truth; profiles can always be rebuilt by replaying it.
 */
public interface ChatStore {

    ChatMessage appendMessage(NewMessage message);

    /**
     * Replaces the content of an existing message, e.g. when a transcript is back-filled.
     *
     * @throws ResourceNotFoundException if the message does not exist
     */
    ChatMessage patchContent(long messageId, String content);

    Optional<ChatMessage> findMessage(long messageId);

    /** Newest messages of a chat, newest first. */
    List<ChatMessage> listRecent(long chatId, int limit);

    /** Messages with {@code afterId < id < beforeId}, ascending. */
    List<ChatMessage> listRange(long chatId, long afterId, long beforeId);

    /** Up to {@code limit} messages immediately preceding {@code messageId}, nearest first. */
    List<ChatMessage> listBefore(long chatId, long messageId, int limit);

    /** Up to {@code limit} messages immediately following {@code messageId}, nearest first. */
    List<ChatMessage> listAfter(long chatId, long messageId, int limit);

    /** Fetches the given ids restricted to the chat, ascending. Unknown ids are ignored. */
    List<ChatMessage> findByIds(long chatId, Collection<Long> ids);

    Optional<ChatMessage> newestMessage(long chatId);

    List<Long> listChatIds();

    long countMessages(long chatId);

    /** Deletes every message of the chat and returns how many were removed. */
    long deleteChat(long chatId);

    Optional<ChatProfile> getProfile(long chatId);

    void upsertProfile(ChatProfile profile);

    void deleteProfile(long chatId);

    Optional<String> getSetting(String key);

    void putSetting(String key, String value);

    Map<String, String> listSettings();
}
