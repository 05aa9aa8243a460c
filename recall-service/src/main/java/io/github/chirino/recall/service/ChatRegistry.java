package io.github.chirino.recall.service;

import io.github.chirino.recall.archive.ArchiveState;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Process-wide owner of per-chat {@link ChatHandle}s.
 *
 * <p>Handles are created on first use and evicted by {@link #evictIdle()} once they are unlocked,
 * not compacting, not cooling down and unused for {@code chat-recall.registry.idle-eviction}.
 * Operations on different chats never contend.
 */
@ApplicationScoped
public class ChatRegistry {

    private static final Logger LOG = Logger.getLogger(ChatRegistry.class);

    @ConfigProperty(name = "chat-recall.registry.idle-eviction", defaultValue = "PT30M")
    Duration idleEviction;

    Clock clock = Clock.systemUTC();

    private final ConcurrentMap<Long, ChatHandle> handles = new ConcurrentHashMap<>();

    public ChatHandle handle(long chatId) {
        Instant now = clock.instant();
        ChatHandle handle = handles.computeIfAbsent(chatId, id -> new ChatHandle(id, now));
        handle.touch(now);
        return handle;
    }

    /** Runs {@code action} while holding the chat's lock. */
    public <T> T withChatLock(long chatId, Supplier<T> action) {
        ChatHandle handle = lockHandle(chatId);
        try {
            return action.get();
        } finally {
            handle.touch(clock.instant());
            handle.lock().unlock();
        }
    }

    public void withChatLock(long chatId, Runnable action) {
        withChatLock(
                chatId,
                () -> {
                    action.run();
                    return null;
                });
    }

    /** Drops idle handles and returns how many were removed. */
    public int evictIdle() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(idleEviction);
        int before = handles.size();
        for (Long chatId : handles.keySet()) {
            handles.computeIfPresent(
                    chatId, (id, handle) -> handle.isEvictable(now, cutoff) ? null : handle);
        }
        int evicted = before - handles.size();
        if (evicted > 0) {
            LOG.debugf("Evicted %d idle chat handles, %d remain", evicted, handles.size());
        }
        return evicted;
    }

    /** Ends the indexing cooldown of every tracked chat. */
    public void clearIndexCooldowns() {
        handles.values().forEach(ChatHandle::clearIndexCooldown);
    }

    /**
     * Returns a chat to its initial state after its data was wiped. Caller holds the lock. A
     * compaction in flight keeps its state; it notices the reset when it commits.
     */
    public void resetState(long chatId) {
        ChatHandle handle = handles.get(chatId);
        if (handle != null) {
            handle.settleArchiveState(ArchiveState.IDLE);
            handle.setLastArchiveAttempt(Instant.EPOCH);
            handle.clearIndexCooldown();
        }
    }

    public boolean isTracked(long chatId) {
        return handles.containsKey(chatId);
    }

    public int size() {
        return handles.size();
    }

    // A handle evicted between lookup and lock is retried so that two threads never hold
    // different locks for the same chat.
    private ChatHandle lockHandle(long chatId) {
        while (true) {
            ChatHandle handle = handle(chatId);
            handle.lock().lock();
            if (handles.get(chatId) == handle) {
                return handle;
            }
            handle.lock().unlock();
        }
    }
}
