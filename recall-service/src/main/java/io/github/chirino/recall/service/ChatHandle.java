package io.github.chirino.recall.service;

import io.github.chirino.recall.archive.ArchiveState;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process state of one chat: its mutual-exclusion lock plus the trigger bookkeeping of the
 * archive and indexing jobs. Handles are created lazily by {@link ChatRegistry}.
 */
public final class ChatHandle {

    private final long chatId;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicReference<ArchiveState> archiveState =
            new AtomicReference<>(ArchiveState.IDLE);
    private final AtomicBoolean indexing = new AtomicBoolean();
    private volatile Instant lastArchiveAttempt = Instant.EPOCH;
    private volatile Instant indexCooldownUntil = Instant.EPOCH;
    private volatile Instant lastAccess;

    ChatHandle(long chatId, Instant now) {
        this.chatId = chatId;
        this.lastAccess = now;
    }

    public long getChatId() {
        return chatId;
    }

    ReentrantLock lock() {
        return lock;
    }

    public ArchiveState getArchiveState() {
        return archiveState.get();
    }

    /**
     * Records the state observed by a pass that does not own the chat. A running compaction is
     * left alone; only its owner may end it through {@link #endCompaction(ArchiveState)}.
     */
    public void settleArchiveState(ArchiveState state) {
        archiveState.updateAndGet(current -> current == ArchiveState.COMPACTING ? current : state);
    }

    /** Leaves {@link ArchiveState#COMPACTING}; called by the pass that began the compaction. */
    public void endCompaction(ArchiveState next) {
        archiveState.compareAndSet(ArchiveState.COMPACTING, next);
    }

    /**
     * Moves the chat into {@link ArchiveState#COMPACTING} unless a compaction is already running.
     *
     * @return false when another compaction owns the chat
     */
    public boolean tryBeginCompaction() {
        while (true) {
            ArchiveState current = archiveState.get();
            if (current == ArchiveState.COMPACTING) {
                return false;
            }
            if (archiveState.compareAndSet(current, ArchiveState.COMPACTING)) {
                return true;
            }
        }
    }

    public boolean tryBeginIndexing() {
        return indexing.compareAndSet(false, true);
    }

    public void endIndexing() {
        indexing.set(false);
    }

    public boolean isIndexing() {
        return indexing.get();
    }

    public Instant getLastArchiveAttempt() {
        return lastArchiveAttempt;
    }

    public void setLastArchiveAttempt(Instant lastArchiveAttempt) {
        this.lastArchiveAttempt = lastArchiveAttempt;
    }

    public Instant getIndexCooldownUntil() {
        return indexCooldownUntil;
    }

    public boolean isIndexCoolingDown(Instant now) {
        return now.isBefore(indexCooldownUntil);
    }

    public void startIndexCooldown(Instant until) {
        this.indexCooldownUntil = until;
    }

    public void clearIndexCooldown() {
        this.indexCooldownUntil = Instant.EPOCH;
    }

    Instant getLastAccess() {
        return lastAccess;
    }

    void touch(Instant now) {
        this.lastAccess = now;
    }

    boolean isEvictable(Instant now, Instant idleCutoff) {
        return !lock.isLocked()
                && !lock.hasQueuedThreads()
                && !indexing.get()
                && archiveState.get() != ArchiveState.COMPACTING
                && !isIndexCoolingDown(now)
                && lastAccess.isBefore(idleCutoff);
    }
}
