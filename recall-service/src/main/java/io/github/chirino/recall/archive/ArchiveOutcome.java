package io.github.chirino.recall.archive;

/**
 * Result of one archive pass for a chat.
 *
 * @param reason set only when a compaction was attempted
 * @param lastFoldedId archive pointer after the pass, or -1 when the pass never ran
 * @param foldedMessages number of buffer messages folded into the profile
 */
public record ArchiveOutcome(
        Status status, TriggerReason reason, long lastFoldedId, int foldedMessages) {

    public enum Status {
        COMPACTED,
        NOT_TRIGGERED,
        SKIPPED_IN_FLIGHT,
        SKIPPED_DEBOUNCED,
        /** The chat was reset or its pointer moved while the summarizer ran; nothing was saved. */
        DISCARDED,
        FAILED
    }

    public static ArchiveOutcome compacted(TriggerReason reason, long lastFoldedId, int folded) {
        return new ArchiveOutcome(Status.COMPACTED, reason, lastFoldedId, folded);
    }

    public static ArchiveOutcome notTriggered(long lastFoldedId) {
        return new ArchiveOutcome(Status.NOT_TRIGGERED, null, lastFoldedId, 0);
    }

    public static ArchiveOutcome skipped(Status status, long lastFoldedId) {
        return new ArchiveOutcome(status, null, lastFoldedId, 0);
    }

    public static ArchiveOutcome discarded(TriggerReason reason, long lastFoldedId) {
        return new ArchiveOutcome(Status.DISCARDED, reason, lastFoldedId, 0);
    }

    public static ArchiveOutcome failed(TriggerReason reason, long lastFoldedId) {
        return new ArchiveOutcome(Status.FAILED, reason, lastFoldedId, 0);
    }

    public static ArchiveOutcome rejected() {
        return new ArchiveOutcome(Status.FAILED, null, -1L, 0);
    }

    public boolean isCompacted() {
        return status == Status.COMPACTED;
    }
}
