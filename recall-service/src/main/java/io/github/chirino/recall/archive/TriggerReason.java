package io.github.chirino.recall.archive;

/** Why a compaction fired. */
public enum TriggerReason {
    /** The buffer reached the configured token threshold. */
    THRESHOLD,
    /** The buffer is non-empty and the chat has been quiet longer than the idle threshold. */
    IDLE
}
