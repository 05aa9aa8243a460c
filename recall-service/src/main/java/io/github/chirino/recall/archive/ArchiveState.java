package io.github.chirino.recall.archive;

/** Per-chat state of the archive trigger. */
public enum ArchiveState {
    /** Nothing waits outside the active window. */
    IDLE,
    /** Messages have left the window but no compaction fired yet. */
    BUFFER_GROWING,
    /** A summarization call is in flight for the chat. */
    COMPACTING
}
