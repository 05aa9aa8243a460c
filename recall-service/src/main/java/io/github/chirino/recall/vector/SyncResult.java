package io.github.chirino.recall.vector;

/**
 * Outcome of one incremental index pass.
 *
 * @param indexed anchors embedded and written
 * @param skipped anchors marked as having nothing to embed
 */
public record SyncResult(Status status, int indexed, int skipped) {

    public enum Status {
        INDEXED,
        UP_TO_DATE,
        SKIPPED_COOLDOWN,
        SKIPPED_IN_FLIGHT,
        DISABLED,
        EMBEDDING_UNAVAILABLE
    }

    public static SyncResult indexed(int indexed, int skipped) {
        return new SyncResult(Status.INDEXED, indexed, skipped);
    }

    public static SyncResult of(Status status) {
        return new SyncResult(status, 0, 0);
    }

    /** Whether another pass could find more work right away. */
    public boolean hasMore() {
        return status == Status.INDEXED && indexed + skipped > 0;
    }
}
