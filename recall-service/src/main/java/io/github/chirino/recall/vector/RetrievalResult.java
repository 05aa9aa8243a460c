package io.github.chirino.recall.vector;

import java.util.List;

/**
 * Supplementary context found for a query. Every status other than {@link Status#MATCHED} comes
 * with an empty block.
 */
public record RetrievalResult(Status status, String block, List<ClusterMerger.Cluster> clusters) {

    public enum Status {
        MATCHED,
        NO_MATCH,
        QUERY_TOO_SHORT,
        EMBEDDING_UNAVAILABLE,
        DISABLED
    }

    public static RetrievalResult of(Status status) {
        return new RetrievalResult(status, "", List.of());
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }
}
