package io.github.chirino.recall.vector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/** Merges overlapping match neighborhoods into chronologically ordered clusters. */
public final class ClusterMerger {

    /**
     * Messages around one matched anchor.
     *
     * @param messageIds ids in log order, including the anchor
     */
    public record Neighborhood(long anchorId, double distance, List<Long> messageIds) {

        public Neighborhood {
            if (messageIds.isEmpty()) {
                throw new IllegalArgumentException("Neighborhood of " + anchorId + " is empty");
            }
            messageIds = List.copyOf(messageIds);
        }

        long firstId() {
            return messageIds.get(0);
        }

        long lastId() {
            return messageIds.get(messageIds.size() - 1);
        }
    }

    /**
     * A contiguous slice of the log containing one or more anchors.
     *
     * @param anchorDistances distance of every anchor in the cluster, keyed by message id
     */
    public record Cluster(List<Long> messageIds, Map<Long, Double> anchorDistances) {

        public long firstId() {
            return messageIds.get(0);
        }
    }

    private ClusterMerger() {}

    /** Neighborhoods sharing at least one message end up in the same cluster. */
    public static List<Cluster> merge(List<Neighborhood> neighborhoods) {
        List<Neighborhood> sorted = new ArrayList<>(neighborhoods);
        sorted.sort(
                Comparator.comparingLong(Neighborhood::firstId)
                        .thenComparingLong(Neighborhood::lastId));

        List<Cluster> clusters = new ArrayList<>();
        TreeSet<Long> ids = null;
        Map<Long, Double> anchors = null;
        for (Neighborhood neighborhood : sorted) {
            if (ids != null && neighborhood.firstId() <= ids.last()) {
                ids.addAll(neighborhood.messageIds());
                anchors.merge(neighborhood.anchorId(), neighborhood.distance(), Math::min);
                continue;
            }
            if (ids != null) {
                clusters.add(new Cluster(List.copyOf(ids), Map.copyOf(anchors)));
            }
            ids = new TreeSet<>(neighborhood.messageIds());
            anchors = new LinkedHashMap<>();
            anchors.put(neighborhood.anchorId(), neighborhood.distance());
        }
        if (ids != null) {
            clusters.add(new Cluster(List.copyOf(ids), Map.copyOf(anchors)));
        }
        return clusters;
    }
}
