package io.github.chirino.recall.vector;

import java.util.List;

/**
 * Vectors for a batch of texts, already projected to the index dimension, or the reason they are
 * unavailable. A batch either succeeds as a whole or not at all.
 */
public record EmbeddingResult(List<float[]> vectors, String failure) {

    public static EmbeddingResult of(List<float[]> vectors) {
        return new EmbeddingResult(List.copyOf(vectors), null);
    }

    public static EmbeddingResult unavailable(String failure) {
        return new EmbeddingResult(List.of(), failure);
    }

    public boolean isAvailable() {
        return failure == null;
    }

    public float[] first() {
        if (vectors.isEmpty()) {
            throw new IllegalStateException("No vectors: " + failure);
        }
        return vectors.get(0);
    }
}
