package io.github.chirino.recall.vector;

import java.util.ArrayList;
import java.util.List;

/** Turns text into embedding vectors at the backend's native dimension. */
public interface EmbeddingService {

    boolean isEnabled();

    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    int dimensions();

    String modelId();

    /**
     * Whether the leading dimensions of a vector are meaningful on their own, so that the vector
     * can be cut down to a shorter prefix.
     */
    default boolean supportsTruncation() {
        return false;
    }
}
