package io.github.chirino.recall.vector;

import java.util.Arrays;
import java.util.Locale;

/** Fits native embeddings into the fixed width of the vector index. */
public final class VectorProjection {

    private VectorProjection() {}

    /**
     * Keeps the leading {@code dimension} components and rescales the result to unit length.
     *
     * @throws IllegalArgumentException if the vector is shorter than {@code dimension}
     */
    public static float[] project(float[] vector, int dimension) {
        if (vector.length < dimension) {
            throw new IllegalArgumentException(
                    "Vector of dimension "
                            + vector.length
                            + " cannot be projected to "
                            + dimension);
        }
        return normalize(Arrays.copyOf(vector, dimension));
    }

    /** Scales the vector to unit length in place; an all-zero vector is returned unchanged. */
    static float[] normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        if (sum <= 0.0) {
            return vector;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = vector[i] / norm;
        }
        return vector;
    }

    /** Cosine distance, {@code 1 - cos}. Zero vectors are at distance 1 from everything. */
    public static double cosineDistance(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        int n = Math.min(a.length, b.length);
        for (int i = 0; i < n; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 1.0;
        }
        return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** pgvector text literal, e.g. {@code [0.100000,0.200000]}. */
    public static String toPgVectorLiteral(float[] vector) {
        StringBuilder builder = new StringBuilder(vector.length * 10 + 2);
        builder.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%.6f", vector[i]));
        }
        builder.append(']');
        return builder.toString();
    }
}
