package io.github.chirino.recall.vector;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Deterministic bag-of-words feature hashing. Useful offline and in tests: texts sharing words
 * end up close in cosine distance.
 */
public class HashEmbeddingService implements EmbeddingService {

    private final int dimension;

    public HashEmbeddingService(int dimension) {
        this.dimension = Math.max(8, dimension);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            int hash = stableHash(token);
            int index = Math.floorMod(hash, dimension);
            float sign = (hash & 0x100) == 0 ? 1.0f : -1.0f;
            vector[index] += sign;
        }
        return VectorProjection.normalize(vector);
    }

    @Override
    public int dimensions() {
        return dimension;
    }

    @Override
    public String modelId() {
        return "hash/" + dimension;
    }

    // FNV-1a
    private static int stableHash(String token) {
        byte[] data = token.getBytes(StandardCharsets.UTF_8);
        int hash = 0x811C9DC5;
        for (byte b : data) {
            hash ^= b & 0xff;
            hash *= 0x01000193;
        }
        return hash;
    }
}
