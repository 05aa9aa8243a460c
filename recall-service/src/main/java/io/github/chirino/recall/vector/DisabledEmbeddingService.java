package io.github.chirino.recall.vector;

import java.util.List;

/** Backend used when semantic recall is switched off; every call fails with the reason. */
public class DisabledEmbeddingService implements EmbeddingService {

    private final String reason;

    public DisabledEmbeddingService(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public float[] embed(String text) {
        throw new EmbeddingUnavailableException("Embeddings are disabled: " + reason);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        throw new EmbeddingUnavailableException("Embeddings are disabled: " + reason);
    }

    @Override
    public int dimensions() {
        return 0;
    }

    @Override
    public String modelId() {
        return "none";
    }
}
