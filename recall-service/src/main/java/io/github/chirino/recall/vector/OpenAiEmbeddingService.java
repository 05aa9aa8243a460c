package io.github.chirino.recall.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.ArrayList;
import java.util.List;

/** Embeddings from an OpenAI compatible endpoint. */
public class OpenAiEmbeddingService implements EmbeddingService {

    // Upper bound on inputs per request accepted by the embeddings endpoint.
    static final int MAX_INPUTS_PER_REQUEST = 2048;

    private final EmbeddingModel model;
    private final String modelName;
    private final int dimensions;

    public OpenAiEmbeddingService(EmbeddingModel model, String modelName, Integer dimensions) {
        this.model = model;
        this.modelName = modelName;
        this.dimensions =
                dimensions != null && dimensions > 0 ? dimensions : nativeDimensions(modelName);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += MAX_INPUTS_PER_REQUEST) {
            List<TextSegment> segments =
                    texts.subList(start, Math.min(texts.size(), start + MAX_INPUTS_PER_REQUEST))
                            .stream()
                            .map(TextSegment::from)
                            .toList();
            List<Embedding> embeddings;
            try {
                embeddings = model.embedAll(segments).content();
            } catch (RuntimeException e) {
                throw new EmbeddingUnavailableException(
                        modelId() + " request failed: " + e.getMessage(), e);
            }
            for (Embedding embedding : embeddings) {
                vectors.add(embedding.vector());
            }
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "openai/" + modelName;
    }

    // The text-embedding-3 family is trained so that shortened vectors stay meaningful.
    @Override
    public boolean supportsTruncation() {
        return modelName.startsWith("text-embedding-3");
    }

    static int nativeDimensions(String modelName) {
        return "text-embedding-3-large".equals(modelName) ? 3072 : 1536;
    }
}
