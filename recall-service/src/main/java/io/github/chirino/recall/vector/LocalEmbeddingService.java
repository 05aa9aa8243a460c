package io.github.chirino.recall.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Quantized all-MiniLM-L6-v2 running in-process through ONNX. The model is loaded on first use so
 * that deployments with recall turned off never pay for it.
 */
public class LocalEmbeddingService implements EmbeddingService {

    static final int DIMENSIONS = 384;

    private static final class ModelHolder {
        static final EmbeddingModel MODEL = new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public float[] embed(String text) {
        return ModelHolder.MODEL.embed(text).content().vector();
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String text : texts) {
            segments.add(TextSegment.from(text));
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (Embedding embedding : ModelHolder.MODEL.embedAll(segments).content()) {
            vectors.add(embedding.vector());
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return DIMENSIONS;
    }

    @Override
    public String modelId() {
        return "local/all-MiniLM-L6-v2";
    }
}
