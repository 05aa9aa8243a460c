package io.github.chirino.recall.vector;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Single entry point to the embedding backend. Backend failures come back as an unavailable
 * {@link EmbeddingResult} and every vector is projected to {@code chat-recall.vector.dimension}.
 */
@ApplicationScoped
public class EmbeddingGateway {

    private static final Logger LOG = Logger.getLogger(EmbeddingGateway.class);

    static final String FAILURE_METRIC = "chat.recall.embedding.failures";

    @Inject EmbeddingService embeddingService;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "chat-recall.vector.dimension", defaultValue = "384")
    int dimension;

    @PostConstruct
    void validate() {
        if (!embeddingService.isEnabled()) {
            LOG.info("Embeddings are disabled, semantic recall is off");
            return;
        }
        if (dimension <= 0) {
            throw new IllegalStateException(
                    "chat-recall.vector.dimension must be positive, got " + dimension);
        }
        int nativeDimension = embeddingService.dimensions();
        if (dimension > nativeDimension) {
            throw new IllegalStateException(
                    "chat-recall.vector.dimension "
                            + dimension
                            + " exceeds the native dimension "
                            + nativeDimension
                            + " of "
                            + embeddingService.modelId());
        }
        if (dimension < nativeDimension && !embeddingService.supportsTruncation()) {
            LOG.warnf(
                    "%s is not known to support truncated embeddings; cutting %d dimensions to %d"
                            + " may degrade recall",
                    embeddingService.modelId(), nativeDimension, dimension);
        }
        LOG.infof(
                "Embedding with %s, index dimension %d", embeddingService.modelId(), dimension);
    }

    public boolean isEnabled() {
        return embeddingService.isEnabled();
    }

    public int dimension() {
        return dimension;
    }

    public String modelId() {
        return embeddingService.modelId();
    }

    public EmbeddingResult embed(String text) {
        return embedAll(List.of(text));
    }

    public EmbeddingResult embedAll(List<String> texts) {
        if (!embeddingService.isEnabled()) {
            return EmbeddingResult.unavailable("embeddings disabled");
        }
        if (texts.isEmpty()) {
            return EmbeddingResult.of(List.of());
        }
        List<float[]> raw;
        try {
            raw = embeddingService.embedAll(texts);
        } catch (RuntimeException e) {
            return failure(texts.size(), e.getMessage() == null ? e.toString() : e.getMessage());
        }
        if (raw == null || raw.size() != texts.size()) {
            int returned = raw == null ? 0 : raw.size();
            return failure(
                    texts.size(),
                    "backend returned " + returned + " vectors for " + texts.size() + " texts");
        }
        List<float[]> projected = new ArrayList<>(raw.size());
        for (float[] vector : raw) {
            if (vector == null || vector.length < dimension) {
                return failure(texts.size(), "backend returned a vector of unexpected dimension");
            }
            projected.add(VectorProjection.project(vector, dimension));
        }
        return EmbeddingResult.of(projected);
    }

    private EmbeddingResult failure(int count, String reason) {
        meterRegistry.counter(FAILURE_METRIC, "model", embeddingService.modelId()).increment();
        LOG.warnf("Embedding %d texts with %s failed: %s", count, modelId(), reason);
        return EmbeddingResult.unavailable(reason);
    }
}
