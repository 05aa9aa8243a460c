package io.github.chirino.recall.vector;

import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Chooses the embedding backend from {@code chat-recall.embedding.type}: {@code local} (bundled
 * ONNX model), {@code openai}, {@code hash} (offline feature hashing) or {@code none}.
 */
@ApplicationScoped
public class EmbeddingServiceProducer {

    private static final Logger LOG = Logger.getLogger(EmbeddingServiceProducer.class);

    @ConfigProperty(name = "chat-recall.embedding.type", defaultValue = "local")
    String embeddingType;

    @ConfigProperty(name = "chat-recall.embedding.openai.api-key")
    Optional<String> openaiApiKey;

    // OPENAI_API_KEY from the environment
    @ConfigProperty(name = "openai.api.key")
    Optional<String> genericOpenaiApiKey;

    @ConfigProperty(
            name = "chat-recall.embedding.openai.model-name",
            defaultValue = "text-embedding-3-small")
    String openaiModelName;

    @ConfigProperty(
            name = "chat-recall.embedding.openai.base-url",
            defaultValue = "https://api.openai.com/v1")
    String openaiBaseUrl;

    @ConfigProperty(name = "chat-recall.embedding.openai.dimensions")
    Optional<Integer> openaiDimensions;

    @ConfigProperty(name = "chat-recall.embedding.openai.timeout", defaultValue = "PT30S")
    Duration openaiTimeout;

    @ConfigProperty(name = "chat-recall.embedding.hash.dimension", defaultValue = "384")
    int hashDimension;

    @Produces
    @Singleton
    public EmbeddingService embeddingService() {
        EmbeddingService service =
                switch (embeddingType.trim().toLowerCase()) {
                    case "local" -> new LocalEmbeddingService();
                    case "openai" -> openAi();
                    case "hash" -> new HashEmbeddingService(hashDimension);
                    case "none" ->
                            new DisabledEmbeddingService("chat-recall.embedding.type=none");
                    default ->
                            throw new IllegalStateException(
                                    "Unsupported embedding type: "
                                            + embeddingType
                                            + ". Valid values: local, openai, hash, none");
                };
        LOG.infof("Embedding backend: %s", service.modelId());
        return service;
    }

    private EmbeddingService openAi() {
        String key =
                openaiApiKey.or(() -> genericOpenaiApiKey).filter(k -> !k.isBlank()).orElse(null);
        if (key == null) {
            LOG.warn("No embedding API key configured, semantic recall is disabled");
            return new DisabledEmbeddingService("no OpenAI API key");
        }
        var builder =
                OpenAiEmbeddingModel.builder()
                        .apiKey(key)
                        .modelName(openaiModelName)
                        .baseUrl(openaiBaseUrl)
                        .timeout(openaiTimeout);
        openaiDimensions.filter(d -> d > 0).ifPresent(builder::dimensions);
        return new OpenAiEmbeddingService(
                builder.build(), openaiModelName, openaiDimensions.orElse(null));
    }
}
