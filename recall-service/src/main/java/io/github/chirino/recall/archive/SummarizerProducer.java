package io.github.chirino.recall.archive;

import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SummarizerProducer {

    private static final Logger LOG = Logger.getLogger(SummarizerProducer.class);

    @ConfigProperty(name = "chat-recall.summarizer.type", defaultValue = "openai")
    String summarizerType;

    @ConfigProperty(name = "chat-recall.summarizer.openai.api-key")
    Optional<String> apiKey;

    // Fallback: picks up the generic OPENAI_API_KEY env var
    @ConfigProperty(name = "openai.api.key")
    Optional<String> genericApiKey;

    @ConfigProperty(
            name = "chat-recall.summarizer.openai.model-name",
            defaultValue = "gpt-4o-mini")
    String modelName;

    @ConfigProperty(
            name = "chat-recall.summarizer.openai.base-url",
            defaultValue = "https://api.openai.com/v1")
    String baseUrl;

    @ConfigProperty(name = "chat-recall.summarizer.temperature", defaultValue = "0.3")
    double temperature;

    @ConfigProperty(name = "chat-recall.summarizer.timeout", defaultValue = "PT60S")
    Duration timeout;

    @Produces
    @Singleton
    public Summarizer summarizer() {
        return switch (summarizerType.trim().toLowerCase()) {
            case "openai" -> openAi();
            case "none" -> new DisabledSummarizer();
            default ->
                    throw new IllegalStateException(
                            "Unsupported summarizer type: "
                                    + summarizerType
                                    + ". Valid values: openai, none");
        };
    }

    private Summarizer openAi() {
        String key = apiKey.or(() -> genericApiKey).filter(k -> !k.isBlank()).orElse(null);
        if (key == null) {
            LOG.warn("No summarizer API key configured, profile compaction is disabled");
            return new DisabledSummarizer();
        }
        OpenAiChatModel model =
                OpenAiChatModel.builder()
                        .apiKey(key)
                        .modelName(modelName)
                        .baseUrl(baseUrl)
                        .temperature(temperature)
                        .timeout(timeout)
                        .build();
        LOG.infof("Profile compaction uses %s", modelName);
        return new ChatModelSummarizer(model, modelName);
    }
}
