package io.github.chirino.recall.archive;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SummarizerProducerTest {

    private SummarizerProducer createProducer(String type) {
        SummarizerProducer producer = new SummarizerProducer();
        producer.summarizerType = type;
        producer.apiKey = Optional.empty();
        producer.genericApiKey = Optional.empty();
        producer.modelName = "gpt-4o-mini";
        producer.baseUrl = "https://api.openai.com/v1";
        producer.temperature = 0.3;
        producer.timeout = Duration.ofSeconds(60);
        return producer;
    }

    @Test
    void missing_api_key_disables_summarization() {
        Summarizer summarizer = createProducer("openai").summarizer();

        assertInstanceOf(DisabledSummarizer.class, summarizer);
        assertFalse(summarizer.isEnabled());
        assertThrows(SummarizationFailedException.class, () -> summarizer.summarize("", "x"));
    }

    @Test
    void selects_chat_model_when_key_is_present() {
        SummarizerProducer producer = createProducer("openai");
        producer.genericApiKey = Optional.of("sk-generic-key");

        Summarizer summarizer = producer.summarizer();

        assertInstanceOf(ChatModelSummarizer.class, summarizer);
        assertTrue(summarizer.isEnabled());
    }

    @Test
    void rejects_unknown_type() {
        SummarizerProducer producer = createProducer("claude");

        IllegalStateException ex = assertThrows(IllegalStateException.class, producer::summarizer);
        assertTrue(ex.getMessage().contains("claude"));
    }
}
