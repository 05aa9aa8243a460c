package io.github.chirino.recall.archive;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;

/** Summarizer backed by a LangChain4j chat model. */
public class ChatModelSummarizer implements Summarizer {

    static final String INSTRUCTIONS =
            "You maintain a long-term memory profile of the user.\n"
                    + "The input has two parts:\n"
                    + "1. Old Summary\n"
                    + "2. New Interaction\n\n"
                    + "Merge facts, preferences and traits from the new interaction into the"
                    + " summary. Keep it concise, objective and dense. If the interaction adds"
                    + " nothing of value, return the old summary unchanged. Answer in plain text"
                    + " without markdown.";

    private final ChatModel model;
    private final String modelName;

    public ChatModelSummarizer(ChatModel model, String modelName) {
        this.model = model;
        this.modelName = modelName;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String summarize(String previousProfile, String transcript) {
        String oldSummary = previousProfile == null ? "" : previousProfile;
        List<ChatMessage> messages =
                List.of(
                        SystemMessage.from(INSTRUCTIONS),
                        UserMessage.from(
                                "Old Summary:\n"
                                        + oldSummary
                                        + "\n\nNew Interaction:\n"
                                        + transcript));
        ChatResponse response;
        try {
            response = model.chat(messages);
        } catch (RuntimeException e) {
            throw new SummarizationFailedException(
                    "Summarization with " + modelName + " failed: " + e.getMessage(), e);
        }
        String text =
                response == null || response.aiMessage() == null
                        ? null
                        : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new SummarizationFailedException(modelName + " returned an empty profile");
        }
        return text.trim();
    }

    public String getModelName() {
        return modelName;
    }
}
