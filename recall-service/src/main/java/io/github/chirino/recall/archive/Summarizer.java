package io.github.chirino.recall.archive;

/** Folds new conversation text into an existing long-term profile. */
public interface Summarizer {

    boolean isEnabled();

    /**
     * @param previousProfile current profile text, empty when the chat has none yet
     * @param transcript buffer messages rendered one {@code Role: content} line each
     * @return the new profile, never blank
     * @throws SummarizationFailedException when the call fails or yields nothing
     */
    String summarize(String previousProfile, String transcript);
}
