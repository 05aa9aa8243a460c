package io.github.chirino.recall.archive;

/** The summarization capability could not produce a new profile. */
public class SummarizationFailedException extends RuntimeException {

    public SummarizationFailedException(String message) {
        super(message);
    }

    public SummarizationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
