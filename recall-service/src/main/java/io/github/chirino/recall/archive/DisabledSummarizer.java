package io.github.chirino.recall.archive;

public class DisabledSummarizer implements Summarizer {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String summarize(String previousProfile, String transcript) {
        throw new SummarizationFailedException("Summarizer is disabled");
    }
}
