package io.github.chirino.recall.window;

/**
 * Token accounting of a chat at one point in time.
 *
 * <p>The active window, the buffer {@code (lastArchivedId, windowStartId)} and the folded prefix
 * {@code <= lastArchivedId} partition the log.
 */
public record WindowStats(
        long chatId,
        int targetTokens,
        int windowTokens,
        int windowMessages,
        long windowStartId,
        int bufferTokens,
        int bufferMessages,
        long lastArchivedId) {

    public boolean hasBuffer() {
        return bufferMessages > 0;
    }

    /** Window usage relative to the budget, in percent, rounded to one decimal. */
    public double usagePercent() {
        if (targetTokens <= 0) {
            return 0.0;
        }
        return Math.round(windowTokens * 1000.0 / targetTokens) / 10.0;
    }
}
