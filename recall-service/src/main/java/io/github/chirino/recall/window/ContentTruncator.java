package io.github.chirino.recall.window;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Caps oversized message content by keeping a head and a tail slice around a visible elision
 * marker.
 *
 * <p>The output of a truncation never exceeds the ceiling, so truncating twice with the same
 * settings yields the same text. The kept slices shrink below the configured fraction when the
 * ceiling is too small to hold both of them plus the longest marker.
 */
@ApplicationScoped
public class ContentTruncator {

    static final double MAX_FRACTION = 0.45;

    static final int MAX_MARKER_LENGTH = marker(Integer.MAX_VALUE).length();

    @ConfigProperty(name = "chat-recall.window.max-chars", defaultValue = "8000")
    int maxChars;

    @ConfigProperty(name = "chat-recall.window.keep-fraction", defaultValue = "0.3")
    double keepFraction;

    @PostConstruct
    void validate() {
        if (maxChars < 100) {
            throw new IllegalStateException(
                    "chat-recall.window.max-chars must be at least 100, got " + maxChars);
        }
        if (keepFraction <= 0 || keepFraction > MAX_FRACTION) {
            throw new IllegalStateException(
                    "chat-recall.window.keep-fraction must be in (0, "
                            + MAX_FRACTION
                            + "], got "
                            + keepFraction);
        }
    }

    public String truncate(String content) {
        return truncate(content, maxChars, keepFraction);
    }

    public static String truncate(String content, int maxChars, double keepFraction) {
        if (content == null) {
            return "";
        }
        if (content.length() <= maxChars) {
            return content;
        }
        // The tail may grow by one char when its start backs off a surrogate pair.
        int keep =
                Math.max(
                        0,
                        Math.min(
                                (int) Math.floor(maxChars * keepFraction),
                                (maxChars - MAX_MARKER_LENGTH - 1) / 2));
        int headEnd = safeBoundary(content, keep);
        int tailStart = safeBoundary(content, content.length() - keep);
        return content.substring(0, headEnd)
                + marker(tailStart - headEnd)
                + content.substring(tailStart);
    }

    private static String marker(int elided) {
        return "\n...[truncated " + elided + " chars]...\n";
    }

    // Never split a surrogate pair.
    private static int safeBoundary(String text, int index) {
        if (index > 0
                && index < text.length()
                && Character.isHighSurrogate(text.charAt(index - 1))
                && Character.isLowSurrogate(text.charAt(index))) {
            return index - 1;
        }
        return index;
    }
}
