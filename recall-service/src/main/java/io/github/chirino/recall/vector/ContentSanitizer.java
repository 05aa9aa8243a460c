package io.github.chirino.recall.vector;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces stored message content to the text worth embedding. Applied identically when indexing
 * and when querying.
 */
public final class ContentSanitizer {

    private static final Pattern IMAGE_SUMMARY =
            Pattern.compile("\\[Image Summary\\s*:(.*?)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHAT_WRAPPER =
            Pattern.compile("<chat[^>]*>(.*?)</chat>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final List<String> PLACEHOLDERS =
            List.of("[Voice: Processing...]", "[Image: Processing...]");

    private ContentSanitizer() {}

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = IMAGE_SUMMARY.matcher(text).replaceAll("Image content:$1");
        for (String placeholder : PLACEHOLDERS) {
            cleaned = cleaned.replace(placeholder, "");
        }

        Matcher wrapped = CHAT_WRAPPER.matcher(cleaned);
        List<String> inner = new ArrayList<>();
        while (wrapped.find()) {
            inner.add(wrapped.group(1).strip());
        }
        if (!inner.isEmpty()) {
            return collapse(String.join(" ", inner));
        }
        return collapse(TAG.matcher(cleaned).replaceAll(""));
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
