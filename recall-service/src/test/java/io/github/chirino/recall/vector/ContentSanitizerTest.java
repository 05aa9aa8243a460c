package io.github.chirino.recall.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ContentSanitizerTest {

    @Test
    void keeps_only_chat_wrapper_content_when_present() {
        String content =
                "<thinking>internal</thinking><chat reply=\"12\"> Sure,\n  see you </chat>"
                        + " trailing <chat>tomorrow</chat>";

        assertEquals("Sure, see you tomorrow", ContentSanitizer.sanitize(content));
    }

    @Test
    void strips_tags_and_collapses_whitespace_without_wrappers() {
        assertEquals(
                "hello bold world", ContentSanitizer.sanitize("  hello <b>bold</b>\n\n world "));
    }

    @Test
    void rewrites_image_summaries_and_drops_placeholders() {
        assertEquals(
                "Image content: a cat on a sofa",
                ContentSanitizer.sanitize("[Image Summary: a cat on a sofa]"));
        assertEquals("", ContentSanitizer.sanitize("[Voice: Processing...]"));
        assertEquals("look", ContentSanitizer.sanitize("[Image: Processing...] look"));
    }

    @Test
    void null_and_empty_become_empty() {
        assertEquals("", ContentSanitizer.sanitize(null));
        assertEquals("", ContentSanitizer.sanitize(""));
    }
}
