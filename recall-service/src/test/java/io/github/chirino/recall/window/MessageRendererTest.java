package io.github.chirino.recall.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.MessageKind;
import io.github.chirino.recall.model.MessageRole;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class MessageRendererTest {

    private static final OffsetDateTime TIME =
            OffsetDateTime.of(2024, 5, 1, 10, 0, 5, 0, ZoneOffset.UTC);

    @Test
    void renders_metadata_and_reply_snippet() {
        MessageRenderer renderer = TestWindow.renderer();
        ChatMessage message =
                new ChatMessage(
                        1L,
                        7L,
                        MessageRole.USER,
                        MessageKind.VOICE,
                        "see you",
                        null,
                        3L,
                        "earlier text..",
                        TIME);

        assertEquals(
                "[2024-05-01 10:00:05] User (voice) (Reply to \"earlier text..\"): see you",
                renderer.render(message));
        assertEquals("User: see you", renderer.transcriptLine(message));
        assertTrue(renderer.cost(message) > 0);
    }

    @Test
    void formats_times_in_the_display_zone() {
        MessageRenderer renderer = TestWindow.renderer();
        renderer.timezone = "Asia/Shanghai";

        assertEquals("2024-05-01 18:00", renderer.shortTime(TIME));
    }

    @Test
    void unknown_zone_falls_back_to_utc() {
        MessageRenderer renderer = TestWindow.renderer();
        renderer.timezone = "Mars/Olympus";

        assertEquals("2024-05-01 10:00", renderer.shortTime(TIME));
        assertEquals("unknown time", renderer.shortTime(null));
    }
}
