package io.github.chirino.recall.window;

import io.github.chirino.recall.model.ChatMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Renders messages into the text form that is costed against the token budget and shown to the
 * model: {@code [2024-05-01 10:00:00] User (text) (Reply to "…"): content}.
 */
@ApplicationScoped
public class MessageRenderer {

    private static final Logger LOG = Logger.getLogger(MessageRenderer.class);

    static final DateTimeFormatter FULL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final DateTimeFormatter SHORT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    @ConfigProperty(name = "chat-recall.display.timezone", defaultValue = "UTC")
    String timezone;

    @Inject ContentTruncator truncator;

    @Inject TokenCounter tokenCounter;

    private volatile ZoneId zone;

    public String render(ChatMessage message) {
        StringBuilder line = new StringBuilder(64 + message.content().length());
        line.append('[').append(format(message.createdAt(), FULL_TIME)).append("] ");
        line.append(message.role().label());
        line.append(" (").append(message.kind().toValue()).append(')');
        if (message.replyToSnippet() != null && !message.replyToSnippet().isBlank()) {
            line.append(" (Reply to \"").append(message.replyToSnippet()).append("\")");
        }
        line.append(": ").append(truncator.truncate(message.content()));
        return line.toString();
    }

    /** Token cost of the rendered message. */
    public int cost(ChatMessage message) {
        return tokenCounter.count(render(message));
    }

    /** {@code Role: content} line used for summarization input. */
    public String transcriptLine(ChatMessage message) {
        return message.role().label() + ": " + truncator.truncate(message.content());
    }

    public String format(OffsetDateTime time, DateTimeFormatter formatter) {
        if (time == null) {
            return "unknown time";
        }
        return time.atZoneSameInstant(zone()).format(formatter);
    }

    public String shortTime(OffsetDateTime time) {
        return format(time, SHORT_TIME);
    }

    private ZoneId zone() {
        ZoneId resolved = zone;
        if (resolved == null) {
            try {
                resolved = ZoneId.of(timezone == null ? "UTC" : timezone.trim());
            } catch (DateTimeException e) {
                LOG.warnf("Unknown display timezone '%s', using UTC", timezone);
                resolved = ZoneOffset.UTC;
            }
            zone = resolved;
        }
        return resolved;
    }
}
