package io.github.chirino.recall.vector;

import io.github.chirino.recall.model.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the text embedded for an assistant anchor: the contiguous run of user messages right
 * before it followed by the reply, one {@code Role: content} line each.
 */
public final class ContextFusion {

    private ContextFusion() {}

    /**
     * @param anchor the assistant message being indexed
     * @param preceding messages immediately before the anchor, nearest first
     * @return the fused text, or an empty string when the anchor has nothing to embed
     */
    public static String fuse(ChatMessage anchor, List<ChatMessage> preceding) {
        String reply = ContentSanitizer.sanitize(anchor.content());
        if (reply.isEmpty()) {
            return "";
        }
        List<String> questions = new ArrayList<>();
        for (ChatMessage message : preceding) {
            if (!message.isUser()) {
                break;
            }
            String text = ContentSanitizer.sanitize(message.content());
            if (!text.isEmpty()) {
                questions.add(message.role().label() + ": " + text);
            }
        }
        Collections.reverse(questions);

        StringBuilder fused = new StringBuilder();
        for (String question : questions) {
            fused.append(question).append('\n');
        }
        fused.append(anchor.role().label()).append(": ").append(reply);
        return fused.toString();
    }
}
