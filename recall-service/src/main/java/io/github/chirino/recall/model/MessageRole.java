package io.github.chirino.recall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    USER("User"),
    ASSISTANT("Assistant"),
    SYSTEM("System");

    private final String label;

    MessageRole(String label) {
        this.label = label;
    }

    /** Capitalized name used when rendering transcripts, e.g. {@code User: hi}. */
    public String label() {
        return label;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageRole fromString(String value) {
        if (value == null) {
            return null;
        }
        return MessageRole.valueOf(value.trim().toUpperCase());
    }
}
