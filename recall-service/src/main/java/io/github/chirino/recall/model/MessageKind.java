package io.github.chirino.recall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageKind {
    TEXT,
    VOICE,
    IMAGE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageKind fromString(String value) {
        if (value == null) {
            return TEXT;
        }
        return MessageKind.valueOf(value.trim().toUpperCase());
    }
}
