package io.sendshield.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageKind {
    TEXT,
    MEDIA,
    LOCATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        for (MessageKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + raw);
    }
}
