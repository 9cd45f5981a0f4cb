package io.sendshield.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageStatus {
    PENDING,
    PROCESSING,
    SENT,
    FAILED;

    public boolean active() {
        return this == PENDING || this == PROCESSING;
    }

    public boolean terminal() {
        return this == SENT || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageStatus fromString(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
