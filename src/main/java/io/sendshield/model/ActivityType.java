package io.sendshield.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActivityType {
    SENT,
    FAILED,
    DISCONNECTED,
    RECONNECTED;

    public boolean messageOutcome() {
        return this == SENT || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActivityType fromWireName(String raw) {
        if (raw != null) {
            for (ActivityType type : values()) {
                if (type.wireName().equalsIgnoreCase(raw.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("unknown activity type: " + raw);
    }
}
