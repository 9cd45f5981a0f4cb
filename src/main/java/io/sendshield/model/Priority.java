package io.sendshield.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high", 0),
    NORMAL("normal", 1),
    LOW("low", 2);

    private final String wireName;
    private final int rank;

    Priority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Sort key: lower rank dispatches first.
     */
    public int rank() {
        return rank;
    }

    @JsonCreator
    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }

    public static Priority fromRank(int rank) {
        for (Priority value : values()) {
            if (value.rank == rank) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }
}
