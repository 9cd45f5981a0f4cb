package io.sendshield.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    HEALTHY(80),
    WARNING(50),
    CRITICAL(20),
    BLOCKED(0);

    private final int minScore;

    HealthStatus(int minScore) {
        this.minScore = minScore;
    }

    public int minScore() {
        return minScore;
    }

    public static HealthStatus fromScore(int score) {
        if (score >= HEALTHY.minScore) {
            return HEALTHY;
        }
        if (score >= WARNING.minScore) {
            return WARNING;
        }
        if (score >= CRITICAL.minScore) {
            return CRITICAL;
        }
        return BLOCKED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
