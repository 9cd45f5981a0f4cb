package io.sendshield.runtime;

import java.util.Locale;

public enum StoreKind {
    MEMORY,
    SQLITE;

    public static StoreKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEMORY;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown store: " + raw + " (expected memory or sqlite)", e);
        }
    }
}
