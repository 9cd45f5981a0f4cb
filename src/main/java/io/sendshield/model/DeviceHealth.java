package io.sendshield.model;

import java.util.List;

public record DeviceHealth(
        String accountId,
        int score,
        HealthStatus status,
        HealthMetrics metrics,
        List<String> warnings,
        long lastUpdatedMs
) {
    public DeviceHealth {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean needsAttention() {
        return status != HealthStatus.HEALTHY;
    }
}
