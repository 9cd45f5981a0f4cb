package io.sendshield.model;

public record HealthMetrics(
        int messagesPerHour,
        double successRate,
        int outcomeSample,
        double avgResponseTimeMs,
        int disconnectionCount24h,
        long lastActivityAtMs,
        boolean warmupPhase,
        long warmupStartedAtMs
) {
}
