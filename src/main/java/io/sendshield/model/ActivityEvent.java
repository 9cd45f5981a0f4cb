package io.sendshield.model;

public record ActivityEvent(
        ActivityType type,
        long timestampMs,
        Long latencyMs,
        String error
) {
    public static ActivityEvent sent(long timestampMs, long latencyMs) {
        return new ActivityEvent(ActivityType.SENT, timestampMs, latencyMs, null);
    }

    public static ActivityEvent failed(long timestampMs, String error) {
        return new ActivityEvent(ActivityType.FAILED, timestampMs, null, error);
    }

    public static ActivityEvent disconnected(long timestampMs) {
        return disconnected(timestampMs, null);
    }

    public static ActivityEvent disconnected(long timestampMs, String reason) {
        return new ActivityEvent(ActivityType.DISCONNECTED, timestampMs, null, reason);
    }

    public static ActivityEvent reconnected(long timestampMs) {
        return new ActivityEvent(ActivityType.RECONNECTED, timestampMs, null, null);
    }
}
