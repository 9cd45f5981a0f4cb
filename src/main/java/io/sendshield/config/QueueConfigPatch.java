package io.sendshield.config;

/**
 * Partial {@link QueueConfig}. Null fields keep the current value.
 */
public record QueueConfigPatch(
        Long minDelayMs,
        Long maxDelayMs,
        Integer messagesPerMinute,
        Integer burstLimit,
        Integer maxAttempts,
        Long retryDelayMs,
        Boolean typingDelaySimulation
) {
    public static final QueueConfigPatch EMPTY = new QueueConfigPatch(null, null, null, null, null, null, null);

    public static QueueConfigPatch messagesPerMinute(int value) {
        return new QueueConfigPatch(null, null, value, null, null, null, null);
    }

    public boolean isEmpty() {
        return minDelayMs == null
                && maxDelayMs == null
                && messagesPerMinute == null
                && burstLimit == null
                && maxAttempts == null
                && retryDelayMs == null
                && typingDelaySimulation == null;
    }
}
