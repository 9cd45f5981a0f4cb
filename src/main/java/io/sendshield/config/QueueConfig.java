package io.sendshield.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Process-wide pacing and retry settings. Immutable: the dispatch queue holds one reference
 * and swaps it atomically on update.
 */
public record QueueConfig(
        long minDelayMs,
        long maxDelayMs,
        int messagesPerMinute,
        int burstLimit,
        int maxAttempts,
        long retryDelayMs,
        boolean typingDelaySimulation
) {
    public static final long DEFAULT_MIN_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 10_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 5_000L;
    public static final int DEFAULT_MESSAGES_PER_MINUTE = 10;
    public static final int DEFAULT_BURST_LIMIT = 3;

    public static QueueConfig defaults() {
        return fromEnvironment(Map.of());
    }

    public static QueueConfig fromEnvironment(Map<String, String> env) {
        QueueConfig config = new QueueConfig(
                longEnv(env, "MESSAGE_MIN_DELAY", DEFAULT_MIN_DELAY_MS),
                longEnv(env, "MESSAGE_MAX_DELAY", DEFAULT_MAX_DELAY_MS),
                intEnv(env, "MESSAGES_PER_MINUTE", DEFAULT_MESSAGES_PER_MINUTE),
                intEnv(env, "MESSAGE_BURST_LIMIT", DEFAULT_BURST_LIMIT),
                intEnv(env, "MESSAGE_MAX_ATTEMPTS", DEFAULT_MAX_ATTEMPTS),
                longEnv(env, "MESSAGE_RETRY_DELAY", DEFAULT_RETRY_DELAY_MS),
                !"false".equalsIgnoreCase(env.getOrDefault("ENABLE_TYPING_DELAY", "true").trim())
        );
        config.validate();
        return config;
    }

    public QueueConfig merge(QueueConfigPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        QueueConfig merged = new QueueConfig(
                patch.minDelayMs() == null ? minDelayMs : patch.minDelayMs(),
                patch.maxDelayMs() == null ? maxDelayMs : patch.maxDelayMs(),
                patch.messagesPerMinute() == null ? messagesPerMinute : patch.messagesPerMinute(),
                patch.burstLimit() == null ? burstLimit : patch.burstLimit(),
                patch.maxAttempts() == null ? maxAttempts : patch.maxAttempts(),
                patch.retryDelayMs() == null ? retryDelayMs : patch.retryDelayMs(),
                patch.typingDelaySimulation() == null ? typingDelaySimulation : patch.typingDelaySimulation()
        );
        merged.validate();
        return merged;
    }

    public void validate() {
        List<String> violations = new ArrayList<>();
        if (minDelayMs < 0L) {
            violations.add("minDelayMs must be >= 0");
        }
        if (maxDelayMs < minDelayMs) {
            violations.add("maxDelayMs must be >= minDelayMs");
        }
        if (messagesPerMinute < 1) {
            violations.add("messagesPerMinute must be >= 1");
        }
        if (burstLimit < 1) {
            violations.add("burstLimit must be >= 1");
        } else if (burstLimit > messagesPerMinute) {
            violations.add("burstLimit must be <= messagesPerMinute");
        }
        if (maxAttempts < 1) {
            violations.add("maxAttempts must be >= 1");
        }
        if (retryDelayMs < 0L) {
            violations.add("retryDelayMs must be >= 0");
        }
        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }
    }

    /**
     * Width of the window in which at most {@code burstLimit} sends may land.
     */
    public long burstWindowMs() {
        return 60_000L / messagesPerMinute * burstLimit;
    }

    public List<String> diff(QueueConfig other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (minDelayMs != other.minDelayMs) changed.add("minDelayMs");
        if (maxDelayMs != other.maxDelayMs) changed.add("maxDelayMs");
        if (messagesPerMinute != other.messagesPerMinute) changed.add("messagesPerMinute");
        if (burstLimit != other.burstLimit) changed.add("burstLimit");
        if (maxAttempts != other.maxAttempts) changed.add("maxAttempts");
        if (retryDelayMs != other.retryDelayMs) changed.add("retryDelayMs");
        if (typingDelaySimulation != other.typingDelaySimulation) changed.add("typingDelaySimulation");
        return changed;
    }

    private static long longEnv(Map<String, String> env, String key, long fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(List.of(key + " is not a number: " + raw));
        }
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        long value = longEnv(env, key, fallback);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConfigException(List.of(key + " out of range: " + value));
        }
        return (int) value;
    }
}
