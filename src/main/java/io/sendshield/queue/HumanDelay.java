package io.sendshield.queue;

import io.sendshield.config.QueueConfig;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Initial hold applied at enqueue time so that consecutive messages do not leave at machine
 * cadence. Busy accounts draw from the upper part of the configured range.
 */
final class HumanDelay {
    static final long RECENT_SEND_MS = 30_000L;

    private HumanDelay() {
    }

    static long pick(QueueConfig config, Long lastSendAtMs, int sentInLastMinute, long nowMs) {
        long min = config.minDelayMs();
        long max = config.maxDelayMs();
        if (max <= 0L) {
            return 0L;
        }
        if (lastSendAtMs != null && nowMs - lastSendAtMs < RECENT_SEND_MS) {
            return between(config, (long) (max * 0.8d), max);
        }
        if (sentInLastMinute >= config.messagesPerMinute()) {
            return between(config, (long) (max * 0.6d), max);
        }
        if (sentInLastMinute >= config.burstLimit()) {
            return between(config, min * 2L, (long) (max * 0.7d));
        }
        return between(config, min, max);
    }

    private static long between(QueueConfig config, long lo, long hi) {
        long low = Math.max(config.minDelayMs(), Math.min(lo, config.maxDelayMs()));
        long high = Math.max(low, Math.min(hi, config.maxDelayMs()));
        if (low == high) {
            return low;
        }
        return ThreadLocalRandom.current().nextLong(low, high + 1L);
    }
}
