package io.sendshield.queue;

import java.util.concurrent.ThreadLocalRandom;

final class RetryBackoff {
    static final long MAX_JITTER_MS = 250L;

    private RetryBackoff() {
    }

    /**
     * {@code baseMs * 2^(attempt-1)}, capped at {@code maxMs}, plus up to 250 ms of jitter that
     * never lifts the result above the cap.
     */
    static long delayMs(int attempt, long baseMs, long maxMs) {
        long backoff = baseMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxMs / 2L) {
                backoff = maxMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, MAX_JITTER_MS + 1L);
        return Math.max(0L, Math.min(maxMs, backoff + jitter));
    }
}
