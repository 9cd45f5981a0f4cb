package io.sendshield.web;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed one-minute window counter per remote address for mutating routes. A limit of 0
 * disables it.
 */
final class WriteRateLimiter {
    private final int limitPerMinute;
    private final ConcurrentMap<String, WindowCounter> counters = new ConcurrentHashMap<>();
    private final AtomicLong lastCleanupWindowStartMs = new AtomicLong(Long.MIN_VALUE);

    WriteRateLimiter(int limitPerMinute) {
        this.limitPerMinute = Math.max(0, limitPerMinute);
    }

    boolean disabled() {
        return limitPerMinute <= 0;
    }

    boolean tryAcquire(String key, long nowMs) {
        if (disabled()) {
            return true;
        }
        long windowStartMs = nowMs - (nowMs % 60_000L);
        WindowCounter current = counters.compute(key, (k, existing) -> {
            if (existing == null || existing.windowStartMs() < windowStartMs) {
                return new WindowCounter(windowStartMs, 1);
            }
            return new WindowCounter(windowStartMs, existing.count() + 1);
        });
        cleanup(windowStartMs);
        return current.count() <= limitPerMinute;
    }

    private void cleanup(long windowStartMs) {
        long prev = lastCleanupWindowStartMs.get();
        if (prev == windowStartMs || !lastCleanupWindowStartMs.compareAndSet(prev, windowStartMs)) {
            return;
        }
        long keepAfter = windowStartMs - 60_000L;
        counters.entrySet().removeIf(e -> e.getValue().windowStartMs() < keepAfter);
    }

    private record WindowCounter(long windowStartMs, int count) {
    }
}
