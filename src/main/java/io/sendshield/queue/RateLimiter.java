package io.sendshield.queue;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account sliding window over the send timestamps of the last minute. Queries never
 * block; {@link #checkAndWait} only reports how long the caller should hold off.
 */
public final class RateLimiter {
    public static final long WINDOW_MS = 60_000L;

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Milliseconds until the next send for the account is within both the per-minute limit
     * and the burst limit; 0 when a send is allowed now.
     */
    public long checkAndWait(String accountId, int messagesPerMinute, int burstLimit) {
        Window window = windows.get(accountId);
        if (window == null) {
            return 0L;
        }
        long now = clock.millis();
        long burstWindowMs = WINDOW_MS / messagesPerMinute * burstLimit;
        return window.waitMs(now, messagesPerMinute, burstLimit, burstWindowMs);
    }

    public void recordSend(String accountId, long timestampMs) {
        windows.computeIfAbsent(accountId, k -> new Window()).add(timestampMs);
    }

    public int sentInLast(String accountId, long windowMs) {
        Window window = windows.get(accountId);
        return window == null ? 0 : window.countSince(clock.millis() - windowMs);
    }

    /**
     * Timestamp of the most recent recorded send, or null when the account never sent.
     */
    public Long lastSendAt(String accountId) {
        Window window = windows.get(accountId);
        return window == null ? null : window.last();
    }

    private static final class Window {
        private final ArrayDeque<Long> timestamps = new ArrayDeque<>();
        private Long last;

        synchronized void add(long ts) {
            timestamps.addLast(ts);
            if (last == null || ts > last) {
                last = ts;
            }
        }

        synchronized Long last() {
            return last;
        }

        synchronized int countSince(long cutoffMs) {
            int count = 0;
            for (long ts : timestamps) {
                if (ts > cutoffMs) {
                    count++;
                }
            }
            return count;
        }

        synchronized long waitMs(long now, int perMinute, int burst, long burstWindowMs) {
            prune(now - WINDOW_MS);
            long minuteWait = waitFor(now, WINDOW_MS, perMinute);
            long burstWait = waitFor(now, burstWindowMs, burst);
            return Math.max(minuteWait, burstWait);
        }

        private long waitFor(long now, long windowMs, int limit) {
            long cutoff = now - windowMs;
            long[] inWindow = timestamps.stream()
                    .mapToLong(Long::longValue)
                    .filter(ts -> ts > cutoff)
                    .sorted()
                    .toArray();
            if (inWindow.length < limit) {
                return 0L;
            }
            // the send that must expire before another fits under the limit
            long blocking = inWindow[inWindow.length - limit];
            return Math.max(1L, blocking + windowMs - now);
        }

        private void prune(long cutoffMs) {
            Iterator<Long> it = timestamps.iterator();
            while (it.hasNext()) {
                if (it.next() <= cutoffMs) {
                    it.remove();
                }
            }
        }
    }
}
