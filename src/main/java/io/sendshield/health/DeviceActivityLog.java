package io.sendshield.health;

import io.sendshield.model.ActivityEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, bounded record of one account's activity. The oldest entry is evicted once the
 * capacity is reached. Not thread-safe; guarded by the owning account state.
 */
final class DeviceActivityLog {
    private final ArrayDeque<ActivityEvent> events = new ArrayDeque<>();

    void append(ActivityEvent event, int capacity) {
        events.addLast(event);
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }

    int size() {
        return events.size();
    }

    /**
     * Events strictly newer than {@code cutoffMs}, oldest first.
     */
    List<ActivityEvent> since(long cutoffMs) {
        List<ActivityEvent> out = new ArrayList<>();
        for (ActivityEvent event : events) {
            if (event.timestampMs() > cutoffMs) {
                out.add(event);
            }
        }
        return out;
    }

    long lastTimestamp() {
        ActivityEvent last = events.peekLast();
        return last == null ? 0L : last.timestampMs();
    }
}
