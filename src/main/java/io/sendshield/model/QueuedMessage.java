package io.sendshield.model;

import java.util.Comparator;

/**
 * A unit of dispatch work. Instances are immutable; the dispatch loop moves a message through
 * its lifecycle by producing a successor and swapping it into the store with compare-and-set.
 */
public record QueuedMessage(
        String id,
        String accountId,
        String recipient,
        MessageKind kind,
        MessagePayload payload,
        SendOptions options,
        Priority priority,
        int attempts,
        int maxAttempts,
        long enqueuedAtMs,
        long nextEligibleAtMs,
        String lastError,
        MessageStatus status,
        long updatedAtMs
) {
    /**
     * Priority band first, then strict FIFO by enqueue time; id breaks exact ties.
     */
    public static final Comparator<QueuedMessage> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedMessage m) -> m.priority().rank())
            .thenComparingLong(QueuedMessage::enqueuedAtMs)
            .thenComparing(QueuedMessage::id);

    public boolean eligibleAt(long nowMs) {
        return status == MessageStatus.PENDING && nextEligibleAtMs <= nowMs;
    }

    public boolean attemptsExhausted() {
        return attempts >= maxAttempts;
    }

    public QueuedMessage deferred(long untilMs, String reason, long nowMs) {
        return new QueuedMessage(id, accountId, recipient, kind, payload, options, priority,
                attempts, maxAttempts, enqueuedAtMs, untilMs, reason, MessageStatus.PENDING, nowMs);
    }

    public QueuedMessage claimed(long nowMs) {
        return new QueuedMessage(id, accountId, recipient, kind, payload, options, priority,
                attempts + 1, maxAttempts, enqueuedAtMs, nextEligibleAtMs, lastError, MessageStatus.PROCESSING, nowMs);
    }

    public QueuedMessage sent(long nowMs) {
        return new QueuedMessage(id, accountId, recipient, kind, payload, options, priority,
                attempts, maxAttempts, enqueuedAtMs, nextEligibleAtMs, null, MessageStatus.SENT, nowMs);
    }

    public QueuedMessage retrying(long retryAtMs, String error, long nowMs) {
        return new QueuedMessage(id, accountId, recipient, kind, payload, options, priority,
                attempts, maxAttempts, enqueuedAtMs, retryAtMs, error, MessageStatus.PENDING, nowMs);
    }

    public QueuedMessage failed(String error, long nowMs) {
        return new QueuedMessage(id, accountId, recipient, kind, payload, options, priority,
                attempts, maxAttempts, enqueuedAtMs, nextEligibleAtMs, error, MessageStatus.FAILED, nowMs);
    }

    /**
     * Undoes a claim whose dispatch never started; the attempt is not counted.
     */
    public QueuedMessage released(long retryAtMs, String reason, long nowMs) {
        return new QueuedMessage(id, accountId, recipient, kind, payload, options, priority,
                Math.max(0, attempts - 1), maxAttempts, enqueuedAtMs, retryAtMs, reason, MessageStatus.PENDING, nowMs);
    }
}
