package io.sendshield.queue;

import io.sendshield.client.AccountClient;
import io.sendshield.client.DeviceLifecycle;
import io.sendshield.client.SendOutcome;
import io.sendshield.client.TransportException;
import io.sendshield.config.QueueConfig;
import io.sendshield.config.QueueConfigPatch;
import io.sendshield.health.HealthMonitor;
import io.sendshield.model.ActivityEvent;
import io.sendshield.model.DeviceQueueStatus;
import io.sendshield.model.MessageKind;
import io.sendshield.model.MessagePayload;
import io.sendshield.model.MessageStatus;
import io.sendshield.model.Priority;
import io.sendshield.model.QueueStatus;
import io.sendshield.model.QueuedMessage;
import io.sendshield.model.SafetyDecision;
import io.sendshield.model.SendOptions;
import io.sendshield.model.SendRequest;
import io.sendshield.storage.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Ordered collection of pending sends plus the admission logic that decides, per tick, which
 * message of which account may go out.
 *
 * <p>Each tick visits accounts round-robin and dispatches at most one message per account.
 * A message is only handed to the {@link AccountClient} after the device is ready, the
 * {@link HealthMonitor} considers the account safe and the {@link RateLimiter} reports no wait.
 * Client calls run on the dispatch executor; an account never has more than one call in flight.
 *
 * <p>Only the head of an account's dispatch order (priority, then enqueue time) is considered. A
 * head that is not eligible yet holds back everything behind it.
 */
public final class DispatchQueue {
    private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

    public static final long DEFAULT_NOT_READY_DEFER_MS = 30_000L;
    static final long MAX_TYPING_DELAY_MS = 3_000L;
    static final long TYPING_MS_PER_CHAR = 50L;
    static final String RECIPIENT_SUFFIX = "@c.us";

    private final MessageStore store;
    private final RateLimiter rateLimiter;
    private final HealthMonitor healthMonitor;
    private final AccountClient client;
    private final DeviceLifecycle lifecycle;
    private final Clock clock;
    private final Executor dispatchExecutor;
    private final Map<String, QueuedMessage> inFlight = new ConcurrentHashMap<>();

    private volatile QueueConfig config;
    private volatile long sendTimeoutMs;
    private volatile long notReadyDeferMs = DEFAULT_NOT_READY_DEFER_MS;
    private volatile Consumer<QueuedMessage> terminalFailureListener = message -> {
    };
    private String roundRobinCursor;

    public DispatchQueue(
            MessageStore store,
            RateLimiter rateLimiter,
            HealthMonitor healthMonitor,
            AccountClient client,
            DeviceLifecycle lifecycle,
            Clock clock,
            Executor dispatchExecutor,
            long sendTimeoutMs,
            QueueConfig initialConfig
    ) {
        initialConfig.validate();
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.healthMonitor = healthMonitor;
        this.client = client;
        this.lifecycle = lifecycle;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.sendTimeoutMs = sendTimeoutMs;
        this.config = initialConfig;
    }

    public String enqueue(SendRequest request) {
        validate(request);
        QueueConfig cfg = config;
        long now = clock.millis();
        String accountId = request.accountId().trim();
        long delay = HumanDelay.pick(
                cfg,
                rateLimiter.lastSendAt(accountId),
                rateLimiter.sentInLast(accountId, RateLimiter.WINDOW_MS),
                now
        );
        QueuedMessage message = new QueuedMessage(
                "msg_" + UUID.randomUUID(),
                accountId,
                request.recipient().trim(),
                request.kind() == null ? MessageKind.TEXT : request.kind(),
                request.payload(),
                request.options() == null ? SendOptions.NONE : request.options(),
                request.priority() == null ? Priority.NORMAL : request.priority(),
                0,
                request.maxAttempts() == null ? cfg.maxAttempts() : request.maxAttempts(),
                now,
                now + delay,
                null,
                MessageStatus.PENDING,
                now
        );
        store.insert(message);
        log.debug("Queued {} for account {} priority={} delay={}ms", message.id(), accountId, message.priority().wireName(), delay);
        return message.id();
    }

    /**
     * One pass of the dispatch loop. Safe to call directly; concurrent calls are serialized.
     */
    public synchronized TickOutcome tick() {
        QueueConfig cfg = config;
        long now = clock.millis();
        int dispatched = 0;
        int notReady = 0;
        int unsafe = 0;
        int rateLimited = 0;
        int busy = 0;
        int lost = 0;
        String firstServed = null;

        for (String accountId : rotate(store.accountsWithPending())) {
            if (inFlight.containsKey(accountId)) {
                busy++;
                continue;
            }
            Optional<QueuedMessage> next = store.head(accountId);
            if (next.isEmpty() || !next.get().eligibleAt(now)) {
                continue;
            }
            if (firstServed == null) {
                firstServed = accountId;
            }
            QueuedMessage message = next.get();

            if (!lifecycle.isReady(accountId)) {
                if (store.compareAndSet(message, message.deferred(now + notReadyDeferMs, "device not ready", now))) {
                    notReady++;
                }
                continue;
            }
            SafetyDecision safety = healthMonitor.isSafeToSend(accountId);
            if (!safety.safe()) {
                long hold = healthMonitor.getRecommendedDelay(accountId);
                if (store.compareAndSet(message, message.deferred(now + hold, safety.reason(), now))) {
                    unsafe++;
                    log.info("Deferred {} for account {} by {}ms: {}", message.id(), accountId, hold, safety.reason());
                }
                continue;
            }
            long wait = rateLimiter.checkAndWait(accountId, cfg.messagesPerMinute(), cfg.burstLimit());
            if (wait > 0L) {
                if (store.compareAndSet(message, message.deferred(now + wait, message.lastError(), now))) {
                    rateLimited++;
                }
                continue;
            }
            QueuedMessage claimed = message.claimed(now);
            if (!store.compareAndSet(message, claimed)) {
                lost++;
                continue;
            }
            inFlight.put(accountId, claimed);
            rateLimiter.recordSend(accountId, now);
            dispatch(claimed, cfg);
            dispatched++;
        }
        if (firstServed != null) {
            roundRobinCursor = firstServed;
        }
        return new TickOutcome(dispatched, notReady, unsafe, rateLimited, busy, lost);
    }

    public QueueStatus getQueueStatus() {
        MessageStore.Counts counts = store.counts();
        return QueueStatus.of(counts.pending(), counts.processing());
    }

    public DeviceQueueStatus getDeviceStatus(String accountId) {
        return new DeviceQueueStatus(
                accountId,
                rateLimiter.sentInLast(accountId, RateLimiter.WINDOW_MS),
                rateLimiter.lastSendAt(accountId),
                store.countActive(accountId)
        );
    }

    /**
     * Drops every pending and processing message. Calls already handed to the client finish,
     * but their outcome is no longer written back.
     */
    public int clearQueue() {
        int removed = store.clearActive();
        log.warn("Cleared {} queued messages", removed);
        return removed;
    }

    /**
     * Merges {@code patch} into the active configuration. The next tick sees the new values;
     * on invalid input the previous configuration stays active.
     */
    public synchronized QueueConfig updateConfig(QueueConfigPatch patch) {
        QueueConfig previous = config;
        QueueConfig next = previous.merge(patch);
        config = next;
        List<String> changed = previous.diff(next);
        if (!changed.isEmpty()) {
            log.info("Queue config updated: {}", changed);
        }
        return next;
    }

    public QueueConfig config() {
        return config;
    }

    public Optional<QueuedMessage> find(String messageId) {
        return store.find(messageId);
    }

    public List<QueuedMessage> history(int limit) {
        return store.history(limit);
    }

    public long sendTimeoutMs() {
        return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
        if (sendTimeoutMs < 1L) {
            throw new IllegalArgumentException("sendTimeoutMs must be >= 1");
        }
        this.sendTimeoutMs = sendTimeoutMs;
    }

    public void setNotReadyDeferMs(long notReadyDeferMs) {
        this.notReadyDeferMs = Math.max(0L, notReadyDeferMs);
    }

    public void setTerminalFailureListener(Consumer<QueuedMessage> listener) {
        this.terminalFailureListener = listener == null ? message -> {
        } : listener;
    }

    static String formatRecipient(String recipient) {
        return recipient.contains("@") ? recipient : recipient + RECIPIENT_SUFFIX;
    }

    static long typingDelayMs(QueuedMessage message) {
        return Math.min(message.payload().textLength() * TYPING_MS_PER_CHAR, MAX_TYPING_DELAY_MS);
    }

    private List<String> rotate(List<String> accounts) {
        List<String> sorted = new ArrayList<>(accounts);
        sorted.sort(String::compareTo);
        String cursor = roundRobinCursor;
        if (cursor == null) {
            return sorted;
        }
        List<String> rotated = new ArrayList<>(sorted.size());
        for (String accountId : sorted) {
            if (accountId.compareTo(cursor) > 0) {
                rotated.add(accountId);
            }
        }
        for (String accountId : sorted) {
            if (accountId.compareTo(cursor) <= 0) {
                rotated.add(accountId);
            }
        }
        return rotated;
    }

    /**
     * Runs the typing phase, then the send. The send timeout starts once typing is over; the
     * typing phase itself is bounded by its own delay plus the send timeout. A call that outlives
     * its timeout keeps running on the executor, but its result is ignored and the account is
     * free for the retry.
     */
    private void dispatch(QueuedMessage claimed, QueueConfig cfg) {
        long timeoutMs = sendTimeoutMs;
        boolean typing = cfg.typingDelaySimulation() && claimed.kind() == MessageKind.TEXT;
        CompletableFuture<Void> typed;
        try {
            typed = typing
                    ? CompletableFuture.runAsync(() -> simulateTyping(claimed), dispatchExecutor)
                    .orTimeout(typingDelayMs(claimed) + timeoutMs, TimeUnit.MILLISECONDS)
                    : CompletableFuture.completedFuture(null);
        } catch (RejectedExecutionException e) {
            releaseRejected(claimed, cfg, e);
            return;
        }
        typed.thenCompose(ignored -> CompletableFuture.supplyAsync(() -> deliver(claimed), dispatchExecutor)
                        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .whenComplete((delivery, error) -> {
                    try {
                        settle(claimed, cfg, delivery, error, timeoutMs);
                    } finally {
                        inFlight.remove(claimed.accountId(), claimed);
                    }
                });
    }

    private void releaseRejected(QueuedMessage claimed, QueueConfig cfg, RejectedExecutionException e) {
        inFlight.remove(claimed.accountId(), claimed);
        long now = clock.millis();
        QueuedMessage released = claimed.released(now + cfg.retryDelayMs(), "dispatch rejected", now);
        store.compareAndSet(claimed, released);
        log.warn("Dispatch executor rejected {}; released claim", claimed.id(), e);
    }

    private Delivery deliver(QueuedMessage message) {
        String to = formatRecipient(message.recipient());
        try {
            long started = clock.millis();
            SendOutcome outcome = client.send(message.accountId(), to, message.kind(), message.payload(), message.options());
            return new Delivery(outcome, Math.max(0L, clock.millis() - started));
        } catch (TransportException e) {
            throw new CompletionException(e);
        }
    }

    private void simulateTyping(QueuedMessage message) {
        String to = formatRecipient(message.recipient());
        try {
            client.sendTyping(message.accountId(), to, true);
        } catch (TransportException e) {
            log.debug("Typing indicator failed for {}: {}", message.id(), e.getMessage());
        }
        try {
            Thread.sleep(typingDelayMs(message));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(new TransportException("interrupted during typing delay", e));
        }
        try {
            client.sendTyping(message.accountId(), to, false);
        } catch (TransportException e) {
            log.debug("Clearing typing indicator failed for {}: {}", message.id(), e.getMessage());
        }
    }

    private void settle(QueuedMessage claimed, QueueConfig cfg, Delivery delivery, Throwable error, long timeoutMs) {
        long now = clock.millis();
        String accountId = claimed.accountId();
        if (error == null) {
            healthMonitor.recordActivity(accountId, ActivityEvent.sent(now, delivery.latencyMs()));
            if (store.compareAndSet(claimed, claimed.sent(now))) {
                log.info("Sent {} for account {} attempt {}/{} in {}ms",
                        claimed.id(), accountId, claimed.attempts(), claimed.maxAttempts(), delivery.latencyMs());
            } else {
                log.info("Outcome of {} discarded: message was cleared or already settled", claimed.id());
            }
            return;
        }

        Throwable cause = unwrap(error);
        if (cause instanceof RejectedExecutionException) {
            releaseRejected(claimed, cfg, (RejectedExecutionException) cause);
            return;
        }
        String reason = describe(cause, timeoutMs);
        if (!(cause instanceof TransportException) && !(cause instanceof TimeoutException)) {
            log.warn("Unexpected client failure for {}", claimed.id(), cause);
        }
        healthMonitor.recordActivity(accountId, ActivityEvent.failed(now, reason));
        if (cause instanceof TransportException && ((TransportException) cause).providerRejected()) {
            healthMonitor.startCooldown(accountId, Duration.ofMillis(healthMonitor.policy().providerCooldownMs()), reason);
        }

        QueuedMessage next;
        if (claimed.attemptsExhausted()) {
            next = claimed.failed(reason, now);
        } else {
            long backoff = RetryBackoff.delayMs(claimed.attempts(), cfg.retryDelayMs(), cfg.maxDelayMs());
            next = claimed.retrying(now + backoff, reason, now);
        }
        if (!store.compareAndSet(claimed, next)) {
            log.info("Failure of {} discarded: message was cleared or already settled", claimed.id());
            return;
        }
        if (next.status() == MessageStatus.FAILED) {
            log.warn("Message {} for account {} failed after {} attempts: {}", claimed.id(), accountId, claimed.attempts(), reason);
            terminalFailureListener.accept(next);
        } else {
            log.info("Message {} for account {} retrying at {} (attempt {}/{}): {}",
                    claimed.id(), accountId, next.nextEligibleAtMs(), claimed.attempts(), claimed.maxAttempts(), reason);
        }
    }

    private static String describe(Throwable cause, long timeoutMs) {
        if (cause instanceof TimeoutException) {
            return "send timed out after " + timeoutMs + "ms";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void validate(SendRequest request) {
        if (request == null) {
            throw new ValidationException("request", "request must not be null");
        }
        if (request.accountId() == null || request.accountId().isBlank()) {
            throw new ValidationException("accountId", "accountId must not be empty");
        }
        if (request.recipient() == null || request.recipient().isBlank()) {
            throw new ValidationException("recipient", "recipient must not be empty");
        }
        if (request.maxAttempts() != null && request.maxAttempts() < 1) {
            throw new ValidationException("maxAttempts", "maxAttempts must be >= 1");
        }
        MessagePayload payload = request.payload();
        if (payload == null) {
            throw new ValidationException("payload", "payload must not be null");
        }
        MessageKind kind = request.kind() == null ? MessageKind.TEXT : request.kind();
        switch (kind) {
            case TEXT -> {
                if (payload.text() == null || payload.text().isBlank()) {
                    throw new ValidationException("text", "text message body must not be empty");
                }
            }
            case MEDIA -> {
                if (payload.mediaBase64() == null || payload.mediaBase64().isBlank()) {
                    throw new ValidationException("mediaBase64", "media message requires base64 content");
                }
            }
            case LOCATION -> {
                if (payload.latitude() == null || payload.latitude() < -90.0d || payload.latitude() > 90.0d) {
                    throw new ValidationException("latitude", "latitude must be within [-90, 90]");
                }
                if (payload.longitude() == null || payload.longitude() < -180.0d || payload.longitude() > 180.0d) {
                    throw new ValidationException("longitude", "longitude must be within [-180, 180]");
                }
            }
        }
    }

    private record Delivery(SendOutcome outcome, long latencyMs) {
    }
}
