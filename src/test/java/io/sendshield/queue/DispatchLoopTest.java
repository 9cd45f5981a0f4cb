package io.sendshield.queue;

import io.sendshield.ScriptedAccountClient;
import io.sendshield.client.DeviceLifecycle;
import io.sendshield.config.HealthPolicy;
import io.sendshield.config.QueueConfig;
import io.sendshield.health.HealthMonitor;
import io.sendshield.model.MessageStatus;
import io.sendshield.model.QueuedMessage;
import io.sendshield.model.SendRequest;
import io.sendshield.storage.InMemoryMessageStore;
import io.sendshield.storage.MessageStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

final class DispatchLoopTest {
    private static final QueueConfig NO_DELAY = new QueueConfig(0L, 0L, 10, 3, 3, 0L, false);

    @Test
    void loopDispatchesQueuedMessages() throws Exception {
        Clock clock = Clock.systemUTC();
        DispatchQueue queue = newQueue(new InMemoryMessageStore(), clock);
        String id = queue.enqueue(SendRequest.text("acct-a", "15551234567", "hello"));

        try (DispatchLoop loop = new DispatchLoop(queue, 10L)) {
            loop.start();
            loop.start();
            Assertions.assertTrue(loop.running());
            awaitStatus(queue, id, MessageStatus.SENT);
            Assertions.assertTrue(loop.ticks() > 0L);
        }
    }

    @Test
    void failingTickDoesNotStopTheLoop() throws Exception {
        Clock clock = Clock.systemUTC();
        AtomicBoolean failOnce = new AtomicBoolean(true);
        DispatchQueue queue = newQueue(new FailingOnceStore(new InMemoryMessageStore(), failOnce), clock);
        String id = queue.enqueue(SendRequest.text("acct-a", "15551234567", "hello"));

        DispatchLoop loop = new DispatchLoop(queue, 10L);
        try {
            loop.start();
            awaitStatus(queue, id, MessageStatus.SENT);
            Assertions.assertFalse(failOnce.get());
        } finally {
            loop.close();
        }
        Assertions.assertFalse(loop.running());
        Assertions.assertThrows(IllegalStateException.class, loop::start);
    }

    @Test
    void rejectsNonPositiveInterval() {
        DispatchQueue queue = newQueue(new InMemoryMessageStore(), Clock.systemUTC());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new DispatchLoop(queue, 0L));
    }

    private static DispatchQueue newQueue(MessageStore store, Clock clock) {
        return new DispatchQueue(
                store,
                new RateLimiter(clock),
                new HealthMonitor(clock, HealthPolicy.defaults()),
                new ScriptedAccountClient(clock),
                DeviceLifecycle.ALWAYS_READY,
                clock,
                Runnable::run,
                30_000L,
                NO_DELAY
        );
    }

    private static void awaitStatus(DispatchQueue queue, String id, MessageStatus status) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (System.currentTimeMillis() < deadline) {
            if (queue.find(id).map(QueuedMessage::status).orElse(null) == status) {
                return;
            }
            Thread.sleep(10L);
        }
        Assertions.fail("message " + id + " never reached " + status);
    }

    private static final class FailingOnceStore implements MessageStore {
        private final MessageStore delegate;
        private final AtomicBoolean failNext;

        FailingOnceStore(MessageStore delegate, AtomicBoolean failNext) {
            this.delegate = delegate;
            this.failNext = failNext;
        }

        @Override
        public void insert(QueuedMessage message) {
            delegate.insert(message);
        }

        @Override
        public Optional<QueuedMessage> find(String id) {
            return delegate.find(id);
        }

        @Override
        public List<String> accountsWithPending() {
            if (failNext.getAndSet(false)) {
                throw new IllegalStateException("store unavailable");
            }
            return delegate.accountsWithPending();
        }

        @Override
        public Optional<QueuedMessage> head(String accountId) {
            return delegate.head(accountId);
        }

        @Override
        public boolean compareAndSet(QueuedMessage expected, QueuedMessage next) {
            return delegate.compareAndSet(expected, next);
        }

        @Override
        public Counts counts() {
            return delegate.counts();
        }

        @Override
        public int countActive(String accountId) {
            return delegate.countActive(accountId);
        }

        @Override
        public int clearActive() {
            return delegate.clearActive();
        }

        @Override
        public List<QueuedMessage> history(int limit) {
            return delegate.history(limit);
        }
    }
}
