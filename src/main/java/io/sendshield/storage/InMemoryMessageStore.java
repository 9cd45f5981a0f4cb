package io.sendshield.storage;

import io.sendshield.model.MessageStatus;
import io.sendshield.model.QueuedMessage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded store keyed by message id with a per-account index of active messages.
 */
public final class InMemoryMessageStore implements MessageStore {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, QueuedMessage> byId = new LinkedHashMap<>();
    private final Map<String, TreeSet<QueuedMessage>> pendingByAccount = new LinkedHashMap<>();

    @Override
    public void insert(QueuedMessage message) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            if (byId.containsKey(message.id())) {
                throw new IllegalStateException("Duplicate message id: " + message.id());
            }
            byId.put(message.id(), message);
            index(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueuedMessage> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(byId.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> accountsWithPending() {
        lock.lock();
        try {
            return new ArrayList<>(pendingByAccount.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueuedMessage> head(String accountId) {
        lock.lock();
        try {
            TreeSet<QueuedMessage> pending = pendingByAccount.get(accountId);
            if (pending == null || pending.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(pending.first());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean compareAndSet(QueuedMessage expected, QueuedMessage next) {
        lock.lock();
        try {
            QueuedMessage current = byId.get(expected.id());
            if (current == null
                    || current.status() != expected.status()
                    || current.attempts() != expected.attempts()) {
                return false;
            }
            unindex(current);
            byId.put(next.id(), next);
            index(next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Counts counts() {
        lock.lock();
        try {
            int pending = 0;
            int processing = 0;
            for (QueuedMessage message : byId.values()) {
                if (message.status() == MessageStatus.PENDING) {
                    pending++;
                } else if (message.status() == MessageStatus.PROCESSING) {
                    processing++;
                }
            }
            return new Counts(pending, processing);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int countActive(String accountId) {
        lock.lock();
        try {
            int count = 0;
            for (QueuedMessage message : byId.values()) {
                if (message.accountId().equals(accountId) && message.status().active()) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clearActive() {
        lock.lock();
        try {
            int before = byId.size();
            byId.values().removeIf(message -> message.status().active());
            pendingByAccount.clear();
            return before - byId.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueuedMessage> history(int limit) {
        lock.lock();
        try {
            return byId.values().stream()
                    .filter(message -> message.status().terminal())
                    .sorted(Comparator.comparingLong(QueuedMessage::updatedAtMs).reversed())
                    .limit(Math.max(0, limit))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    private void index(QueuedMessage message) {
        if (message.status() != MessageStatus.PENDING) {
            return;
        }
        pendingByAccount
                .computeIfAbsent(message.accountId(), k -> new TreeSet<>(QueuedMessage.DISPATCH_ORDER))
                .add(message);
    }

    private void unindex(QueuedMessage message) {
        TreeSet<QueuedMessage> pending = pendingByAccount.get(message.accountId());
        if (pending == null) {
            return;
        }
        pending.remove(message);
        if (pending.isEmpty()) {
            pendingByAccount.remove(message.accountId());
        }
    }
}
