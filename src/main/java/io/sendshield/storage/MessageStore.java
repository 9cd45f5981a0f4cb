package io.sendshield.storage;

import io.sendshield.model.QueuedMessage;

import java.util.List;
import java.util.Optional;

/**
 * Owned home of every queued message. All state transitions go through
 * {@link #compareAndSet(QueuedMessage, QueuedMessage)} so that a message is claimed by exactly
 * one dispatcher, even when several processes share a durable store.
 */
public interface MessageStore {
    void insert(QueuedMessage message);

    Optional<QueuedMessage> find(String id);

    /**
     * Accounts that currently own at least one pending message, in a stable order.
     */
    List<String> accountsWithPending();

    /**
     * First pending message of the account in {@link QueuedMessage#DISPATCH_ORDER}, whether or
     * not it is eligible yet. Nothing behind it may be dispatched first.
     */
    Optional<QueuedMessage> head(String accountId);

    /**
     * Replaces {@code expected} with {@code next} only while the stored copy still has the
     * expected status and attempt count.
     */
    boolean compareAndSet(QueuedMessage expected, QueuedMessage next);

    Counts counts();

    int countActive(String accountId);

    /**
     * Removes every pending or processing message; terminal history is kept.
     */
    int clearActive();

    /**
     * Terminal messages, most recently updated first.
     */
    List<QueuedMessage> history(int limit);

    record Counts(int pending, int processing) {
    }
}
