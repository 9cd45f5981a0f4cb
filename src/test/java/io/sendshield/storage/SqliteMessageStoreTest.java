package io.sendshield.storage;

import io.sendshield.config.SendShieldConfig;
import io.sendshield.model.MessageKind;
import io.sendshield.model.MessagePayload;
import io.sendshield.model.MessageStatus;
import io.sendshield.model.Priority;
import io.sendshield.model.QueuedMessage;
import io.sendshield.model.SendOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class SqliteMessageStoreTest {
    @Test
    void persistsMessagesAcrossStoreInstances() throws Exception {
        Path root = Files.createTempDirectory("sendshield-sqlite-store-");
        try {
            Database database = new Database(new SendShieldConfig(root));
            database.init();
            SqliteMessageStore first = new SqliteMessageStore(database);
            QueuedMessage location = new QueuedMessage("m-loc", "acct-a", "15551234567", MessageKind.LOCATION,
                    MessagePayload.location(52.52d, 13.40d, "office"), new SendOptions("q-1", List.of("15550000000")),
                    Priority.HIGH, 0, 3, 100L, 0L, null, MessageStatus.PENDING, 100L);
            first.insert(location);
            first.insert(InMemoryMessageStoreTest.message("m-text", "acct-b", Priority.LOW, 50L, 0L));

            SqliteMessageStore second = new SqliteMessageStore(database);
            Assertions.assertEquals(location, second.find("m-loc").orElseThrow());
            Assertions.assertEquals(List.of("acct-b", "acct-a"), second.accountsWithPending());
            Assertions.assertEquals(new MessageStore.Counts(2, 0), second.counts());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void headIsTheOldestOfTheHighestBandEvenWhenNotYetEligible() throws Exception {
        Path root = Files.createTempDirectory("sendshield-sqlite-head-");
        try {
            Database database = new Database(new SendShieldConfig(root));
            database.init();
            SqliteMessageStore store = new SqliteMessageStore(database);
            store.insert(InMemoryMessageStoreTest.message("m-old", "acct-a", Priority.NORMAL, 100L, 9_000L));
            store.insert(InMemoryMessageStoreTest.message("m-new", "acct-a", Priority.NORMAL, 110L, 1_000L));
            store.insert(InMemoryMessageStoreTest.message("m-low", "acct-a", Priority.LOW, 50L, 0L));

            Assertions.assertEquals("m-old", store.head("acct-a").orElseThrow().id());
            Assertions.assertFalse(store.head("acct-a").orElseThrow().eligibleAt(2_000L));
            Assertions.assertTrue(store.head("acct-b").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("sendshield-sqlite-claim-");
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            Database database = new Database(new SendShieldConfig(root));
            database.init();
            QueuedMessage pending = InMemoryMessageStoreTest.message("m1", "acct-a", Priority.NORMAL, 100L, 0L);
            new SqliteMessageStore(database).insert(pending);

            CountDownLatch go = new CountDownLatch(1);
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                SqliteMessageStore dispatcher = new SqliteMessageStore(database);
                long claimAt = 1_000L + i;
                attempts.add(pool.submit(() -> {
                    go.await();
                    QueuedMessage seen = dispatcher.head("acct-a").orElse(pending);
                    return dispatcher.compareAndSet(seen, seen.claimed(claimAt));
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
            QueuedMessage stored = new SqliteMessageStore(database).find("m1").orElseThrow();
            Assertions.assertEquals(MessageStatus.PROCESSING, stored.status());
            Assertions.assertEquals(1, stored.attempts());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void clearActiveLeavesHistoryInPlace() throws Exception {
        Path root = Files.createTempDirectory("sendshield-sqlite-clear-");
        try {
            Database database = new Database(new SendShieldConfig(root));
            database.init();
            SqliteMessageStore store = new SqliteMessageStore(database);
            QueuedMessage first = InMemoryMessageStoreTest.message("m1", "acct-a", Priority.NORMAL, 100L, 0L);
            store.insert(first);
            QueuedMessage claimed = first.claimed(200L);
            Assertions.assertTrue(store.compareAndSet(first, claimed));
            Assertions.assertTrue(store.compareAndSet(claimed, claimed.failed("rejected", 300L)));
            store.insert(InMemoryMessageStoreTest.message("m2", "acct-a", Priority.NORMAL, 400L, 0L));

            Assertions.assertEquals(1, store.countActive("acct-a"));
            Assertions.assertEquals(1, store.clearActive());

            List<QueuedMessage> history = store.history(5);
            Assertions.assertEquals(1, history.size());
            Assertions.assertEquals("rejected", history.get(0).lastError());
            Assertions.assertEquals(MessageStatus.FAILED, history.get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
