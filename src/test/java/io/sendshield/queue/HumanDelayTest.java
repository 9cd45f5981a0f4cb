package io.sendshield.queue;

import io.sendshield.config.QueueConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class HumanDelayTest {
    private static final QueueConfig CONFIG = new QueueConfig(1_000L, 10_000L, 10, 3, 3, 5_000L, false);
    private static final long NOW = 1_000_000L;

    @Test
    void idleAccountDrawsFromFullRange() {
        for (int i = 0; i < 100; i++) {
            long delay = HumanDelay.pick(CONFIG, null, 0, NOW);
            Assertions.assertTrue(delay >= 1_000L && delay <= 10_000L, "delay=" + delay);
        }
    }

    @Test
    void recentSendPushesDelayToUpperRange() {
        for (int i = 0; i < 100; i++) {
            long delay = HumanDelay.pick(CONFIG, NOW - 5_000L, 1, NOW);
            Assertions.assertTrue(delay >= 8_000L && delay <= 10_000L, "delay=" + delay);
        }
    }

    @Test
    void burstyAccountStaysWithinMiddleBand() {
        for (int i = 0; i < 100; i++) {
            long delay = HumanDelay.pick(CONFIG, NOW - 45_000L, 3, NOW);
            Assertions.assertTrue(delay >= 2_000L && delay <= 7_000L, "delay=" + delay);
        }
    }

    @Test
    void zeroRangeMeansNoDelay() {
        QueueConfig immediate = new QueueConfig(0L, 0L, 10, 3, 3, 0L, false);
        Assertions.assertEquals(0L, HumanDelay.pick(immediate, NOW - 1L, 9, NOW));
    }
}
