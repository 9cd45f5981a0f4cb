package io.sendshield.queue;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RetryBackoffTest {
    @Test
    void doublesPerAttemptWithBoundedJitter() {
        for (int i = 0; i < 50; i++) {
            long first = RetryBackoff.delayMs(1, 1_000L, 60_000L);
            long third = RetryBackoff.delayMs(3, 1_000L, 60_000L);
            Assertions.assertTrue(first >= 1_000L && first <= 1_250L, "first=" + first);
            Assertions.assertTrue(third >= 4_000L && third <= 4_250L, "third=" + third);
        }
    }

    @Test
    void neverExceedsTheCap() {
        for (int i = 0; i < 50; i++) {
            Assertions.assertEquals(10_000L, RetryBackoff.delayMs(2, 5_000L, 10_000L));
            Assertions.assertEquals(10_000L, RetryBackoff.delayMs(30, 5_000L, 10_000L));
        }
        Assertions.assertEquals(0L, RetryBackoff.delayMs(1, 0L, 0L));
    }
}
