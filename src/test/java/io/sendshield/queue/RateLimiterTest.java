package io.sendshield.queue;

import io.sendshield.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class RateLimiterTest {
    @Test
    void unknownAccountMaySendImmediately() {
        RateLimiter limiter = new RateLimiter(new MutableClock());
        Assertions.assertEquals(0L, limiter.checkAndWait("acct-a", 10, 3));
        Assertions.assertNull(limiter.lastSendAt("acct-a"));
        Assertions.assertEquals(0, limiter.sentInLast("acct-a", RateLimiter.WINDOW_MS));
    }

    @Test
    void burstLimitHoldsUntilOldestBurstSendExpires() {
        MutableClock clock = new MutableClock();
        RateLimiter limiter = new RateLimiter(clock);
        long t0 = clock.millis();
        for (int i = 0; i < 3; i++) {
            limiter.recordSend("acct-a", t0);
        }

        // 10/min with a burst of 3 spreads bursts over 18 s
        Assertions.assertEquals(18_000L, limiter.checkAndWait("acct-a", 10, 3));

        clock.advance(Duration.ofSeconds(5));
        Assertions.assertEquals(13_000L, limiter.checkAndWait("acct-a", 10, 3));

        clock.advance(Duration.ofSeconds(13));
        Assertions.assertEquals(0L, limiter.checkAndWait("acct-a", 10, 3));
    }

    @Test
    void perMinuteLimitHoldsOnceWindowIsFull() {
        MutableClock clock = new MutableClock();
        RateLimiter limiter = new RateLimiter(clock);
        long t0 = clock.millis();
        for (int i = 0; i < 10; i++) {
            limiter.recordSend("acct-a", clock.millis());
            clock.advance(Duration.ofSeconds(1));
        }
        clock.advanceMillis(-1_000L);

        Assertions.assertEquals(10, limiter.sentInLast("acct-a", RateLimiter.WINDOW_MS));
        Assertions.assertEquals(t0 + 60_000L - clock.millis(), limiter.checkAndWait("acct-a", 10, 10));
        Assertions.assertEquals(Long.valueOf(t0 + 9_000L), limiter.lastSendAt("acct-a"));
    }

    @Test
    void accountsAreLimitedIndependently() {
        MutableClock clock = new MutableClock();
        RateLimiter limiter = new RateLimiter(clock);
        limiter.recordSend("acct-a", clock.millis());
        limiter.recordSend("acct-a", clock.millis());

        Assertions.assertTrue(limiter.checkAndWait("acct-a", 2, 2) > 0L);
        Assertions.assertEquals(0L, limiter.checkAndWait("acct-b", 2, 2));
    }

    @Test
    void sendsAgeOutOfTheWindow() {
        MutableClock clock = new MutableClock();
        RateLimiter limiter = new RateLimiter(clock);
        limiter.recordSend("acct-a", clock.millis());
        clock.advance(Duration.ofSeconds(61));

        Assertions.assertEquals(0, limiter.sentInLast("acct-a", RateLimiter.WINDOW_MS));
        Assertions.assertEquals(0L, limiter.checkAndWait("acct-a", 1, 1));
    }
}
