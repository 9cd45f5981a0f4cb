package io.sendshield.health;

import io.sendshield.config.HealthPolicy;
import io.sendshield.model.HealthMetrics;
import io.sendshield.model.HealthStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class HealthScorerTest {
    private static final HealthPolicy POLICY = HealthPolicy.defaults();
    private static final long NOW = 10_000_000_000L;

    @Test
    void successRateDominatesAtTheLowEnd() {
        HealthMetrics half = metrics(50.0d, 20, 0, 0.0d, 5);
        Assertions.assertEquals(25, HealthScorer.score(half, POLICY, NOW));
        Assertions.assertEquals(HealthStatus.CRITICAL, HealthScorer.status(25, half, POLICY));
        Assertions.assertFalse(HealthScorer.successRateCritical(half, POLICY));

        HealthMetrics poor = metrics(15.0d, 20, 0, 0.0d, 5);
        Assertions.assertEquals(HealthStatus.BLOCKED, HealthScorer.status(HealthScorer.score(poor, POLICY, NOW), poor, POLICY));
        Assertions.assertTrue(HealthScorer.successRateCritical(poor, POLICY));
    }

    @Test
    void disconnectPenaltyFlattensBeyondSoftCap() {
        Assertions.assertEquals(0.0d, HealthScorer.disconnectPenalty(0, POLICY));
        Assertions.assertEquals(30.0d, HealthScorer.disconnectPenalty(3, POLICY));
        Assertions.assertEquals(40.0d, HealthScorer.disconnectPenalty(5, POLICY));
    }

    @Test
    void latencyPenaltyIsCapped() {
        Assertions.assertEquals(0.0d, HealthScorer.latencyPenalty(4_999.0d, POLICY));
        Assertions.assertEquals(5.0d, HealthScorer.latencyPenalty(6_000.0d, POLICY));
        Assertions.assertEquals(20.0d, HealthScorer.latencyPenalty(60_000.0d, POLICY));
    }

    @Test
    void warmupCeilingRampsToJustBelowHealthy() {
        long start = NOW - POLICY.warmupPeriodMs();
        Assertions.assertEquals(60.0d, HealthScorer.warmupCeiling(NOW, POLICY, NOW));
        Assertions.assertEquals(79.0d, HealthScorer.warmupCeiling(start, POLICY, NOW));
    }

    @Test
    void scoreIsDeterministicAndBounded() {
        HealthMetrics terrible = metrics(0.0d, 20, 12, 30_000.0d, 200);
        Assertions.assertEquals(0, HealthScorer.score(terrible, POLICY, NOW));
        Assertions.assertEquals(HealthScorer.warnings(terrible, POLICY, NOW), HealthScorer.warnings(terrible, POLICY, NOW));
        Assertions.assertEquals(4, HealthScorer.warnings(terrible, POLICY, NOW).size());
    }

    private static HealthMetrics metrics(double successRate, int sample, int disconnects, double latency, int perHour) {
        return new HealthMetrics(perHour, successRate, sample, latency, disconnects, NOW, false, 0L);
    }
}
