package io.sendshield.health;

import io.sendshield.config.HealthPolicy;
import io.sendshield.model.HealthMetrics;
import io.sendshield.model.HealthStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure scoring of a metrics snapshot. The same metrics and policy always produce the same
 * score, status and warnings.
 */
final class HealthScorer {
    static final double SUCCESS_WARNING_RATE = 90.0d;
    static final double SUCCESS_CRITICAL_RATE = 50.0d;

    private HealthScorer() {
    }

    static int score(HealthMetrics m, HealthPolicy policy, long nowMs) {
        double score = 100.0d;
        if (successRateCounts(m, policy)) {
            double factor = m.successRate() / 100.0d;
            score *= factor * factor;
        }
        score -= disconnectPenalty(m.disconnectionCount24h(), policy);
        score -= latencyPenalty(m.avgResponseTimeMs(), policy);
        if (m.messagesPerHour() > policy.hourlySoftLimit()) {
            score -= (m.messagesPerHour() - policy.hourlySoftLimit()) * 2.0d;
        }
        if (m.warmupPhase()) {
            score = Math.min(score, warmupCeiling(m.warmupStartedAtMs(), policy, nowMs));
        }
        return (int) Math.round(Math.max(0.0d, Math.min(100.0d, score)));
    }

    static HealthStatus status(int score, HealthMetrics m, HealthPolicy policy) {
        if (successRateCounts(m, policy) && m.successRate() < policy.blockSuccessRate()) {
            return HealthStatus.BLOCKED;
        }
        return HealthStatus.fromScore(score);
    }

    static List<String> warnings(HealthMetrics m, HealthPolicy policy, long nowMs) {
        List<String> warnings = new ArrayList<>();
        if (successRateCounts(m, policy) && m.successRate() < SUCCESS_WARNING_RATE) {
            warnings.add("success rate below 90%");
        }
        if (m.disconnectionCount24h() > 0) {
            warnings.add("disconnected " + m.disconnectionCount24h() + " times in 24h");
        }
        if (m.avgResponseTimeMs() > policy.latencyBaselineMs()) {
            warnings.add("high response times (avg " + Math.round(m.avgResponseTimeMs()) + " ms)");
        }
        if (m.messagesPerHour() > policy.hourlySoftLimit()) {
            warnings.add("high message rate (" + m.messagesPerHour() + "/h)");
        }
        if (m.warmupPhase()) {
            long elapsedDays = Math.max(0L, nowMs - m.warmupStartedAtMs()) / 86_400_000L;
            warnings.add("still in warm-up, day " + (elapsedDays + 1L) + " of " + policy.warmupPeriodDays());
        }
        return warnings;
    }

    /**
     * True when the success rate was computed over enough outcomes to be trusted.
     */
    static boolean successRateCounts(HealthMetrics m, HealthPolicy policy) {
        return m.outcomeSample() >= policy.minOutcomeSample();
    }

    static boolean successRateCritical(HealthMetrics m, HealthPolicy policy) {
        return successRateCounts(m, policy) && m.successRate() < SUCCESS_CRITICAL_RATE;
    }

    static double disconnectPenalty(int disconnects, HealthPolicy policy) {
        int soft = Math.min(disconnects, policy.disconnectSoftCap());
        int beyond = Math.max(0, disconnects - policy.disconnectSoftCap());
        return soft * (double) policy.disconnectPenalty() + beyond * (policy.disconnectPenalty() / 2.0d);
    }

    static double latencyPenalty(double avgLatencyMs, HealthPolicy policy) {
        if (avgLatencyMs <= policy.latencyBaselineMs()) {
            return 0.0d;
        }
        return Math.min(policy.latencyPenaltyCap(), (avgLatencyMs - policy.latencyBaselineMs()) / 1000.0d * 5.0d);
    }

    /**
     * Linear ramp from the starting ceiling to one below the healthy threshold.
     */
    static double warmupCeiling(long warmupStartedAtMs, HealthPolicy policy, long nowMs) {
        double progress = Math.min(1.0d, Math.max(0.0d, nowMs - warmupStartedAtMs) / (double) policy.warmupPeriodMs());
        int top = HealthStatus.HEALTHY.minScore() - 1;
        return policy.warmupStartCeiling() + (top - policy.warmupStartCeiling()) * progress;
    }
}
