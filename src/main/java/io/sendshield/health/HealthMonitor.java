package io.sendshield.health;

import io.sendshield.config.HealthPolicy;
import io.sendshield.model.ActivityEvent;
import io.sendshield.model.ActivityType;
import io.sendshield.model.DeviceHealth;
import io.sendshield.model.HealthMetrics;
import io.sendshield.model.HealthStatus;
import io.sendshield.model.SafetyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rolling per-account health. Every recorded outcome recomputes the account's score; the
 * running service also calls {@link #recomputeAll()} periodically so that old failures age out
 * of the windows even when an account is idle.
 *
 * <p>Unhealthy accounts never cause an exception: callers ask {@link #isSafeToSend(String)} and
 * {@link #getRecommendedDelay(String)} and act on the answer.
 */
public final class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    static final long HOUR_MS = 3_600_000L;
    static final long DAY_MS = 86_400_000L;
    static final int BUSY_MESSAGES_PER_HOUR = 15;

    private final Clock clock;
    private final Map<String, AccountState> accounts = new ConcurrentHashMap<>();
    private volatile HealthPolicy policy;

    public HealthMonitor(Clock clock, HealthPolicy policy) {
        this.clock = clock;
        this.policy = policy;
    }

    public HealthPolicy policy() {
        return policy;
    }

    /**
     * Replaces the scoring constants; every known account is rescored with the new policy.
     */
    public void updatePolicy(HealthPolicy next) {
        this.policy = next;
        recomputeAll();
    }

    public DeviceHealth recordActivity(String accountId, ActivityEvent event) {
        AccountState state = accounts.computeIfAbsent(accountId, this::newState);
        return state.record(event, policy, clock.millis());
    }

    public Optional<DeviceHealth> recomputeScore(String accountId) {
        AccountState state = accounts.get(accountId);
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(state.recompute(policy, clock.millis()));
    }

    public void recomputeAll() {
        long now = clock.millis();
        HealthPolicy current = policy;
        for (AccountState state : accounts.values()) {
            state.recompute(current, now);
        }
    }

    public SafetyDecision isSafeToSend(String accountId) {
        AccountState state = accounts.get(accountId);
        if (state == null) {
            return SafetyDecision.allow();
        }
        return state.safety(policy, clock.millis());
    }

    public long getRecommendedDelay(String accountId) {
        HealthPolicy current = policy;
        AccountState state = accounts.get(accountId);
        if (state == null) {
            return current.unknownAccountDelayMs();
        }
        DeviceHealth health = state.recompute(current, clock.millis());
        double delay = current.baseDelayMs() * (1.0d + (100 - health.score()) / 25.0d);
        if (health.metrics().messagesPerHour() > BUSY_MESSAGES_PER_HOUR) {
            delay *= 1.5d;
        }
        delay *= ThreadLocalRandom.current().nextDouble(0.8d, 1.2d);
        return Math.max(0L, Math.round(delay));
    }

    public DeviceHealth startWarmupPhase(String accountId) {
        AccountState state = accounts.computeIfAbsent(accountId, this::newState);
        DeviceHealth health = state.startWarmup(policy, clock.millis());
        log.info("Warm-up phase started for account {}", accountId);
        return health;
    }

    /**
     * Holds every dispatch for the account until {@code duration} has elapsed.
     */
    public DeviceHealth startCooldown(String accountId, Duration duration, String reason) {
        AccountState state = accounts.computeIfAbsent(accountId, this::newState);
        long until = clock.millis() + Math.max(0L, duration.toMillis());
        DeviceHealth health = state.startCooldown(until, reason, policy, clock.millis());
        log.warn("Cooldown started for account {} until {}: {}", accountId, until, reason);
        return health;
    }

    public Optional<DeviceHealth> getDeviceHealth(String accountId) {
        AccountState state = accounts.get(accountId);
        return state == null ? Optional.empty() : Optional.of(state.current());
    }

    public List<DeviceHealth> getAllDeviceHealth() {
        List<DeviceHealth> out = new ArrayList<>();
        for (AccountState state : accounts.values()) {
            out.add(state.current());
        }
        out.sort(Comparator.comparing(DeviceHealth::accountId));
        return out;
    }

    public List<DeviceHealth> getDevicesNeedingAttention() {
        return getAllDeviceHealth().stream()
                .filter(DeviceHealth::needsAttention)
                .toList();
    }

    private AccountState newState(String accountId) {
        long now = clock.millis();
        HealthPolicy current = policy;
        return new AccountState(accountId, current.autoWarmupNewAccounts() ? now : null, current, now);
    }

    private static final class AccountState {
        private final String accountId;
        private final DeviceActivityLog activity = new DeviceActivityLog();
        private double emaLatencyMs;
        private boolean latencySeen;
        private Long warmupStartedAtMs;
        private long cooldownUntilMs;
        private String cooldownReason;
        private DeviceHealth current;

        AccountState(String accountId, Long warmupStartedAtMs, HealthPolicy policy, long nowMs) {
            this.accountId = accountId;
            this.warmupStartedAtMs = warmupStartedAtMs;
            this.current = evaluate(policy, nowMs);
        }

        synchronized DeviceHealth current() {
            return current;
        }

        synchronized DeviceHealth record(ActivityEvent event, HealthPolicy policy, long nowMs) {
            activity.append(event, policy.activityLogCapacity());
            if (event.type() == ActivityType.SENT && event.latencyMs() != null) {
                double sample = Math.max(0L, event.latencyMs());
                if (!latencySeen) {
                    emaLatencyMs = sample;
                    latencySeen = true;
                } else {
                    emaLatencyMs = policy.latencyEmaAlpha() * sample + (1.0d - policy.latencyEmaAlpha()) * emaLatencyMs;
                }
            }
            return recompute(policy, nowMs);
        }

        synchronized DeviceHealth startWarmup(HealthPolicy policy, long nowMs) {
            warmupStartedAtMs = nowMs;
            return recompute(policy, nowMs);
        }

        synchronized DeviceHealth startCooldown(long untilMs, String reason, HealthPolicy policy, long nowMs) {
            if (untilMs > cooldownUntilMs) {
                cooldownUntilMs = untilMs;
                cooldownReason = reason;
            }
            return recompute(policy, nowMs);
        }

        synchronized DeviceHealth recompute(HealthPolicy policy, long nowMs) {
            DeviceHealth previous = current;
            current = evaluate(policy, nowMs);
            if (previous != null && previous.status() != current.status()) {
                if (current.status() == HealthStatus.HEALTHY) {
                    log.info("Account {} health {} -> {} (score {})",
                            accountId, previous.status(), current.status(), current.score());
                } else {
                    log.warn("Account {} health {} -> {} (score {}, warnings {})",
                            accountId, previous.status(), current.status(), current.score(), current.warnings());
                }
            }
            return current;
        }

        synchronized SafetyDecision safety(HealthPolicy policy, long nowMs) {
            DeviceHealth health = recompute(policy, nowMs);
            if (cooldownUntilMs > nowMs) {
                return SafetyDecision.deny("cooldown active: " + cooldownReason);
            }
            HealthMetrics m = health.metrics();
            if (health.status() == HealthStatus.BLOCKED) {
                if (HealthScorer.successRateCritical(m, policy)) {
                    return SafetyDecision.deny("device health protection: success rate critically low");
                }
                return SafetyDecision.deny("device health protection: health score " + health.score() + " too low");
            }
            if (health.status() == HealthStatus.CRITICAL) {
                int cap = m.warmupPhase() ? policy.warmupHourlyCap() : policy.hourlySoftLimit();
                if (m.messagesPerHour() >= cap) {
                    return SafetyDecision.deny("device health protection: critical health with "
                            + m.messagesPerHour() + " messages in the last hour (cap " + cap + ")");
                }
            }
            return SafetyDecision.allow();
        }

        private DeviceHealth evaluate(HealthPolicy policy, long nowMs) {
            HealthMetrics metrics = metrics(policy, nowMs);
            int score = HealthScorer.score(metrics, policy, nowMs);
            HealthStatus status = HealthScorer.status(score, metrics, policy);
            List<String> warnings = HealthScorer.warnings(metrics, policy, nowMs);
            if (cooldownUntilMs > nowMs) {
                warnings.add("cooldown active until " + cooldownUntilMs + ": " + cooldownReason);
            }
            return new DeviceHealth(accountId, score, status, metrics, warnings, nowMs);
        }

        private HealthMetrics metrics(HealthPolicy policy, long nowMs) {
            List<ActivityEvent> day = activity.since(nowMs - DAY_MS);
            int messagesPerHour = 0;
            int disconnects = 0;
            List<ActivityEvent> outcomes = new ArrayList<>();
            for (ActivityEvent event : day) {
                if (event.type().messageOutcome()) {
                    outcomes.add(event);
                    if (event.timestampMs() > nowMs - HOUR_MS) {
                        messagesPerHour++;
                    }
                } else if (event.type() == ActivityType.DISCONNECTED) {
                    disconnects++;
                }
            }
            List<ActivityEvent> window = outcomes.subList(Math.max(0, outcomes.size() - policy.successWindow()), outcomes.size());
            int sent = 0;
            for (ActivityEvent event : window) {
                if (event.type() == ActivityType.SENT) {
                    sent++;
                }
            }
            double successRate = window.isEmpty() ? 100.0d : sent * 100.0d / window.size();
            boolean warmup = warmupStartedAtMs != null && nowMs - warmupStartedAtMs < policy.warmupPeriodMs();
            return new HealthMetrics(
                    messagesPerHour,
                    successRate,
                    window.size(),
                    latencySeen ? emaLatencyMs : 0.0d,
                    disconnects,
                    activity.lastTimestamp(),
                    warmup,
                    warmupStartedAtMs == null ? 0L : warmupStartedAtMs
            );
        }
    }
}
