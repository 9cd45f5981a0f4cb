package io.sendshield.runtime;

import io.sendshield.client.AccountClient;
import io.sendshield.client.EchoAccountClient;
import io.sendshield.config.QueueConfig;
import io.sendshield.config.QueueConfigPatch;
import io.sendshield.config.SendShieldConfig;
import io.sendshield.config.SettingsFile;
import io.sendshield.health.HealthMonitor;
import io.sendshield.model.ActivityEvent;
import io.sendshield.model.ActivityType;
import io.sendshield.model.DeviceHealth;
import io.sendshield.model.DeviceQueueStatus;
import io.sendshield.model.HealthStatus;
import io.sendshield.model.QueueStatus;
import io.sendshield.model.QueuedMessage;
import io.sendshield.model.SafetyDecision;
import io.sendshield.model.SendRequest;
import io.sendshield.observability.AuditLogger;
import io.sendshield.queue.DispatchLoop;
import io.sendshield.queue.DispatchQueue;
import io.sendshield.queue.RateLimiter;
import io.sendshield.storage.Database;
import io.sendshield.storage.InMemoryMessageStore;
import io.sendshield.storage.MessageStore;
import io.sendshield.storage.SqliteMessageStore;
import io.sendshield.util.DaemonThreads;
import io.sendshield.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Explicitly wired object graph of one SendShield process: store, rate limiter, health
 * monitor, dispatch queue and loop, audit trail and the settings file.
 *
 * <p>Admin operations (clear, config update, warm-up, cooldown, settings reload) are written
 * to the audit trail with the acting principal.
 */
public final class SendShieldRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SendShieldRuntime.class);

    static final int BACKLOG_ALERT_THRESHOLD = 10;

    private final SendShieldConfig config;
    private final RuntimeOptions options;
    private final Clock clock;
    private final Database database;
    private final MessageStore store;
    private final RateLimiter rateLimiter;
    private final HealthMonitor healthMonitor;
    private final DispatchQueue queue;
    private final ExecutorService ownedExecutor;
    private final AccountClient client;
    private final Object settingsLock = new Object();
    private AuditLogger auditLogger;
    private DispatchLoop loop;
    private volatile RuntimeSettings settings;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;

    public SendShieldRuntime(SendShieldConfig config, RuntimeOptions options) {
        this.config = config;
        this.options = options;
        this.clock = options.clock();
        this.settings = RuntimeSettings.defaults(options.env());
        this.settingsFileMtimeMs = Long.MIN_VALUE;
        this.lastSettingsCheckMs = 0L;
        if (options.store() == StoreKind.SQLITE) {
            this.database = new Database(config);
            this.store = new SqliteMessageStore(database);
        } else {
            this.database = null;
            this.store = new InMemoryMessageStore();
        }
        this.rateLimiter = new RateLimiter(clock);
        this.healthMonitor = new HealthMonitor(clock, settings.health());
        this.client = options.client() == null ? new EchoAccountClient(clock) : options.client();
        Executor executor = options.dispatchExecutor();
        if (executor == null) {
            this.ownedExecutor = Executors.newFixedThreadPool(
                    SendShieldConfig.DEFAULT_DISPATCH_THREADS, DaemonThreads.factory("sendshield-send-"));
            executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }
        this.queue = new DispatchQueue(
                store,
                rateLimiter,
                healthMonitor,
                client,
                options.lifecycle(),
                clock,
                executor,
                settings.sendTimeoutMs(),
                settings.queue()
        );
        this.queue.setTerminalFailureListener(this::auditTerminalFailure);
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create data root: " + config.rootDir(), e);
        }
        if (database != null) {
            database.init();
        }
        this.auditLogger = new AuditLogger(config.auditFile(), loadOrCreateAuditSigningSecret(config.auditSigningKey()), clock);
        loadSettings(true);
        options.lifecycle().addListener(this::recordDeviceEvent);
        log.info("Runtime initialised root={} store={} client={}",
                config.rootDir(), options.store().name().toLowerCase(Locale.ROOT), client.getClass().getSimpleName());
    }

    /**
     * Starts the dispatch loop together with the periodic health recompute and settings check.
     */
    public synchronized void start() {
        if (loop != null) {
            return;
        }
        RuntimeSettings current = settings;
        loop = new DispatchLoop(queue, current.dispatchIntervalMs());
        loop.start();
        loop.every("health-recompute", SendShieldConfig.DEFAULT_HEALTH_RECOMPUTE_INTERVAL_MS, healthMonitor::recomputeAll);
        loop.every("settings-check", SendShieldConfig.DEFAULT_SETTINGS_CHECK_INTERVAL_MS,
                () -> maybeReloadSettings(SendShieldConfig.DEFAULT_SETTINGS_CHECK_INTERVAL_MS));
    }

    @Override
    public synchronized void close() {
        if (loop != null) {
            loop.close();
            loop = null;
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public SendShieldConfig config() {
        return config;
    }

    public DispatchQueue queue() {
        return queue;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public RuntimeSettings currentSettings() {
        return settings;
    }

    public String enqueue(SendRequest request) {
        return queue.enqueue(request);
    }

    public QueueStatus queueStatus() {
        return queue.getQueueStatus();
    }

    public Optional<QueuedMessage> findMessage(String messageId) {
        return queue.find(messageId);
    }

    public List<QueuedMessage> history(int limit) {
        return queue.history(limit);
    }

    public int clearQueue(String actor) {
        int removed = queue.clearQueue();
        audit("queue.clear", actor, "queue", "ok", Map.of("cleared", removed));
        return removed;
    }

    public QueueConfig updateQueueConfig(QueueConfigPatch patch, String actor) {
        QueueConfig before = queue.config();
        QueueConfig after;
        try {
            after = queue.updateConfig(patch);
        } catch (RuntimeException e) {
            audit("queue.config.update", actor, "queue/config", "rejected", Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
        audit("queue.config.update", actor, "queue/config", "ok", Map.of("changed_fields", before.diff(after)));
        return after;
    }

    public Optional<DeviceHealth> accountHealth(String accountId) {
        return healthMonitor.getDeviceHealth(accountId);
    }

    public AccountQueueView accountQueueStatus(String accountId) {
        DeviceQueueStatus status = queue.getDeviceStatus(accountId);
        DeviceHealth health = healthMonitor.getDeviceHealth(accountId).orElse(null);
        return new AccountQueueView(
                accountId,
                status,
                health == null ? null : health.score(),
                health == null ? null : health.status(),
                healthMonitor.isSafeToSend(accountId),
                healthMonitor.getRecommendedDelay(accountId)
        );
    }

    public DeviceHealth startWarmup(String accountId, String actor) {
        DeviceHealth health = healthMonitor.startWarmupPhase(accountId);
        audit("account.warmup.start", actor, "accounts/" + accountId, "ok", Map.of("score", health.score()));
        return health;
    }

    public DeviceHealth startCooldown(String accountId, Duration duration, String reason, String actor) {
        DeviceHealth health = healthMonitor.startCooldown(accountId, duration, reason);
        audit("account.cooldown.start", actor, "accounts/" + accountId, "ok",
                Map.of("duration_ms", duration.toMillis(), "reason", reason == null ? "" : reason));
        return health;
    }

    /**
     * Feeds a connection change of the account's session into its health. Only disconnects and
     * reconnects are accepted; send outcomes come from the dispatch queue.
     */
    public DeviceHealth recordDeviceEvent(String accountId, ActivityType type, String detail) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId must not be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("activity type is required");
        }
        long now = clock.millis();
        ActivityEvent event = switch (type) {
            case DISCONNECTED -> ActivityEvent.disconnected(now, detail);
            case RECONNECTED -> ActivityEvent.reconnected(now);
            default -> throw new IllegalArgumentException("device events are disconnected or reconnected, got " + type.wireName());
        };
        DeviceHealth health = healthMonitor.recordActivity(accountId, event);
        log.info("Account {} {}{}; score={} status={}", accountId, type.wireName(),
                detail == null || detail.isBlank() ? "" : " (" + detail + ")", health.score(), health.status());
        return health;
    }

    public HealthOverview healthOverview() {
        List<DeviceHealth> all = healthMonitor.getAllDeviceHealth();
        return new HealthOverview(all, summarize(all));
    }

    public List<DeviceHealth> attention() {
        return healthMonitor.getDevicesNeedingAttention();
    }

    public Dashboard dashboard() {
        QueueStatus queueStatus = queue.getQueueStatus();
        List<DeviceHealth> all = healthMonitor.getAllDeviceHealth();
        HealthSummary summary = summarize(all);
        List<AccountRow> rows = new ArrayList<>();
        for (DeviceHealth health : all) {
            DeviceQueueStatus status = queue.getDeviceStatus(health.accountId());
            rows.add(new AccountRow(
                    health.accountId(),
                    health.score(),
                    health.status(),
                    status.queuedMessages(),
                    status.messagesInLast60s(),
                    health.warnings()
            ));
        }
        Alerts alerts = new Alerts(
                (int) all.stream().filter(DeviceHealth::needsAttention).count(),
                summary.byStatus().getOrDefault(HealthStatus.CRITICAL, 0) + summary.byStatus().getOrDefault(HealthStatus.BLOCKED, 0),
                queueStatus.pending() > BACKLOG_ALERT_THRESHOLD
        );
        return new Dashboard(queueStatus, summary, alerts, rows, clock.millis());
    }

    public SettingsReloadOutcome reloadSettings(String actor) {
        SettingsReloadOutcome out = loadSettings(true);
        audit("runtime.settings.reload", actor, "runtime/settings", out.message(), Map.of("changed_fields", out.changedFields()));
        return out;
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = clock.millis();
        long interval = Math.max(1_000L, minIntervalMs);
        if ((nowMs - lastSettingsCheckMs) < interval) {
            return new SettingsReloadOutcome(
                    false,
                    settingsFileMtimeMs >= 0L,
                    config.settingsFile().toString(),
                    settings,
                    "skip_interval",
                    nowMs,
                    List.of()
            );
        }
        lastSettingsCheckMs = nowMs;
        return loadSettings(false);
    }

    private SettingsReloadOutcome loadSettings(boolean force) {
        synchronized (settingsLock) {
            RuntimeSettings defaults = RuntimeSettings.defaults(options.env());
            Path file = config.settingsFile();
            long checkedAtMs = clock.millis();
            long mtime = resolveFileMtimeMs(file);
            if (!force && mtime == settingsFileMtimeMs) {
                return new SettingsReloadOutcome(false, mtime >= 0L, file.toString(), settings, "unchanged", checkedAtMs, List.of());
            }
            if (mtime < 0L) {
                RuntimeSettings previous = settings;
                settingsFileMtimeMs = -1L;
                List<String> changedFields = previous.diff(defaults);
                if (!changedFields.isEmpty()) {
                    apply(defaults);
                    audit("runtime.settings.load", "system", "runtime/settings", "ok_default",
                            Map.of("config", file.toString(), "changed_fields", changedFields));
                }
                return new SettingsReloadOutcome(!changedFields.isEmpty(), false, file.toString(), defaults, "defaults", checkedAtMs, changedFields);
            }
            RuntimeSettings resolved;
            try {
                SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
                resolved = RuntimeSettings.fromFile(parsed, defaults);
            } catch (IOException | RuntimeException e) {
                settingsFileMtimeMs = mtime;
                log.warn("Settings file {} rejected; keeping previous settings", file, e);
                audit("runtime.settings.load", "system", "runtime/settings", "rejected",
                        Map.of("config", file.toString(), "error", String.valueOf(e.getMessage())));
                return new SettingsReloadOutcome(false, true, file.toString(), settings, "rejected", checkedAtMs, List.of());
            }
            RuntimeSettings previous = settings;
            settingsFileMtimeMs = mtime;
            List<String> changedFields = previous.diff(resolved);
            boolean changed = !changedFields.isEmpty();
            if (changed) {
                apply(resolved);
            }
            audit("runtime.settings.load", "system", "runtime/settings", changed ? "reloaded" : "ok",
                    Map.of("config", file.toString(), "changed_fields", changedFields, "config_mtime_ms", mtime));
            return new SettingsReloadOutcome(changed, true, file.toString(), resolved, changed ? "reloaded" : "unchanged_content", checkedAtMs, changedFields);
        }
    }

    private void apply(RuntimeSettings next) {
        RuntimeSettings previous = settings;
        settings = next;
        if (!previous.queue().equals(next.queue())) {
            QueueConfig q = next.queue();
            queue.updateConfig(new QueueConfigPatch(
                    q.minDelayMs(), q.maxDelayMs(), q.messagesPerMinute(), q.burstLimit(),
                    q.maxAttempts(), q.retryDelayMs(), q.typingDelaySimulation()));
        }
        if (!previous.health().equals(next.health())) {
            healthMonitor.updatePolicy(next.health());
        }
        if (previous.sendTimeoutMs() != next.sendTimeoutMs()) {
            queue.setSendTimeoutMs(next.sendTimeoutMs());
        }
        if (previous.dispatchIntervalMs() != next.dispatchIntervalMs() && loop != null) {
            log.info("dispatchIntervalMs changed to {}ms; takes effect on next start", next.dispatchIntervalMs());
        }
    }

    private void auditTerminalFailure(QueuedMessage message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message_id", message.id());
        details.put("recipient", message.recipient());
        details.put("attempts", message.attempts());
        details.put("last_error", message.lastError() == null ? "" : message.lastError());
        audit("message.failed", "dispatch", "accounts/" + message.accountId(), "failed", details);
    }

    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor == null ? "anonymous" : actor, resource, result, details));
    }

    private static HealthSummary summarize(List<DeviceHealth> all) {
        Map<HealthStatus, Integer> byStatus = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            byStatus.put(status, 0);
        }
        long total = 0L;
        for (DeviceHealth health : all) {
            byStatus.merge(health.status(), 1, Integer::sum);
            total += health.score();
        }
        double average = all.isEmpty() ? 0.0d : (double) total / all.size();
        return new HealthSummary(all.size(), byStatus, Math.round(average * 10.0d) / 10.0d);
    }

    private long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings mtime: " + path, e);
        }
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            RuntimeSettings settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }

    public record AccountQueueView(
            String accountId,
            DeviceQueueStatus queue,
            Integer healthScore,
            HealthStatus healthStatus,
            SafetyDecision safety,
            long recommendedDelayMs
    ) {
    }

    public record HealthSummary(int total, Map<HealthStatus, Integer> byStatus, double averageScore) {
    }

    public record HealthOverview(List<DeviceHealth> accounts, HealthSummary summary) {
    }

    public record Alerts(int needsAttention, int critical, boolean backlog) {
    }

    public record AccountRow(
            String accountId,
            int score,
            HealthStatus status,
            int queuedMessages,
            int messagesInLast60s,
            List<String> warnings
    ) {
    }

    public record Dashboard(
            QueueStatus queue,
            HealthSummary health,
            Alerts alerts,
            List<AccountRow> accounts,
            long generatedAtMs
    ) {
    }
}
