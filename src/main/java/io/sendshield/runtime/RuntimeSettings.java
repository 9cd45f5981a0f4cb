package io.sendshield.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import io.sendshield.config.HealthPolicy;
import io.sendshield.config.QueueConfig;
import io.sendshield.config.SendShieldConfig;
import io.sendshield.config.SettingsFile;
import io.sendshield.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Effective settings after layering the settings file over environment defaults.
 */
public record RuntimeSettings(
        QueueConfig queue,
        HealthPolicy health,
        long dispatchIntervalMs,
        long sendTimeoutMs
) {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public static RuntimeSettings defaults(Map<String, String> env) {
        return new RuntimeSettings(
                QueueConfig.fromEnvironment(env),
                HealthPolicy.defaults(),
                SendShieldConfig.DEFAULT_DISPATCH_INTERVAL_MS,
                SendShieldConfig.DEFAULT_SEND_TIMEOUT_MS
        );
    }

    /**
     * Applies {@code file} over {@code defaults}. Queue values are validated as a whole and
     * raise {@link io.sendshield.config.ConfigException}; out-of-range scalar values fall back
     * to the defaults.
     */
    public static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new RuntimeSettings(
                defaults.queue().merge(file.queue()),
                HealthPolicy.fromFile(file.health(), defaults.health()),
                sanitize(file.dispatchIntervalMs(), defaults.dispatchIntervalMs(), 10L),
                sanitize(file.sendTimeoutMs(), defaults.sendTimeoutMs(), 100L)
        );
    }

    /**
     * Dotted names of every leaf value that differs, e.g. {@code queue.messagesPerMinute}.
     */
    public List<String> diff(RuntimeSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        for (String field : queue.diff(other.queue())) {
            changed.add("queue." + field);
        }
        Map<String, Object> before = Jsons.mapper().convertValue(health, MAP_TYPE);
        Map<String, Object> after = Jsons.mapper().convertValue(other.health(), MAP_TYPE);
        for (Map.Entry<String, Object> entry : before.entrySet()) {
            if (!Objects.equals(entry.getValue(), after.get(entry.getKey()))) {
                changed.add("health." + entry.getKey());
            }
        }
        if (dispatchIntervalMs != other.dispatchIntervalMs()) {
            changed.add("dispatchIntervalMs");
        }
        if (sendTimeoutMs != other.sendTimeoutMs()) {
            changed.add("sendTimeoutMs");
        }
        return changed;
    }

    private static long sanitize(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }
}
