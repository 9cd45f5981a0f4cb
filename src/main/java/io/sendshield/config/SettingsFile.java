package io.sendshield.config;

/**
 * On-disk shape of {@code sendshield-settings.json}.
 */
public record SettingsFile(
        QueueConfigPatch queue,
        HealthPolicy.File health,
        Long dispatchIntervalMs,
        Long sendTimeoutMs
) {
}
