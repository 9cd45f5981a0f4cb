package io.sendshield.config;

import java.time.Duration;

/**
 * Tunable constants behind the health score. Only the shape of the scoring (which factor
 * dominates at which extreme) is a contract; the numbers are operator settings.
 */
public record HealthPolicy(
        int successWindow,
        int minOutcomeSample,
        double blockSuccessRate,
        int disconnectPenalty,
        int disconnectSoftCap,
        long latencyBaselineMs,
        int latencyPenaltyCap,
        double latencyEmaAlpha,
        int hourlySoftLimit,
        int warmupStartCeiling,
        long warmupPeriodMs,
        int warmupHourlyCap,
        long baseDelayMs,
        long unknownAccountDelayMs,
        long providerCooldownMs,
        int activityLogCapacity,
        boolean autoWarmupNewAccounts
) {
    public static HealthPolicy defaults() {
        return new HealthPolicy(
                20,
                5,
                20.0d,
                10,
                3,
                5_000L,
                20,
                0.2d,
                20,
                60,
                Duration.ofDays(7).toMillis(),
                10,
                2_000L,
                5_000L,
                Duration.ofMinutes(15).toMillis(),
                500,
                false
        );
    }

    public static HealthPolicy fromFile(File file, HealthPolicy defaults) {
        if (file == null) {
            return defaults;
        }
        int successWindow = sanitizeInt(file.successWindow(), defaults.successWindow(), 1);
        int minOutcomeSample = Math.min(successWindow, sanitizeInt(file.minOutcomeSample(), defaults.minOutcomeSample(), 1));
        double blockSuccessRate = sanitizePercent(file.blockSuccessRate(), defaults.blockSuccessRate());
        int disconnectPenalty = sanitizeInt(file.disconnectPenalty(), defaults.disconnectPenalty(), 0);
        int disconnectSoftCap = sanitizeInt(file.disconnectSoftCap(), defaults.disconnectSoftCap(), 0);
        long latencyBaselineMs = sanitizeLong(file.latencyBaselineMs(), defaults.latencyBaselineMs(), 1L);
        int latencyPenaltyCap = sanitizeInt(file.latencyPenaltyCap(), defaults.latencyPenaltyCap(), 0);
        double alpha = file.latencyEmaAlpha() == null || file.latencyEmaAlpha() <= 0d || file.latencyEmaAlpha() > 1d
                ? defaults.latencyEmaAlpha()
                : file.latencyEmaAlpha();
        int hourlySoftLimit = sanitizeInt(file.hourlySoftLimit(), defaults.hourlySoftLimit(), 1);
        int warmupStartCeiling = Math.min(79, sanitizeInt(file.warmupStartCeiling(), defaults.warmupStartCeiling(), 0));
        long warmupPeriodMs = sanitizeLong(file.warmupPeriodMs(), defaults.warmupPeriodMs(), 1_000L);
        int warmupHourlyCap = sanitizeInt(file.warmupHourlyCap(), defaults.warmupHourlyCap(), 1);
        long baseDelayMs = sanitizeLong(file.baseDelayMs(), defaults.baseDelayMs(), 0L);
        long unknownAccountDelayMs = sanitizeLong(file.unknownAccountDelayMs(), defaults.unknownAccountDelayMs(), 0L);
        long providerCooldownMs = sanitizeLong(file.providerCooldownMs(), defaults.providerCooldownMs(), 0L);
        int activityLogCapacity = sanitizeInt(file.activityLogCapacity(), defaults.activityLogCapacity(), 16);
        boolean autoWarmup = file.autoWarmupNewAccounts() == null
                ? defaults.autoWarmupNewAccounts()
                : file.autoWarmupNewAccounts();
        return new HealthPolicy(
                successWindow,
                minOutcomeSample,
                blockSuccessRate,
                disconnectPenalty,
                disconnectSoftCap,
                latencyBaselineMs,
                latencyPenaltyCap,
                alpha,
                hourlySoftLimit,
                warmupStartCeiling,
                warmupPeriodMs,
                warmupHourlyCap,
                baseDelayMs,
                unknownAccountDelayMs,
                providerCooldownMs,
                activityLogCapacity,
                autoWarmup
        );
    }

    public long warmupPeriodDays() {
        return Math.max(1L, Duration.ofMillis(warmupPeriodMs).toDays());
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static double sanitizePercent(Double raw, double fallback) {
        if (raw == null || raw < 0d || raw > 100d) {
            return fallback;
        }
        return raw;
    }

    /**
     * Shape of the {@code health} section of the settings file; every field optional.
     */
    public record File(
            Integer successWindow,
            Integer minOutcomeSample,
            Double blockSuccessRate,
            Integer disconnectPenalty,
            Integer disconnectSoftCap,
            Long latencyBaselineMs,
            Integer latencyPenaltyCap,
            Double latencyEmaAlpha,
            Integer hourlySoftLimit,
            Integer warmupStartCeiling,
            Long warmupPeriodMs,
            Integer warmupHourlyCap,
            Long baseDelayMs,
            Long unknownAccountDelayMs,
            Long providerCooldownMs,
            Integer activityLogCapacity,
            Boolean autoWarmupNewAccounts
    ) {
    }
}
