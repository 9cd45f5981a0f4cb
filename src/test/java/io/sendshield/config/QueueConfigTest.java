package io.sendshield.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class QueueConfigTest {
    @Test
    void defaultsMatchDocumentedValues() {
        QueueConfig config = QueueConfig.defaults();
        Assertions.assertEquals(1_000L, config.minDelayMs());
        Assertions.assertEquals(10_000L, config.maxDelayMs());
        Assertions.assertEquals(10, config.messagesPerMinute());
        Assertions.assertEquals(3, config.burstLimit());
        Assertions.assertEquals(3, config.maxAttempts());
        Assertions.assertEquals(5_000L, config.retryDelayMs());
        Assertions.assertTrue(config.typingDelaySimulation());
        Assertions.assertEquals(18_000L, config.burstWindowMs());
    }

    @Test
    void environmentOverridesDefaults() {
        QueueConfig config = QueueConfig.fromEnvironment(Map.of(
                "MESSAGE_MIN_DELAY", "250",
                "MESSAGE_MAX_DELAY", " 2000 ",
                "MESSAGES_PER_MINUTE", "20",
                "MESSAGE_BURST_LIMIT", "5",
                "ENABLE_TYPING_DELAY", "FALSE"
        ));

        Assertions.assertEquals(250L, config.minDelayMs());
        Assertions.assertEquals(2_000L, config.maxDelayMs());
        Assertions.assertEquals(20, config.messagesPerMinute());
        Assertions.assertEquals(5, config.burstLimit());
        Assertions.assertFalse(config.typingDelaySimulation());
    }

    @Test
    void malformedEnvironmentIsRejected() {
        ConfigException notNumber = Assertions.assertThrows(ConfigException.class,
                () -> QueueConfig.fromEnvironment(Map.of("MESSAGES_PER_MINUTE", "ten")));
        Assertions.assertTrue(notNumber.getMessage().contains("MESSAGES_PER_MINUTE"));

        Assertions.assertThrows(ConfigException.class,
                () -> QueueConfig.fromEnvironment(Map.of("MESSAGE_MIN_DELAY", "5000", "MESSAGE_MAX_DELAY", "1000")));
    }

    @Test
    void mergeCollectsEveryViolation() {
        QueueConfigPatch patch = new QueueConfigPatch(-1L, null, 0, 0, 0, -5L, null);

        ConfigException e = Assertions.assertThrows(ConfigException.class, () -> QueueConfig.defaults().merge(patch));

        Assertions.assertEquals(List.of(
                "minDelayMs must be >= 0",
                "messagesPerMinute must be >= 1",
                "burstLimit must be >= 1",
                "maxAttempts must be >= 1",
                "retryDelayMs must be >= 0"
        ), e.violations());
    }

    @Test
    void mergeKeepsUnsetFieldsAndReportsDiff() {
        QueueConfig base = QueueConfig.defaults();
        QueueConfig merged = base.merge(QueueConfigPatch.messagesPerMinute(30));

        Assertions.assertEquals(30, merged.messagesPerMinute());
        Assertions.assertEquals(base.burstLimit(), merged.burstLimit());
        Assertions.assertEquals(List.of("messagesPerMinute"), base.diff(merged));
        Assertions.assertSame(base, base.merge(QueueConfigPatch.EMPTY));
        Assertions.assertSame(base, base.merge(null));
    }
}
