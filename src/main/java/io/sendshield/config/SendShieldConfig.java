package io.sendshield.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SendShieldConfig {
    public static final long DEFAULT_DISPATCH_INTERVAL_MS = 500L;
    public static final long DEFAULT_HEALTH_RECOMPUTE_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_SEND_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_SETTINGS_CHECK_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_DISPATCH_THREADS = 4;

    private final Path rootDir;

    public SendShieldConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SendShieldConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new SendShieldConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("sendshield.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("sendshield-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKey() {
        return securityRoot().resolve("audit-signing.key");
    }
}
