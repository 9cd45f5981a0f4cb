package io.sendshield.config;

import java.util.List;

/**
 * Rejected configuration update. The previously active configuration stays in force.
 */
public final class ConfigException extends RuntimeException {
    private final List<String> violations;

    public ConfigException(List<String> violations) {
        super("Invalid queue configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
