package com.vigil.watchdog;

/**
 * Thrown when a check or supervisor is constructed with malformed parameters, such as a
 * negative window or a blank name.
 * <p>
 * Raised at construction time and never retried: the caller has to fix the configuration.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private final String parameter;

    public InvalidConfigurationException(String parameter, String reason) {
        super("Invalid watchdog configuration for '%s': %s".formatted(parameter, reason));
        this.parameter = parameter;
    }

    /**
     * Returns the name of the offending parameter (e.g., "duration").
     */
    public String parameter() {
        return parameter;
    }
}
