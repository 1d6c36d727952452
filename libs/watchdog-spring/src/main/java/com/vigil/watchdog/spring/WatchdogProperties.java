package com.vigil.watchdog.spring;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the application's watchdog.
 *
 * <p>Properties are bound from the {@code vigil.watchdog.*} prefix:
 *
 * <pre>
 * vigil:
 *   watchdog:
 *     enabled: true
 *     name: ingest-pipeline
 *     period: 1s
 *     checks:
 *       db: 5s
 *       kafka-consumer: 30s
 * </pre>
 *
 * <p>Each entry under {@code checks} becomes a {@link com.vigil.watchdog.TimedLivenessCheck};
 * components look it up by name on the {@link com.vigil.watchdog.Supervisor} bean and reset it.
 *
 * @param enabled whether the watchdog beans are created (default true)
 * @param name    supervisor name used in logs, metrics and traces (default "watchdog")
 * @param period  interval between supervision passes (default 1s)
 * @param checks  check name to window length
 */
@ConfigurationProperties(prefix = "vigil.watchdog")
@Validated
public record WatchdogProperties(
        @DefaultValue("true") boolean enabled,
        @NotBlank String name, @NotNull Duration period, Map<String, Duration> checks) {

    /** Default interval between passes. */
    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(1);

    /**
     * Compact constructor. Applies defaults for optional fields. Runs before Bean Validation, so
     * defaults satisfy constraints.
     */
    public WatchdogProperties {
        if (name == null || name.isBlank()) {
            name = "watchdog";
        }
        if (period == null) {
            period = DEFAULT_PERIOD;
        }
        checks = checks == null ? Map.of() : Map.copyOf(checks);
    }
}
