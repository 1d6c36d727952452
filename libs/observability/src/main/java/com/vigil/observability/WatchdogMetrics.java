package com.vigil.observability;

import com.vigil.watchdog.SupervisionListener;
import com.vigil.watchdog.SupervisionPass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes Micrometer metrics for every supervision pass.
 * <p>
 * Every meter carries a {@code service} tag and a {@code supervisor} tag so several supervisors
 * in one process can be told apart:
 * <ul>
 *   <li>{@value #PASSES} counter, tagged {@code outcome=healthy|expired}</li>
 *   <li>{@value #EXPIRATIONS} counter, tagged {@code check=<name>} for each expired check</li>
 *   <li>{@value #PASS_DURATION} timer</li>
 *   <li>{@value #REGISTERED} gauge of checks inspected by the latest pass</li>
 *   <li>{@value #STOPS} counter of watch loops ended by termination</li>
 * </ul>
 * Attach with {@code supervisor.addListener(new WatchdogMetrics(meterRegistry, "ingest-service"))}.
 */
public final class WatchdogMetrics implements SupervisionListener {

    public static final String PASSES = "watchdog.passes";
    public static final String EXPIRATIONS = "watchdog.check.expirations";
    public static final String PASS_DURATION = "watchdog.pass.duration";
    public static final String REGISTERED = "watchdog.checks.registered";
    public static final String STOPS = "watchdog.stops";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the supervisor name. */
    public static final String TAG_SUPERVISOR = "supervisor";

    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_CHECK = "check";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, AtomicLong> registeredGauges = new ConcurrentHashMap<>();

    /**
     * Creates metrics bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public WatchdogMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    @Override
    public void onPass(SupervisionPass pass) {
        String supervisor = pass.supervisor();

        Counter.builder(PASSES)
                .description("Supervision passes by outcome")
                .tags(baseTags(supervisor, TAG_OUTCOME, pass.healthy() ? "healthy" : "expired"))
                .register(registry)
                .increment();

        Timer.builder(PASS_DURATION)
                .description("Time spent scanning all liveness checks")
                .tags(baseTags(supervisor))
                .register(registry)
                .record(pass.elapsed());

        registeredGauge(supervisor).set(pass.checked());

        pass.failureIfAny().ifPresent(failure -> {
            for (String check : failure.expiredNames()) {
                Counter.builder(EXPIRATIONS)
                        .description("Passes in which a liveness check was found expired")
                        .tags(baseTags(supervisor, TAG_CHECK, check))
                        .register(registry)
                        .increment();
            }
        });
    }

    @Override
    public void onStopped(String supervisor) {
        Counter.builder(STOPS)
                .description("Watch loops ended by a termination request")
                .tags(baseTags(supervisor))
                .register(registry)
                .increment();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private AtomicLong registeredGauge(String supervisor) {
        return registeredGauges.computeIfAbsent(supervisor, name -> {
            AtomicLong value = new AtomicLong(0);
            Gauge.builder(REGISTERED, value, AtomicLong::doubleValue)
                    .description("Liveness checks inspected by the latest pass")
                    .tags(baseTags(name))
                    .register(registry);
            return value;
        });
    }

    private Tags baseTags(String supervisor, String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_SUPERVISOR, supervisor);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
