package com.vigil.watchdog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link LivenessCheck} that expires a fixed {@link Duration} after its last reset.
 * <p>
 * The deadline is kept in an {@link AtomicReference}, so monitored components can reset the
 * check from their own threads without touching the registry lock. A new check is reset once
 * during construction and therefore starts out alive.
 * <p>
 * A zero duration is allowed: the check is alive only at the exact instant of a reset and
 * expired on any later query.
 */
public final class TimedLivenessCheck implements LivenessCheck {

    private final String name;
    private final Duration duration;
    private final Clock clock;
    private final AtomicReference<Instant> deadline = new AtomicReference<>();

    /**
     * Creates a check against the system UTC clock.
     *
     * @param name     name the check is registered under
     * @param duration window length; must not be negative
     * @throws InvalidConfigurationException if the name is blank or the duration is missing or negative
     */
    public TimedLivenessCheck(String name, Duration duration) {
        this(name, duration, Clock.systemUTC());
    }

    /**
     * Creates a check against the given clock.
     *
     * @param name     name the check is registered under
     * @param duration window length; must not be negative
     * @param clock    time source used for resets and expiry queries
     * @throws InvalidConfigurationException if the name is blank or the duration is missing or negative
     */
    public TimedLivenessCheck(String name, Duration duration, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("name", "must not be null or blank");
        }
        if (duration == null) {
            throw new InvalidConfigurationException("duration", "must not be null");
        }
        if (duration.isNegative()) {
            throw new InvalidConfigurationException("duration", "must not be negative, was " + duration);
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.name = name;
        this.duration = duration;
        this.clock = clock;
        reset();
    }

    /**
     * Creates a check against the system UTC clock.
     */
    public static TimedLivenessCheck of(String name, Duration duration) {
        return new TimedLivenessCheck(name, duration);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void reset() {
        deadline.set(clock.instant().plus(duration));
    }

    @Override
    public boolean expired() {
        return clock.instant().isAfter(deadline.get());
    }

    /**
     * Returns the configured window length.
     */
    public Duration duration() {
        return duration;
    }

    /**
     * Returns the instant after which the check counts as expired.
     */
    public Instant deadline() {
        return deadline.get();
    }

    /**
     * Returns the time left before expiry, or {@link Duration#ZERO} once the deadline has passed.
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline.get());
        return left.isNegative() ? Duration.ZERO : left;
    }

    @Override
    public String toString() {
        return "TimedLivenessCheck[name=" + name + ", duration=" + duration + "]";
    }
}
