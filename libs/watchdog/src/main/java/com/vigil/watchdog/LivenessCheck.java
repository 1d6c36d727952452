package com.vigil.watchdog;

/**
 * A single named heartbeat that a monitored component keeps alive.
 * <p>
 * The monitored component calls {@link #reset()} ("whacks" the check) to prove it is still
 * making progress. A {@link Supervisor} periodically asks every registered check whether it has
 * {@link #expired()}; {@code true} is always the failure condition.
 * <p>
 * Implementations must allow {@link #reset()} and {@link #expired()} to be called concurrently
 * from any thread without external locking.
 * <p>
 * Example usage:
 * <pre>{@code
 * LivenessCheck ingest = TimedLivenessCheck.of("ingest", Duration.ofSeconds(30));
 * supervisor.add(ingest);
 *
 * // inside the ingest loop
 * ingest.reset();
 * }</pre>
 */
public interface LivenessCheck {

    /**
     * Returns the name this check is registered under. Never blank.
     */
    String name();

    /**
     * Re-arms the check so that its window starts from now.
     */
    void reset();

    /**
     * Returns {@code true} once the check's window has elapsed since the last reset.
     * Has no side effects and never re-arms the check.
     *
     * @return true if the check has expired (unhealthy)
     */
    boolean expired();
}
