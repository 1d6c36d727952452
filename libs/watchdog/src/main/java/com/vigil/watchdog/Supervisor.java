package com.vigil.watchdog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Periodically verifies every {@link LivenessCheck} in its {@link LivenessRegistry} until told
 * to stop or until a check expires.
 * <p>
 * {@link #watch(Duration)} is meant to run on a dedicated thread, while checks are added,
 * removed and reset from other threads and {@link #terminate()} is called by whoever owns the
 * lifecycle. The loop waits on a {@link CountDownLatch} between passes, so a termination request
 * wakes it immediately instead of after the current period.
 * <p>
 * The loop is fail-fast: the first pass that finds an expired check ends it and returns the
 * {@link AggregateFailure}. Nothing is retried; the caller decides whether to call
 * {@link #watch(Duration)} again, escalate, or shut down.
 * <p>
 * Example usage:
 * <pre>{@code
 * Supervisor supervisor = new Supervisor("ingest-pipeline");
 * supervisor.add(TimedLivenessCheck.of("db", Duration.ofSeconds(5)));
 *
 * executor.submit(() -> supervisor.watch(Duration.ofSeconds(1))
 *         .ifPresent(failure -> alerts.raise(failure.message())));
 *
 * // on shutdown
 * supervisor.terminate();
 * }</pre>
 */
public final class Supervisor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    /** Name used when none is supplied. */
    public static final String DEFAULT_NAME = "watchdog";

    /** MDC key holding the supervisor name while {@link #watch(Duration)} runs. */
    public static final String MDC_WATCHDOG = "watchdog";

    private final String name;
    private final Clock clock;
    private final LivenessRegistry registry;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean watching = new AtomicBoolean(false);
    private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.IDLE);
    private final List<SupervisionListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a supervisor named {@value #DEFAULT_NAME} on the system UTC clock.
     */
    public Supervisor() {
        this(DEFAULT_NAME);
    }

    /**
     * Creates a supervisor with the given name on the system UTC clock.
     *
     * @param name name used in logs, metrics and traces
     */
    public Supervisor(String name) {
        this(name, Clock.systemUTC());
    }

    /**
     * Creates a supervisor with the given name and clock.
     *
     * @param name  name used in logs, metrics and traces
     * @param clock time source for pass timestamps
     */
    public Supervisor(String name, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("name", "must not be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.name = name;
        this.clock = clock;
        this.registry = new LivenessRegistry(clock);
    }

    /**
     * Registers a check, replacing any check with the same name.
     */
    public void add(LivenessCheck check) {
        registry.add(check);
    }

    /**
     * Removes the check registered under {@code name}; unknown names are ignored.
     *
     * @return true if a check was removed
     */
    public boolean remove(String name) {
        return registry.remove(name);
    }

    /**
     * Removes the check registered under the given check's name.
     *
     * @return true if a check was removed
     */
    public boolean remove(LivenessCheck check) {
        return registry.remove(check);
    }

    /**
     * Runs a single pass over every registered check.
     *
     * @return empty if every check is alive, otherwise the failure naming all expired checks
     */
    public Optional<AggregateFailure> checkAll() {
        return runPass().failureIfAny();
    }

    /**
     * Checks all registered entries every {@code period} until {@link #terminate()} is called or
     * a check expires.
     * <p>
     * If termination was requested before the call, returns immediately without checking.
     *
     * @param period time to wait between passes; must be positive
     * @return empty when stopped by {@link #terminate()}, otherwise the first failure observed
     * @throws InterruptedException          if the watching thread is interrupted while waiting
     * @throws InvalidConfigurationException if the period is null, zero or negative
     * @throws IllegalStateException         if another thread is already watching this supervisor
     * @throws RuntimeException              rethrown from a check whose {@code expired()} fails;
     *                                       the supervisor is left {@link SupervisorState#FAILED}
     */
    public Optional<AggregateFailure> watch(Duration period) throws InterruptedException {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new InvalidConfigurationException("period", "must be positive, was " + period);
        }
        if (!watching.compareAndSet(false, true)) {
            throw new IllegalStateException("Supervisor '" + name + "' is already watching");
        }
        MDC.put(MDC_WATCHDOG, name);
        try {
            state.set(SupervisorState.WATCHING);
            log.info("Watching {} liveness checks every {}", registry.size(), period);

            while (!isTerminated()) {
                SupervisionPass pass = runPass();
                if (!pass.healthy()) {
                    state.set(SupervisorState.FAILED);
                    log.warn("Supervision failed: {}", pass.failure().message());
                    return Optional.of(pass.failure());
                }
                if (stopSignal.await(TimeUnit.NANOSECONDS.convert(period), TimeUnit.NANOSECONDS)) {
                    break;
                }
            }

            state.set(SupervisorState.STOPPED);
            log.info("Supervision stopped on request");
            notifyStopped();
            return Optional.empty();
        } catch (InterruptedException e) {
            state.set(SupervisorState.STOPPED);
            log.info("Supervision interrupted");
            throw e;
        } catch (RuntimeException e) {
            state.set(SupervisorState.FAILED);
            log.error("Supervision aborted by a failing check", e);
            throw e;
        } finally {
            MDC.remove(MDC_WATCHDOG);
            watching.set(false);
        }
    }

    /**
     * Asks a running (or future) {@link #watch(Duration)} to return. Idempotent and safe to call
     * from any thread.
     */
    public void terminate() {
        if (stopSignal.getCount() > 0) {
            stopSignal.countDown();
            log.debug("Termination requested for supervisor '{}'", name);
        }
    }

    /**
     * Returns true once {@link #terminate()} has been called.
     */
    public boolean isTerminated() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Returns the current lifecycle state.
     */
    public SupervisorState state() {
        return state.get();
    }

    /**
     * Adds a listener notified after every pass.
     */
    public void addListener(SupervisionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    /**
     * Removes a previously added listener.
     *
     * @return true if the listener was registered
     */
    public boolean removeListener(SupervisionListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Returns the registry holding this supervisor's checks.
     */
    public LivenessRegistry registry() {
        return registry;
    }

    /**
     * Returns the supervisor name.
     */
    public String name() {
        return name;
    }

    // ── Private Helpers ──

    private SupervisionPass runPass() {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        LivenessRegistry.Scan scan = registry.scan();
        SupervisionPass pass = new SupervisionPass(
                name, scan.checked(), scan.failure(), startedAt, Duration.ofNanos(System.nanoTime() - start));

        for (SupervisionListener listener : listeners) {
            try {
                listener.onPass(pass);
            } catch (RuntimeException e) {
                log.warn("Supervision listener {} failed in onPass", listener, e);
            }
        }
        return pass;
    }

    private void notifyStopped() {
        for (SupervisionListener listener : listeners) {
            try {
                listener.onStopped(name);
            } catch (RuntimeException e) {
                log.warn("Supervision listener {} failed in onStopped", listener, e);
            }
        }
    }
}
