package com.vigil.watchdog.spring;

import com.vigil.watchdog.AggregateFailure;
import com.vigil.watchdog.InvalidConfigurationException;
import com.vigil.watchdog.Supervisor;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

/**
 * Runs {@link Supervisor#watch(Duration)} on a dedicated daemon thread for the lifetime of the
 * application context.
 *
 * <p>Started automatically when the context refreshes and stopped (via
 * {@link Supervisor#terminate()}) when it closes. When supervision fails, the failure is logged,
 * kept as {@link #lastFailure()} and published as a {@link WatchdogFailedEvent}; the runner does
 * not restart the loop.
 *
 * <p>A supervisor cannot be un-terminated, so once stopped the runner does not watch again.
 */
public class WatchdogRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WatchdogRunner.class);

    /** How long {@link #stop()} waits for the watch thread to exit. */
    static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final Supervisor supervisor;
    private final Duration period;
    private final ApplicationEventPublisher publisher;
    private final AtomicReference<AggregateFailure> lastFailure = new AtomicReference<>();
    private volatile Thread thread;

    /**
     * @param supervisor supervisor to run
     * @param period     interval between passes; must be positive
     * @param publisher  receives a {@link WatchdogFailedEvent} when supervision fails
     * @throws InvalidConfigurationException if the period is zero or negative
     */
    public WatchdogRunner(Supervisor supervisor, Duration period, ApplicationEventPublisher publisher) {
        if (supervisor == null) {
            throw new IllegalArgumentException("supervisor must not be null");
        }
        if (period == null) {
            throw new IllegalArgumentException("period must not be null");
        }
        if (period.isZero() || period.isNegative()) {
            throw new InvalidConfigurationException("period", "must be positive, was " + period);
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher must not be null");
        }
        this.supervisor = supervisor;
        this.period = period;
        this.publisher = publisher;
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        Thread watcher = new Thread(this::watch, "watchdog-" + supervisor.name());
        watcher.setDaemon(true);
        thread = watcher;
        watcher.start();
        log.info("Started watchdog '{}' with period {}", supervisor.name(), period);
    }

    @Override
    public void stop() {
        supervisor.terminate();
        Thread watcher = thread;
        if (watcher == null) {
            return;
        }
        try {
            watcher.join(STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for watchdog '{}' to stop", supervisor.name());
        }
        if (watcher.isAlive()) {
            log.warn("Watchdog '{}' did not stop within {}", supervisor.name(), STOP_TIMEOUT);
        }
    }

    @Override
    public boolean isRunning() {
        Thread watcher = thread;
        return watcher != null && watcher.isAlive();
    }

    /**
     * Returns the failure that ended supervision, if any.
     */
    public Optional<AggregateFailure> lastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    private void watch() {
        try {
            supervisor.watch(period).ifPresent(this::onFailure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Watchdog '{}' thread interrupted", supervisor.name());
        } catch (RuntimeException e) {
            log.error("Watchdog '{}' terminated unexpectedly", supervisor.name(), e);
        }
    }

    private void onFailure(AggregateFailure failure) {
        lastFailure.set(failure);
        log.error("Watchdog '{}' failed: {}", supervisor.name(), failure.message());
        publisher.publishEvent(new WatchdogFailedEvent(supervisor, failure));
    }
}
