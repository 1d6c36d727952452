package com.vigil.watchdog.spring;

import com.vigil.watchdog.AggregateFailure;
import com.vigil.watchdog.Supervisor;
import org.springframework.context.ApplicationEvent;

/**
 * Published by {@link WatchdogRunner} when supervision ends because one or more checks expired.
 * <p>
 * The event only reports. Restarting components, alerting or shutting down is up to the
 * application's {@code @EventListener}s.
 */
public class WatchdogFailedEvent extends ApplicationEvent {

    private final AggregateFailure failure;

    public WatchdogFailedEvent(Supervisor source, AggregateFailure failure) {
        super(source);
        this.failure = failure;
    }

    public AggregateFailure failure() {
        return failure;
    }

    public Supervisor supervisor() {
        return (Supervisor) getSource();
    }
}
