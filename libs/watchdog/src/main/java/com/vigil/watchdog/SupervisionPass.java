package com.vigil.watchdog;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One evaluation of every check registered with a {@link Supervisor}.
 *
 * @param supervisor name of the supervisor that ran the pass
 * @param checked    number of checks inspected
 * @param failure    the aggregate failure, or null if every check was alive
 * @param startedAt  when the pass started
 * @param elapsed    how long the scan took
 */
public record SupervisionPass(
        String supervisor,
        int checked,
        AggregateFailure failure,
        Instant startedAt,
        Duration elapsed
) {

    public SupervisionPass {
        if (supervisor == null || supervisor.isBlank()) {
            throw new IllegalArgumentException("supervisor must not be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt must not be null");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed must not be null");
        }
    }

    /** Returns true if no check had expired. */
    public boolean healthy() {
        return failure == null;
    }

    /** Returns the failure, if the pass found expired checks. */
    public Optional<AggregateFailure> failureIfAny() {
        return Optional.ofNullable(failure);
    }
}
