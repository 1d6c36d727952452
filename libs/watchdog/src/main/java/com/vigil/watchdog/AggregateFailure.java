package com.vigil.watchdog;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Result of a supervision pass in which one or more checks had expired.
 * <p>
 * Names are de-duplicated and sorted so the same set of expired checks always renders the same
 * way, independent of registry iteration order. {@link #toString()} returns {@link #message()},
 * which log-based consumers parse.
 *
 * @param expiredNames names of every expired check, sorted ascending (never empty)
 * @param detectedAt   when the pass that found the expired checks ran
 */
public record AggregateFailure(List<String> expiredNames, Instant detectedAt) {

    /** Prefix of the rendered failure message. */
    public static final String MESSAGE_PREFIX = "watchdog timed out on the following services: ";

    public AggregateFailure {
        if (expiredNames == null || expiredNames.isEmpty()) {
            throw new IllegalArgumentException("expiredNames must not be null or empty");
        }
        if (detectedAt == null) {
            throw new IllegalArgumentException("detectedAt must not be null");
        }
        expiredNames = expiredNames.stream().distinct().sorted().toList();
    }

    /**
     * Creates a failure for the given names, detected at {@code detectedAt}.
     */
    public static AggregateFailure of(Collection<String> expiredNames, Instant detectedAt) {
        return new AggregateFailure(List.copyOf(expiredNames), detectedAt);
    }

    /**
     * Renders the failure as {@code watchdog timed out on the following services: a, b}.
     */
    public String message() {
        return MESSAGE_PREFIX + String.join(", ", expiredNames);
    }

    /**
     * Returns true if the named check is among the expired ones.
     */
    public boolean contains(String name) {
        return expiredNames.contains(name);
    }

    @Override
    public String toString() {
        return message();
    }
}
