package com.vigil.watchdog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concurrency-safe collection of {@link LivenessCheck}s keyed by name.
 * <p>
 * Checks are registered by name; registering a second check under the same name replaces the
 * first. {@link #checkAll()} scans every entry while holding the read lock, and
 * {@link #add(LivenessCheck)} / {@link #remove(String)} hold the write lock, so a scan never
 * observes a half-applied mutation. Individual checks are reset by their owners without going
 * through this lock.
 */
public final class LivenessRegistry {

    private static final Logger log = LoggerFactory.getLogger(LivenessRegistry.class);

    private final Map<String, LivenessCheck> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    /**
     * Creates a registry that timestamps failures with the system UTC clock.
     */
    public LivenessRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a registry that timestamps failures with the given clock.
     *
     * @param clock time source for {@link AggregateFailure#detectedAt()}
     */
    public LivenessRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Registers a check under its name, replacing any check already registered under that name.
     *
     * @param check the check to register
     */
    public void add(LivenessCheck check) {
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        String name = check.name();
        LivenessCheck previous;
        lock.writeLock().lock();
        try {
            previous = entries.put(name, check);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null && previous != check) {
            log.debug("Replaced liveness check '{}'", name);
        } else {
            log.debug("Registered liveness check '{}'", name);
        }
    }

    /**
     * Removes the check registered under {@code name}. Removing an unknown name is a no-op.
     *
     * @param name name of the check to remove
     * @return true if a check was removed
     */
    public boolean remove(String name) {
        if (name == null) {
            return false;
        }
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = entries.remove(name) != null;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.debug("Removed liveness check '{}'", name);
        }
        return removed;
    }

    /**
     * Removes whatever check is registered under the given check's name.
     *
     * @param check the check whose name should be removed
     * @return true if a check was removed
     */
    public boolean remove(LivenessCheck check) {
        return check != null && remove(check.name());
    }

    /**
     * Checks every registered entry once.
     *
     * @return empty if no check has expired, otherwise the failure naming every expired check
     */
    public Optional<AggregateFailure> checkAll() {
        return scan().outcome();
    }

    /**
     * Scans all entries under the read lock and reports how many were checked alongside the
     * failure, if any.
     */
    Scan scan() {
        List<String> expired = new ArrayList<>();
        int checked;
        lock.readLock().lock();
        try {
            checked = entries.size();
            for (LivenessCheck check : entries.values()) {
                if (check.expired()) {
                    expired.add(check.name());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        if (expired.isEmpty()) {
            return new Scan(checked, null);
        }
        return new Scan(checked, AggregateFailure.of(expired, clock.instant()));
    }

    /**
     * Returns the check registered under {@code name}, if any.
     */
    public Optional<LivenessCheck> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a sorted snapshot of the registered names.
     */
    public SortedSet<String> names() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSortedSet(new TreeSet<>(entries.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of registered checks.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns true if no checks are registered.
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Outcome of one scan.
     *
     * @param checked number of checks inspected
     * @param failure the failure, or null if none had expired
     */
    record Scan(int checked, AggregateFailure failure) {

        Optional<AggregateFailure> outcome() {
            return Optional.ofNullable(failure);
        }
    }
}
