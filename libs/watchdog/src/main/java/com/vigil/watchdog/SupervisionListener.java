package com.vigil.watchdog;

/**
 * Observer of a {@link Supervisor}'s passes, used for metrics, tracing and similar side channels.
 * <p>
 * Listeners are invoked on the thread that ran the pass. They observe results only; acting on a
 * failure stays with whoever called {@link Supervisor#watch(java.time.Duration)}. A listener
 * that throws is logged and skipped.
 */
public interface SupervisionListener {

    /**
     * Called after every pass, healthy or not.
     *
     * @param pass the completed pass
     */
    default void onPass(SupervisionPass pass) {
    }

    /**
     * Called when {@link Supervisor#watch(java.time.Duration)} returns because
     * {@link Supervisor#terminate()} was requested.
     *
     * @param supervisor name of the supervisor that stopped
     */
    default void onStopped(String supervisor) {
    }
}
