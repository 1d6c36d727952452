package com.vigil.watchdog;

/**
 * Lifecycle of a {@link Supervisor}'s watch loop.
 */
public enum SupervisorState {

    /** No watch loop has run yet. */
    IDLE,

    /** A watch loop is running. */
    WATCHING,

    /** The last watch loop ended because termination was requested (or its thread was interrupted). */
    STOPPED,

    /** The last watch loop ended because one or more checks expired. */
    FAILED
}
