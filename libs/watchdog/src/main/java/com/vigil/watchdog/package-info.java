/**
 * In-process liveness watchdog.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.vigil.watchdog.LivenessCheck} and {@link com.vigil.watchdog.TimedLivenessCheck}
 *       for named heartbeats that monitored components reset
 *   <li>{@link com.vigil.watchdog.LivenessRegistry}, the locked name-to-check map
 *   <li>{@link com.vigil.watchdog.Supervisor}, which polls the registry until terminated or until a
 *       check expires
 *   <li>{@link com.vigil.watchdog.AggregateFailure}, the value describing every expired check
 * </ul>
 */
package com.vigil.watchdog;
