/**
 * Metrics and tracing for watchdog supervision.
 *
 * <p>Both classes are {@link com.vigil.watchdog.SupervisionListener}s: attach them to a
 * {@link com.vigil.watchdog.Supervisor} and every pass is reported. They never act on a failure.
 *
 * <ul>
 *   <li>{@link com.vigil.observability.WatchdogMetrics} publishes Micrometer counters, a timer and a
 *       gauge
 *   <li>{@link com.vigil.observability.SupervisionTracer} emits one OpenTelemetry span per pass
 * </ul>
 */
package com.vigil.observability;
