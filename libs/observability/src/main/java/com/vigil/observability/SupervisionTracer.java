package com.vigil.observability;

import com.vigil.watchdog.AggregateFailure;
import com.vigil.watchdog.SupervisionListener;
import com.vigil.watchdog.SupervisionPass;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.List;

/**
 * Records each supervision pass as an OpenTelemetry span named {@value #SPAN_NAME}.
 * <p>
 * The span is back-dated to the pass's start and ends after its elapsed time, so it lines up
 * with the scan itself rather than with the listener callback. Failed passes carry ERROR status
 * and the failure message.
 * <p>
 * This helper only uses the OTel API; services configure the SDK (exporter, sampler, resource
 * attributes) at boot time.
 */
public final class SupervisionTracer implements SupervisionListener {

    public static final String SPAN_NAME = "watchdog.pass";

    public static final AttributeKey<String> SUPERVISOR = AttributeKey.stringKey("watchdog.supervisor");
    public static final AttributeKey<Long> CHECKS = AttributeKey.longKey("watchdog.checks");
    public static final AttributeKey<Long> EXPIRED_COUNT = AttributeKey.longKey("watchdog.expired.count");
    public static final AttributeKey<List<String>> EXPIRED = AttributeKey.stringArrayKey("watchdog.expired");

    private final Tracer tracer;

    /**
     * Creates a tracer listener backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public SupervisionTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    @Override
    public void onPass(SupervisionPass pass) {
        Span span = tracer.spanBuilder(SPAN_NAME)
                .setSpanKind(SpanKind.INTERNAL)
                .setStartTimestamp(pass.startedAt())
                .setAttribute(SUPERVISOR, pass.supervisor())
                .setAttribute(CHECKS, (long) pass.checked())
                .startSpan();

        AggregateFailure failure = pass.failure();
        if (failure == null) {
            span.setAttribute(EXPIRED_COUNT, 0L);
            span.setStatus(StatusCode.OK);
        } else {
            span.setAttribute(EXPIRED_COUNT, (long) failure.expiredNames().size());
            span.setAttribute(EXPIRED, failure.expiredNames());
            span.setStatus(StatusCode.ERROR, failure.message());
        }
        span.end(pass.startedAt().plus(pass.elapsed()));
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
