package com.vigil.watchdog.spring;

import com.vigil.observability.SupervisionTracer;
import com.vigil.observability.WatchdogMetrics;
import com.vigil.watchdog.SupervisionListener;
import com.vigil.watchdog.Supervisor;
import com.vigil.watchdog.TimedLivenessCheck;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Spring Boot auto-configuration for the watchdog.
 *
 * <h2>Beans</h2>
 *
 * <ul>
 *   <li>{@link Supervisor}: one {@link TimedLivenessCheck} per {@code vigil.watchdog.checks}
 *       entry, with every {@link SupervisionListener} bean attached
 *   <li>{@link WatchdogRunner}: watches on a background thread for the context's lifetime
 *   <li>{@link WatchdogMetrics}: only when a {@link MeterRegistry} bean exists
 *   <li>{@link SupervisionTracer}: only when an {@link OpenTelemetry} bean exists
 * </ul>
 *
 * <p>Disable with {@code vigil.watchdog.enabled=false}.
 *
 * @see WatchdogProperties
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.opentelemetry.OpenTelemetryAutoConfiguration"
})
@EnableConfigurationProperties(WatchdogProperties.class)
@ConditionalOnProperty(prefix = "vigil.watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WatchdogAutoConfiguration {

    /** Instrumentation scope name for the watchdog tracer. */
    public static final String INSTRUMENTATION_SCOPE = "com.vigil.watchdog";

    @Bean
    @ConditionalOnMissingBean
    public Supervisor watchdogSupervisor(
            WatchdogProperties properties, ObjectProvider<SupervisionListener> listeners) {
        Supervisor supervisor = new Supervisor(properties.name());
        properties.checks().forEach((name, window) -> supervisor.add(new TimedLivenessCheck(name, window)));
        listeners.orderedStream().forEach(supervisor::addListener);
        return supervisor;
    }

    @Bean
    @ConditionalOnMissingBean
    public WatchdogRunner watchdogRunner(
            Supervisor supervisor, WatchdogProperties properties, ApplicationEventPublisher publisher) {
        return new WatchdogRunner(supervisor, properties.period(), publisher);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        WatchdogMetrics watchdogMetrics(
                MeterRegistry meterRegistry, WatchdogProperties properties, Environment environment) {
            String serviceName = environment.getProperty("spring.application.name", properties.name());
            return new WatchdogMetrics(meterRegistry, serviceName);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(OpenTelemetry.class)
    static class TracingConfiguration {

        @Bean
        @ConditionalOnBean(OpenTelemetry.class)
        @ConditionalOnMissingBean
        SupervisionTracer supervisionTracer(OpenTelemetry openTelemetry) {
            return new SupervisionTracer(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
        }
    }
}
