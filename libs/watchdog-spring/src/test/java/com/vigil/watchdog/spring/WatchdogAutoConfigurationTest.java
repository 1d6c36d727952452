package com.vigil.watchdog.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.observability.SupervisionTracer;
import com.vigil.observability.WatchdogMetrics;
import com.vigil.watchdog.InvalidConfigurationException;
import com.vigil.watchdog.SupervisionListener;
import com.vigil.watchdog.SupervisionPass;
import com.vigil.watchdog.Supervisor;
import com.vigil.watchdog.TimedLivenessCheck;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

/**
 * Tests for {@link WatchdogAutoConfiguration}: bean creation from {@code vigil.watchdog.*}
 * properties, the enable switch, optional metrics and tracing, and fail-fast on bad windows.
 */
@DisplayName("WatchdogAutoConfiguration")
class WatchdogAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WatchdogAutoConfiguration.class))
            .withPropertyValues("vigil.watchdog.period=50ms");

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should create supervisor and running runner with default name")
        void shouldCreateDefaultBeans() {
            contextRunner.run(context -> {
                assertThat(context).hasSingleBean(Supervisor.class);
                assertThat(context).hasSingleBean(WatchdogRunner.class);
                assertThat(context).doesNotHaveBean(WatchdogMetrics.class);
                assertThat(context).doesNotHaveBean(SupervisionTracer.class);

                assertThat(context.getBean(Supervisor.class).name()).isEqualTo("watchdog");
                assertThat(context.getBean(WatchdogRunner.class).isRunning()).isTrue();
            });
        }

        @Test
        @DisplayName("should stop the supervisor when the context closes")
        void shouldStopOnClose() {
            contextRunner.run(context -> {
                Supervisor supervisor = context.getBean(Supervisor.class);
                context.close();

                assertThat(supervisor.isTerminated()).isTrue();
            });
        }

        @Test
        @DisplayName("should create no beans when disabled")
        void shouldBackOffWhenDisabled() {
            contextRunner.withPropertyValues("vigil.watchdog.enabled=false").run(context -> {
                assertThat(context).doesNotHaveBean(Supervisor.class);
                assertThat(context).doesNotHaveBean(WatchdogRunner.class);
            });
        }
    }

    @Nested
    @DisplayName("Checks")
    class Checks {

        @Test
        @DisplayName("should register a timed check per configured entry")
        void shouldRegisterConfiguredChecks() {
            contextRunner
                    .withPropertyValues(
                            "vigil.watchdog.name=ingest",
                            "vigil.watchdog.checks.db=5m",
                            "vigil.watchdog.checks.queue=10m")
                    .run(context -> {
                        Supervisor supervisor = context.getBean(Supervisor.class);

                        assertThat(supervisor.name()).isEqualTo("ingest");
                        assertThat(supervisor.registry().names()).containsExactly("db", "queue");
                        assertThat(supervisor.registry().get("db"))
                                .hasValueSatisfying(check -> assertThat(check)
                                        .isInstanceOfSatisfying(TimedLivenessCheck.class,
                                                timed -> assertThat(timed.duration()).isEqualTo(Duration.ofMinutes(5))));
                        assertThat(supervisor.checkAll()).isEmpty();
                    });
        }

        @Test
        @DisplayName("should fail startup on a negative window")
        void shouldFailOnNegativeWindow() {
            contextRunner.withPropertyValues("vigil.watchdog.checks.db=-1s").run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(InvalidConfigurationException.class);
            });
        }

        @Test
        @DisplayName("should fail startup on a zero or negative period")
        void shouldFailOnNonPositivePeriod() {
            contextRunner.withPropertyValues("vigil.watchdog.period=0s", "vigil.watchdog.checks.db=5s")
                    .run(context -> {
                        assertThat(context).hasFailed();
                        assertThat(context.getStartupFailure())
                                .hasRootCauseInstanceOf(InvalidConfigurationException.class)
                                .hasStackTraceContaining("period");
                    });
            contextRunner.withPropertyValues("vigil.watchdog.period=-5s")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("should attach user-defined listeners")
        void shouldAttachListenerBeans() {
            List<SupervisionPass> passes = new CopyOnWriteArrayList<>();
            contextRunner
                    .withBean(SupervisionListener.class, () -> new SupervisionListener() {
                        @Override
                        public void onPass(SupervisionPass pass) {
                            passes.add(pass);
                        }
                    })
                    .run(context -> {
                        context.getBean(Supervisor.class).checkAll();

                        assertThat(passes).isNotEmpty();
                    });
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("should publish metrics when a MeterRegistry is present")
        void shouldCreateMetricsWithMeterRegistry() {
            contextRunner
                    .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                    .withPropertyValues("spring.application.name=orders")
                    .run(context -> {
                        assertThat(context).hasSingleBean(WatchdogMetrics.class);
                        assertThat(context.getBean(WatchdogMetrics.class).serviceName()).isEqualTo("orders");

                        context.getBean(Supervisor.class).checkAll();

                        MeterRegistry registry = context.getBean(MeterRegistry.class);
                        assertThat(registry.find(WatchdogMetrics.PASSES).tag("service", "orders").counter())
                                .isNotNull();
                    });
        }

        @Test
        @DisplayName("should trace passes when OpenTelemetry is present")
        void shouldCreateTracerWithOpenTelemetry() {
            contextRunner
                    .withBean(OpenTelemetry.class, OpenTelemetry::noop)
                    .run(context -> assertThat(context).hasSingleBean(SupervisionTracer.class));
        }
    }
}
