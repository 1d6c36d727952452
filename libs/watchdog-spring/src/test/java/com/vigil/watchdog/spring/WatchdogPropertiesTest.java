package com.vigil.watchdog.spring;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link WatchdogProperties} record: compact constructor defaults without a Spring
 * context.
 */
@DisplayName("WatchdogProperties")
class WatchdogPropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new WatchdogProperties(true, "ingest", Duration.ofMillis(250), Map.of("db", Duration.ofSeconds(5)));

        assertThat(props.enabled()).isTrue();
        assertThat(props.name()).isEqualTo("ingest");
        assertThat(props.period()).isEqualTo(Duration.ofMillis(250));
        assertThat(props.checks()).containsEntry("db", Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("defaults name, period and checks when missing")
    void defaultsMissingValues() {
        var props = new WatchdogProperties(true, " ", null, null);

        assertThat(props.name()).isEqualTo("watchdog");
        assertThat(props.period()).isEqualTo(WatchdogProperties.DEFAULT_PERIOD);
        assertThat(props.checks()).isEmpty();
    }

    @Test
    @DisplayName("copies the checks map")
    void copiesChecks() {
        var checks = new HashMap<String, Duration>();
        checks.put("db", Duration.ofSeconds(5));

        var props = new WatchdogProperties(true, "ingest", null, checks);
        checks.put("queue", Duration.ofSeconds(1));

        assertThat(props.checks()).containsOnlyKeys("db");
    }
}
