package com.farmsentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should use defaults when no variables are set")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of());

        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getDetectionThreads()).isEqualTo(4);
        assertThat(config.getMaxReturnedAnomalies()).isEqualTo(20);
        assertThat(config.getEnsembleConfigPath()).isEmpty();
        assertThat(config.getReadingsPath()).isEmpty();
    }

    @Test
    @DisplayName("Should read every variable and ignore blank ones")
    void shouldReadVariables() {
        Map<String, String> env = new HashMap<>();
        env.put("HTTP_PORT", "9090");
        env.put("ENSEMBLE_CONFIG_PATH", "/etc/farm/ensemble.yml");
        env.put("READINGS_PATH", "/data/readings.json");
        env.put("DETECTION_THREADS", "8");
        env.put("MAX_RETURNED_ANOMALIES", " ");

        ServiceConfig config = ServiceConfig.fromEnvironment(env);

        assertThat(config.getHttpPort()).isEqualTo(9090);
        assertThat(config.getEnsembleConfigPath()).isEqualTo("/etc/farm/ensemble.yml");
        assertThat(config.getReadingsPath()).isEqualTo("/data/readings.json");
        assertThat(config.getDetectionThreads()).isEqualTo(8);
        assertThat(config.getMaxReturnedAnomalies()).isEqualTo(20);
        assertThat(config.toString()).contains("httpPort=9090");
    }

    @Test
    @DisplayName("Should wrap unparseable numbers in IllegalStateException")
    void shouldRejectNonNumericPort() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("HTTP_PORT", "eighty")))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> ServiceConfig.builder().httpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> ServiceConfig.builder().detectionThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServiceConfig.builder().maxReturnedAnomalies(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
