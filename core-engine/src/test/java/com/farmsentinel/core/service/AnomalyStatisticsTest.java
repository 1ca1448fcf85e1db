package com.farmsentinel.core.service;

import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyStatistics}.
 */
class AnomalyStatisticsTest {

    private static final Instant DAY_ONE = Instant.parse("2024-03-01T06:00:00Z");

    @Test
    @DisplayName("Should return zeroed statistics for no anomalies")
    void shouldHandleEmptyList() {
        AnomalyStatistics stats = AnomalyStatistics.of(List.of());

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getAverageScore()).isZero();
        assertThat(stats.getFrequency()).isEqualTo(AnomalyStatistics.Frequency.LOW);
        assertThat(stats.getTopMetric()).isNull();
    }

    @Test
    @DisplayName("Should aggregate counts, scores and the most frequent metric")
    void shouldAggregate() {
        AnomalyStatistics stats = AnomalyStatistics.of(List.of(
                record("temperature", 0.9, Severity.HIGH, AnomalyType.UNIVARIATE, 0),
                record("humidity", 0.6, Severity.MEDIUM, AnomalyType.MULTIVARIATE, 0),
                record("humidity", 0.85, Severity.HIGH, AnomalyType.TEMPORAL, 1)));

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getBySeverity()).containsOnly(entry(Severity.HIGH, 2), entry(Severity.MEDIUM, 1));
        assertThat(stats.getByType()).hasSize(3);
        assertThat(stats.getAverageScore()).isCloseTo(0.7833, within(1e-4));
        assertThat(stats.getMaxScore()).isEqualTo(0.9);
        assertThat(stats.getMinScore()).isEqualTo(0.6);
        assertThat(stats.getTopMetric()).isEqualTo("humidity");
        // 3 anomalies over 2 calendar days
        assertThat(stats.getFrequency()).isEqualTo(AnomalyStatistics.Frequency.MEDIUM);
    }

    @Test
    @DisplayName("Should call more than two anomalies a day high frequency")
    void shouldDetectHighFrequency() {
        AnomalyStatistics stats = AnomalyStatistics.of(List.of(
                record("co2", 0.9, Severity.HIGH, AnomalyType.UNIVARIATE, 0),
                record("co2", 0.9, Severity.HIGH, AnomalyType.UNIVARIATE, 0),
                record("co2", 0.9, Severity.HIGH, AnomalyType.UNIVARIATE, 0)));

        assertThat(stats.getFrequency()).isEqualTo(AnomalyStatistics.Frequency.HIGH);
    }

    @Test
    @DisplayName("Should call one anomaly in a week low frequency")
    void shouldDetectLowFrequency() {
        AnomalyStatistics stats = AnomalyStatistics.of(List.of(
                record("co2", 0.9, Severity.HIGH, AnomalyType.UNIVARIATE, 0),
                record("co2", 0.9, Severity.HIGH, AnomalyType.UNIVARIATE, 6)));

        assertThat(stats.getFrequency()).isEqualTo(AnomalyStatistics.Frequency.LOW);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyRecord record(String metric, double score, Severity severity, AnomalyType type,
            int dayOffset) {
        return AnomalyRecord.builder()
                .roomId("room-a")
                .timestamp(DAY_ONE.plus(Duration.ofDays(dayOffset)))
                .metricName(metric)
                .value(1.0)
                .combinedScore(score)
                .anomalyType(type)
                .severity(severity)
                .build();
    }
}
