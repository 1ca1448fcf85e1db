package com.farmsentinel.core.service;

import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary figures over a set of anomaly records.
 *
 * <p>
 * Frequency is anomalies per calendar day (UTC) between the first and last
 * record, inclusive: above 2 per day is {@code high}, above 0.5 is
 * {@code medium}, anything else {@code low}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyStatistics {

    public enum Frequency {
        LOW("low"),
        MEDIUM("medium"),
        HIGH("high");

        private final String label;

        Frequency(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }

    static final double HIGH_FREQUENCY_PER_DAY = 2.0;
    static final double MEDIUM_FREQUENCY_PER_DAY = 0.5;

    private final int total;
    private final Map<Severity, Integer> bySeverity;
    private final Map<AnomalyType, Integer> byType;
    private final double averageScore;
    private final double maxScore;
    private final double minScore;
    private final Frequency frequency;
    private final String topMetric;

    private AnomalyStatistics(int total, Map<Severity, Integer> bySeverity, Map<AnomalyType, Integer> byType,
            double averageScore, double maxScore, double minScore, Frequency frequency, String topMetric) {
        this.total = total;
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byType = Collections.unmodifiableMap(byType);
        this.averageScore = averageScore;
        this.maxScore = maxScore;
        this.minScore = minScore;
        this.frequency = frequency;
        this.topMetric = topMetric;
    }

    public static AnomalyStatistics of(List<AnomalyRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
        if (records.isEmpty()) {
            return new AnomalyStatistics(0, bySeverity, byType, 0.0, 0.0, 0.0, Frequency.LOW, null);
        }

        Map<String, Integer> byMetric = new LinkedHashMap<>();
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        LocalDate first = null;
        LocalDate last = null;
        for (AnomalyRecord r : records) {
            bySeverity.merge(r.getSeverity(), 1, Integer::sum);
            byType.merge(r.getAnomalyType(), 1, Integer::sum);
            byMetric.merge(r.getMetricName(), 1, Integer::sum);
            sum += r.getCombinedScore();
            max = Math.max(max, r.getCombinedScore());
            min = Math.min(min, r.getCombinedScore());
            LocalDate day = LocalDate.ofInstant(r.getTimestamp(), ZoneOffset.UTC);
            first = first == null || day.isBefore(first) ? day : first;
            last = last == null || day.isAfter(last) ? day : last;
        }

        long spanDays = ChronoUnit.DAYS.between(first, last) + 1;
        double perDay = (double) records.size() / spanDays;
        Frequency frequency = perDay > HIGH_FREQUENCY_PER_DAY ? Frequency.HIGH
                : perDay > MEDIUM_FREQUENCY_PER_DAY ? Frequency.MEDIUM
                : Frequency.LOW;
        String topMetric = byMetric.entrySet().stream()
                .max(Comparator.comparingInt(Map.Entry::getValue))
                .map(Map.Entry::getKey)
                .orElse(null);

        return new AnomalyStatistics(records.size(), bySeverity, byType, sum / records.size(), max, min,
                frequency, topMetric);
    }

    // ------- Getters -------

    public int getTotal() {
        return total;
    }

    public Map<Severity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<AnomalyType, Integer> getByType() {
        return byType;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public double getMaxScore() {
        return maxScore;
    }

    public double getMinScore() {
        return minScore;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    /**
     * @return metric with the most anomalies, first seen wins ties; {@code null} when empty
     */
    public String getTopMetric() {
        return topMetric;
    }

    @Override
    public String toString() {
        return "AnomalyStatistics{total=" + total + ", bySeverity=" + bySeverity + ", frequency=" + frequency + '}';
    }
}
