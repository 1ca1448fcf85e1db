package com.farmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Score assigned by one detector to one point.
 *
 * <p>
 * {@code normalizedScore} is always within {@code [0, 1]}; {@code rawScore}
 * is in the detector's native unit. {@code diagnostics} carries the
 * intermediate quantities the explainer turns into reason text (z-score,
 * fences, LOF, ...).
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final Instant timestamp;
    private final double value;
    private final double rawScore;
    private final double normalizedScore;
    private final DetectorKind kind;
    private final Map<String, Double> diagnostics;

    public DetectionResult(String metricName, Instant timestamp, double value, double rawScore,
            double normalizedScore, DetectorKind kind, Map<String, Double> diagnostics) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (!(normalizedScore >= 0.0 && normalizedScore <= 1.0)) {
            throw new IllegalArgumentException(
                    kind + " produced normalized score outside [0,1]: " + normalizedScore);
        }
        this.value = value;
        this.rawScore = rawScore;
        this.normalizedScore = normalizedScore;
        this.diagnostics = diagnostics == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getNormalizedScore() {
        return normalizedScore;
    }

    public DetectorKind getKind() {
        return kind;
    }

    public Map<String, Double> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return the named diagnostic, or {@code fallback} when absent
     */
    public double diagnostic(String name, double fallback) {
        Double v = diagnostics.get(name);
        return v != null ? v : fallback;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "kind=" + kind +
                ", metric='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", normalized=" + normalizedScore +
                '}';
    }
}
