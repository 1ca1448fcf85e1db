package com.farmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted combination of every successful {@link DetectionResult} for one
 * point.
 *
 * <p>
 * {@code contributions} lists the detectors that scored the point, in
 * {@link DetectorKind} order, each with its weight after renormalizing over
 * the scoring detectors. {@code excluded} names participating detectors that
 * could not score the point, with the reason.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleScore implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String roomId;
    private final String metricName;
    private final Instant timestamp;
    private final double value;
    private final double combinedScore;
    private final Severity severity;
    private final List<Contribution> contributions;
    private final Map<DetectorKind, String> excluded;

    public EnsembleScore(String roomId, String metricName, Instant timestamp, double value, double combinedScore,
            Severity severity, List<Contribution> contributions, Map<DetectorKind, String> excluded) {
        this.roomId = Objects.requireNonNull(roomId, "roomId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        if (!(combinedScore >= 0.0 && combinedScore <= 1.0)) {
            throw new IllegalArgumentException("combinedScore outside [0,1]: " + combinedScore);
        }
        this.value = value;
        this.combinedScore = combinedScore;
        this.contributions = List.copyOf(contributions);
        this.excluded = excluded == null || excluded.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(excluded));
    }

    public String getRoomId() {
        return roomId;
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

    public double getCombinedScore() {
        return combinedScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    public List<Contribution> getContributions() {
        return contributions;
    }

    public Map<DetectorKind, String> getExcluded() {
        return excluded;
    }

    @Override
    public String toString() {
        return "EnsembleScore{" +
                "room='" + roomId + '\'' +
                ", metric='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", combined=" + combinedScore +
                ", severity=" + severity +
                ", contributions=" + contributions.size() +
                '}';
    }

    // ---------------------------------------------------------------
    // Contribution
    // ---------------------------------------------------------------

    /**
     * One detector's share of a combined score.
     */
    public static final class Contribution implements Serializable {

        private static final long serialVersionUID = 1L;

        private final DetectorKind kind;
        private final double weight;
        private final DetectionResult result;

        public Contribution(DetectorKind kind, double weight, DetectionResult result) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
            this.result = Objects.requireNonNull(result, "result must not be null");
            this.weight = weight;
        }

        public DetectorKind getKind() {
            return kind;
        }

        /**
         * @return the weight renormalized over the detectors that scored this point
         */
        public double getWeight() {
            return weight;
        }

        public double getNormalizedScore() {
            return result.getNormalizedScore();
        }

        /**
         * @return {@code weight * normalizedScore}
         */
        public double getWeightedScore() {
            return weight * result.getNormalizedScore();
        }

        public DetectionResult getResult() {
            return result;
        }

        @Override
        public String toString() {
            return kind + "(w=" + weight + ", s=" + result.getNormalizedScore() + ")";
        }
    }
}
