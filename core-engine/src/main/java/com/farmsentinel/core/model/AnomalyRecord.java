package com.farmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A flagged observation, persisted through an anomaly sink and reviewed by
 * operators.
 *
 * <p>
 * Records are immutable. Persistence assigns the id via {@link #withId(long)};
 * feedback produces an updated copy via {@link #applyFeedback}. A dismissed
 * record is kept, with its state and feedback history, rather than removed.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code roomId}, {@code metricName},
 * {@code timestamp}, {@code anomalyType} and {@code severity} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Assigned by the sink; {@code null} until persisted. */
    private final Long id;
    private final String roomId;
    private final String farmId;
    private final Instant timestamp;
    private final String metricName;
    private final double value;
    private final double combinedScore;
    private final AnomalyType anomalyType;
    private final Severity severity;
    private final String description;
    private final List<ContributingFactor> factors;
    private final ConfirmationState confirmationState;
    private final String feedbackNotes;
    private final List<FeedbackEntry> feedbackHistory;
    private final Instant createdAt;
    private final Instant updatedAt;

    private AnomalyRecord(Builder b) {
        this.id = b.id;
        this.roomId = Objects.requireNonNull(b.roomId, "roomId must not be null");
        this.farmId = b.farmId;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.value = b.value;
        this.combinedScore = b.combinedScore;
        this.anomalyType = Objects.requireNonNull(b.anomalyType, "anomalyType must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.description = b.description;
        this.factors = List.copyOf(b.factors);
        this.confirmationState = Objects.requireNonNull(b.confirmationState, "confirmationState must not be null");
        this.feedbackNotes = b.feedbackNotes;
        this.feedbackHistory = List.copyOf(b.feedbackHistory);
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt != null ? b.updatedAt : b.createdAt;
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * @return a copy carrying the sink-assigned id
     */
    public AnomalyRecord withId(long newId) {
        return toBuilder().id(newId).build();
    }

    /**
     * Label this record as a real anomaly or a false positive.
     *
     * <p>
     * Any state may be relabelled. Applying the same label twice yields the
     * same state with refreshed notes and timestamp; every call appends a
     * history entry.
     * </p>
     *
     * @param isReal whether the operator confirmed the anomaly
     * @param notes  free-text notes, may be {@code null}
     * @param at     time of the feedback
     * @return updated copy
     */
    public AnomalyRecord applyFeedback(boolean isReal, String notes, Instant at) {
        Objects.requireNonNull(at, "feedback time must not be null");
        ConfirmationState next = ConfirmationState.fromFeedback(isReal);
        List<FeedbackEntry> history = new ArrayList<>(feedbackHistory);
        history.add(new FeedbackEntry(confirmationState, next, isReal, notes, at));
        return toBuilder()
                .confirmationState(next)
                .feedbackNotes(notes)
                .feedbackHistory(history)
                .updatedAt(at)
                .build();
    }

    public boolean isFeedbackProvided() {
        return !feedbackHistory.isEmpty();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.roomId = roomId;
        b.farmId = farmId;
        b.timestamp = timestamp;
        b.metricName = metricName;
        b.value = value;
        b.combinedScore = combinedScore;
        b.anomalyType = anomalyType;
        b.severity = severity;
        b.description = description;
        b.factors = new ArrayList<>(factors);
        b.confirmationState = confirmationState;
        b.feedbackNotes = feedbackNotes;
        b.feedbackHistory = new ArrayList<>(feedbackHistory);
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        return b;
    }

    /**
     * Fluent builder for {@link AnomalyRecord}. New records start in
     * {@link ConfirmationState#DETECTED}.
     */
    public static class Builder {
        private Long id;
        private String roomId;
        private String farmId;
        private Instant timestamp;
        private String metricName;
        private double value;
        private double combinedScore;
        private AnomalyType anomalyType;
        private Severity severity;
        private String description;
        private List<ContributingFactor> factors = new ArrayList<>();
        private ConfirmationState confirmationState = ConfirmationState.DETECTED;
        private String feedbackNotes;
        private List<FeedbackEntry> feedbackHistory = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder roomId(String roomId) {
            this.roomId = roomId;
            return this;
        }

        public Builder farmId(String farmId) {
            this.farmId = farmId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder combinedScore(double combinedScore) {
            this.combinedScore = combinedScore;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder factors(List<ContributingFactor> factors) {
            this.factors = new ArrayList<>(factors);
            return this;
        }

        public Builder confirmationState(ConfirmationState confirmationState) {
            this.confirmationState = confirmationState;
            return this;
        }

        public Builder feedbackNotes(String feedbackNotes) {
            this.feedbackNotes = feedbackNotes;
            return this;
        }

        public Builder feedbackHistory(List<FeedbackEntry> feedbackHistory) {
            this.feedbackHistory = new ArrayList<>(feedbackHistory);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    // ------- Getters -------

    public Long getId() {
        return id;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getFarmId() {
        return farmId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public double getCombinedScore() {
        return combinedScore;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public List<ContributingFactor> getFactors() {
        return factors;
    }

    public ConfirmationState getConfirmationState() {
        return confirmationState;
    }

    public String getFeedbackNotes() {
        return feedbackNotes;
    }

    public List<FeedbackEntry> getFeedbackHistory() {
        return feedbackHistory;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "id=" + id +
                ", room='" + roomId + '\'' +
                ", metric='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", score=" + combinedScore +
                ", type=" + anomalyType +
                ", severity=" + severity +
                ", state=" + confirmationState +
                '}';
    }
}
