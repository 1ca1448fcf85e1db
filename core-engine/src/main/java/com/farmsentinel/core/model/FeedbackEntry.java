package com.farmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Audit line for one feedback submission on an anomaly.
 *
 * @since 1.0.0
 */
public final class FeedbackEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ConfirmationState previousState;
    private final ConfirmationState state;
    private final boolean real;
    private final String notes;
    private final Instant recordedAt;

    public FeedbackEntry(ConfirmationState previousState, ConfirmationState state, boolean real, String notes,
            Instant recordedAt) {
        this.previousState = Objects.requireNonNull(previousState, "previousState must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.recordedAt = Objects.requireNonNull(recordedAt, "recordedAt must not be null");
        this.real = real;
        this.notes = notes;
    }

    public ConfirmationState getPreviousState() {
        return previousState;
    }

    public ConfirmationState getState() {
        return state;
    }

    public boolean isReal() {
        return real;
    }

    public String getNotes() {
        return notes;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return "FeedbackEntry{" + previousState + "->" + state + " at " + recordedAt + '}';
    }
}
