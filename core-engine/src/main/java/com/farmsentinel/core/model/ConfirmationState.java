package com.farmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of an {@link AnomalyRecord}.
 *
 * <p>
 * {@code DETECTED} is the initial state. Feedback moves a record to
 * {@code CONFIRMED} or {@code DISMISSED}; a resolved record may be relabelled
 * any number of times.
 * </p>
 *
 * @since 1.0.0
 */
public enum ConfirmationState {

    DETECTED("detected"),
    CONFIRMED("confirmed"),
    DISMISSED("dismissed");

    private final String label;

    ConfirmationState(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static ConfirmationState fromFeedback(boolean isReal) {
        return isReal ? CONFIRMED : DISMISSED;
    }
}
