package com.farmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a flagged anomaly as reported to operators.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** A single metric far outside its own distribution. */
    UNIVARIATE("univariate"),

    /** Unusual with respect to the joint shape of the window. */
    MULTIVARIATE("multivariate"),

    /** A break in the ordering or rhythm of the series. */
    TEMPORAL("temporal");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
