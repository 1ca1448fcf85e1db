package com.farmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete severity tier derived from a combined anomaly score.
 *
 * <p>
 * Constants are declared in ascending order so {@link #compareTo} ranks them.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse a tier label case-insensitively.
     *
     * @param label {@code low}, {@code medium} or {@code high}
     * @return the matching tier
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Severity fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (Severity severity : values()) {
                if (severity.label.equals(normalized)) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + label + "'. Supported: low, medium, high");
    }
}
