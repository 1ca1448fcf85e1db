package com.farmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of detection strategies combined by the ensemble.
 *
 * <p>
 * Declaration order is the order in which contributions are reported.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    GLOBAL_OUTLIER("global_outlier", AnomalyType.MULTIVARIATE),
    LOCAL_DENSITY("local_density", AnomalyType.MULTIVARIATE),
    STATISTICAL_THRESHOLD("statistical_threshold", AnomalyType.UNIVARIATE),
    TEMPORAL_PATTERN("temporal_pattern", AnomalyType.TEMPORAL);

    private final String label;
    private final AnomalyType naturalType;

    DetectorKind(String label, AnomalyType naturalType) {
        this.label = label;
        this.naturalType = naturalType;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @return the anomaly type reported when this detector dominates a score
     */
    public AnomalyType getNaturalType() {
        return naturalType;
    }
}
