package com.farmsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One ranked line of an anomaly explanation.
 *
 * @since 1.0.0
 */
public final class ContributingFactor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DetectorKind detector;
    private final double contribution;
    private final String reason;

    public ContributingFactor(DetectorKind detector, double contribution, String reason) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.contribution = contribution;
    }

    public DetectorKind getDetector() {
        return detector;
    }

    /**
     * @return renormalized weight multiplied by the detector's normalized score
     */
    public double getContribution() {
        return contribution;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return detector + "=" + contribution + " (" + reason + ")";
    }
}
