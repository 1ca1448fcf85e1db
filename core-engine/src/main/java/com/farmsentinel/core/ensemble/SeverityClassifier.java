package com.farmsentinel.core.ensemble;

import com.farmsentinel.core.config.SeverityThresholds;
import com.farmsentinel.core.model.Severity;

import java.util.Objects;

/**
 * Maps a combined score to a severity tier.
 *
 * <p>
 * Tiers are half-open with inclusive lower bounds: with the default thresholds
 * 0.5 is medium, 0.7999 is medium and 0.8 is high.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityClassifier {

    private final double mediumThreshold;
    private final double highThreshold;

    public SeverityClassifier(SeverityThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        if (!(thresholds.getMedium() > 0.0 && thresholds.getMedium() < thresholds.getHigh()
                && thresholds.getHigh() <= 1.0)) {
            throw new IllegalArgumentException("Invalid severity thresholds: " + thresholds);
        }
        this.mediumThreshold = thresholds.getMedium();
        this.highThreshold = thresholds.getHigh();
    }

    public static SeverityClassifier defaults() {
        return new SeverityClassifier(new SeverityThresholds());
    }

    public Severity classify(double combinedScore) {
        if (combinedScore >= highThreshold) {
            return Severity.HIGH;
        }
        if (combinedScore >= mediumThreshold) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }

    public double getHighThreshold() {
        return highThreshold;
    }
}
