package com.farmsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Hyperparameters for the four detectors.
 *
 * <p>
 * Bound from the {@code detectors} section of {@code ensemble.yml}. Every
 * field has a working default, so an empty section is valid.
 * </p>
 *
 * <pre>
 * detectors:
 *   trees: 100
 *   sampleSize: 256
 *   contamination: 0.1
 *   seed: 42
 *   neighbors: 20
 *   deviationThreshold: 3.0
 *   iqrMultiplier: 1.5
 *   trendBreakMultiplier: 3.0
 *   velocityThreshold: 2.0
 *   seasonalThreshold: 2.0
 *   rollingWindow: 7
 *   seasonLength: 0
 *   gapTolerance: 1.5
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    static final double MIN_CONTAMINATION = 0.01;
    static final double MAX_CONTAMINATION = 0.5;

    // --- Global outlier ---
    /** Number of isolation trees. */
    private int trees = 100;

    /** Points drawn (without replacement) to grow each tree. */
    private int sampleSize = 256;

    /** Expected share of anomalies, clamped to [0.01, 0.5]. */
    private double contamination = 0.1;

    /** Random seed for tree construction. */
    private long seed = 42L;

    // --- Local density ---
    /** k for the k-nearest-neighbour density estimate. */
    private int neighbors = 20;

    // --- Statistical threshold ---
    /** |z| at which the z-score rule fires. */
    private double deviationThreshold = 3.0;
    private double iqrMultiplier = 1.5;

    // --- Temporal pattern ---
    /** Second-difference multiple of its rolling std that marks a trend break. */
    private double trendBreakMultiplier = 3.0;

    /** z-score of the first difference that marks a velocity change. */
    private double velocityThreshold = 2.0;

    /** Same-phase deviation, in series standard deviations. */
    private double seasonalThreshold = 2.0;

    /** Number of prior second differences in the rolling std. */
    private int rollingWindow = 7;

    /** Points per seasonal cycle; 0 disables the seasonal sub-score. */
    private int seasonLength = 0;

    /** A gap larger than this many cadences breaks seasonal continuity. */
    private double gapTolerance = 1.5;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every invalid field
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detector settings validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    void collectErrors(List<String> errors) {
        if (trees < 1) {
            errors.add("detectors.trees must be >= 1, got: " + trees);
        }
        if (sampleSize < 2) {
            errors.add("detectors.sampleSize must be >= 2, got: " + sampleSize);
        }
        if (!(contamination > 0.0 && contamination < 1.0)) {
            errors.add("detectors.contamination must be in (0, 1), got: " + contamination);
        }
        if (neighbors < 5) {
            errors.add("detectors.neighbors must be >= 5, got: " + neighbors);
        }
        if (deviationThreshold <= 0) {
            errors.add("detectors.deviationThreshold must be > 0, got: " + deviationThreshold);
        }
        if (iqrMultiplier <= 0) {
            errors.add("detectors.iqrMultiplier must be > 0, got: " + iqrMultiplier);
        }
        if (trendBreakMultiplier <= 0) {
            errors.add("detectors.trendBreakMultiplier must be > 0, got: " + trendBreakMultiplier);
        }
        if (velocityThreshold <= 0) {
            errors.add("detectors.velocityThreshold must be > 0, got: " + velocityThreshold);
        }
        if (seasonalThreshold <= 0) {
            errors.add("detectors.seasonalThreshold must be > 0, got: " + seasonalThreshold);
        }
        if (rollingWindow < 2) {
            errors.add("detectors.rollingWindow must be >= 2, got: " + rollingWindow);
        }
        if (seasonLength < 0 || seasonLength == 1) {
            errors.add("detectors.seasonLength must be 0 (disabled) or >= 2, got: " + seasonLength);
        }
        if (gapTolerance < 1.0) {
            errors.add("detectors.gapTolerance must be >= 1.0, got: " + gapTolerance);
        }
    }

    /**
     * @return contamination clamped to [0.01, 0.5]
     */
    public double effectiveContamination() {
        return Math.max(MIN_CONTAMINATION, Math.min(MAX_CONTAMINATION, contamination));
    }

    // ------- Getters / Setters -------

    public int getTrees() {
        return trees;
    }

    public void setTrees(int trees) {
        this.trees = trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getNeighbors() {
        return neighbors;
    }

    public void setNeighbors(int neighbors) {
        this.neighbors = neighbors;
    }

    public double getDeviationThreshold() {
        return deviationThreshold;
    }

    public void setDeviationThreshold(double deviationThreshold) {
        this.deviationThreshold = deviationThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getTrendBreakMultiplier() {
        return trendBreakMultiplier;
    }

    public void setTrendBreakMultiplier(double trendBreakMultiplier) {
        this.trendBreakMultiplier = trendBreakMultiplier;
    }

    public double getVelocityThreshold() {
        return velocityThreshold;
    }

    public void setVelocityThreshold(double velocityThreshold) {
        this.velocityThreshold = velocityThreshold;
    }

    public double getSeasonalThreshold() {
        return seasonalThreshold;
    }

    public void setSeasonalThreshold(double seasonalThreshold) {
        this.seasonalThreshold = seasonalThreshold;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    public void setRollingWindow(int rollingWindow) {
        this.rollingWindow = rollingWindow;
    }

    public int getSeasonLength() {
        return seasonLength;
    }

    public void setSeasonLength(int seasonLength) {
        this.seasonLength = seasonLength;
    }

    public double getGapTolerance() {
        return gapTolerance;
    }

    public void setGapTolerance(double gapTolerance) {
        this.gapTolerance = gapTolerance;
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "trees=" + trees +
                ", sampleSize=" + sampleSize +
                ", contamination=" + contamination +
                ", seed=" + seed +
                ", neighbors=" + neighbors +
                ", deviationThreshold=" + deviationThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", seasonLength=" + seasonLength +
                '}';
    }
}
