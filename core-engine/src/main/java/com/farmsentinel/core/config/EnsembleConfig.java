package com.farmsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for {@code ensemble.yml}.
 *
 * <pre>
 * detectors:
 *   neighbors: 20
 *   deviationThreshold: 3.0
 * weights:
 *   globalOutlier: 0.3
 *   localDensity: 0.3
 *   statistical: 0.2
 *   temporal: 0.2
 * severity:
 *   medium: 0.5
 *   high: 0.8
 * sensitivity: 0.8
 * cacheTtlSeconds: 3600
 * defaultDays: 7
 * maxDays: 90
 * resultCacheSize: 1000
 * resultCacheTtlSeconds: 600
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectorSettings detectors = new DetectorSettings();
    private WeightSettings weights = new WeightSettings();
    private SeverityThresholds severity = new SeverityThresholds();

    /** Default score a point must exceed to become an anomaly record. */
    private double sensitivity = 0.8;

    /** Lifetime of a fitted detector set in the registry. */
    private long cacheTtlSeconds = 3600;

    private int defaultDays = 7;
    private int maxDays = 90;

    /** Detection result cache bounds. */
    private long resultCacheSize = 1000;
    private long resultCacheTtlSeconds = 600;

    /**
     * Validate every section, collecting all violations.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (detectors == null) {
            errors.add("'detectors' section must not be null");
        } else {
            detectors.collectErrors(errors);
        }
        if (weights == null) {
            errors.add("'weights' section must not be null");
        } else {
            weights.collectErrors(errors);
        }
        if (severity == null) {
            errors.add("'severity' section must not be null");
        } else {
            severity.collectErrors(errors);
        }
        if (!(sensitivity >= 0.0 && sensitivity <= 1.0)) {
            errors.add("sensitivity must be in [0, 1], got: " + sensitivity);
        }
        if (cacheTtlSeconds <= 0) {
            errors.add("cacheTtlSeconds must be > 0, got: " + cacheTtlSeconds);
        }
        if (maxDays < 1) {
            errors.add("maxDays must be >= 1, got: " + maxDays);
        }
        if (defaultDays < 1 || defaultDays > maxDays) {
            errors.add("defaultDays must be in [1, maxDays], got: " + defaultDays);
        }
        if (resultCacheSize < 0) {
            errors.add("resultCacheSize must be >= 0, got: " + resultCacheSize);
        }
        if (resultCacheTtlSeconds <= 0) {
            errors.add("resultCacheTtlSeconds must be > 0, got: " + resultCacheTtlSeconds);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Ensemble configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    public Duration cacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    public Duration resultCacheTtl() {
        return Duration.ofSeconds(resultCacheTtlSeconds);
    }

    // ------- Getters / Setters -------

    public DetectorSettings getDetectors() {
        return detectors;
    }

    public void setDetectors(DetectorSettings detectors) {
        this.detectors = detectors;
    }

    public WeightSettings getWeights() {
        return weights;
    }

    public void setWeights(WeightSettings weights) {
        this.weights = weights;
    }

    public SeverityThresholds getSeverity() {
        return severity;
    }

    public void setSeverity(SeverityThresholds severity) {
        this.severity = severity;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public int getDefaultDays() {
        return defaultDays;
    }

    public void setDefaultDays(int defaultDays) {
        this.defaultDays = defaultDays;
    }

    public int getMaxDays() {
        return maxDays;
    }

    public void setMaxDays(int maxDays) {
        this.maxDays = maxDays;
    }

    public long getResultCacheSize() {
        return resultCacheSize;
    }

    public void setResultCacheSize(long resultCacheSize) {
        this.resultCacheSize = resultCacheSize;
    }

    public long getResultCacheTtlSeconds() {
        return resultCacheTtlSeconds;
    }

    public void setResultCacheTtlSeconds(long resultCacheTtlSeconds) {
        this.resultCacheTtlSeconds = resultCacheTtlSeconds;
    }

    @Override
    public String toString() {
        return "EnsembleConfig{" +
                "detectors=" + detectors +
                ", weights=" + weights +
                ", severity=" + severity +
                ", sensitivity=" + sensitivity +
                ", cacheTtlSeconds=" + cacheTtlSeconds +
                '}';
    }
}
