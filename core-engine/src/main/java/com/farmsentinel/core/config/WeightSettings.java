package com.farmsentinel.core.config;

import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.EnsembleWeights;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * YAML binding for the default ensemble weights.
 *
 * <p>
 * Values need not sum to 1.0; {@link #toEnsembleWeights()} rescales them.
 * Setting a weight to 0 removes that detector from the ensemble.
 * </p>
 *
 * @since 1.0.0
 */
public class WeightSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double globalOutlier = 0.3;
    private double localDensity = 0.3;
    private double statistical = 0.2;
    private double temporal = 0.2;

    void collectErrors(List<String> errors) {
        Map<DetectorKind, Double> map = asMap();
        map.forEach((kind, w) -> {
            if (!Double.isFinite(w) || w < 0) {
                errors.add("weights." + kind.getLabel() + " must be >= 0, got: " + w);
            }
        });
        if (map.values().stream().mapToDouble(Double::doubleValue).sum() <= 0) {
            errors.add("weights must have a positive total");
        }
    }

    public EnsembleWeights toEnsembleWeights() {
        return EnsembleWeights.normalized(asMap());
    }

    private Map<DetectorKind, Double> asMap() {
        Map<DetectorKind, Double> map = new EnumMap<>(DetectorKind.class);
        map.put(DetectorKind.GLOBAL_OUTLIER, globalOutlier);
        map.put(DetectorKind.LOCAL_DENSITY, localDensity);
        map.put(DetectorKind.STATISTICAL_THRESHOLD, statistical);
        map.put(DetectorKind.TEMPORAL_PATTERN, temporal);
        return map;
    }

    // ------- Getters / Setters -------

    public double getGlobalOutlier() {
        return globalOutlier;
    }

    public void setGlobalOutlier(double globalOutlier) {
        this.globalOutlier = globalOutlier;
    }

    public double getLocalDensity() {
        return localDensity;
    }

    public void setLocalDensity(double localDensity) {
        this.localDensity = localDensity;
    }

    public double getStatistical() {
        return statistical;
    }

    public void setStatistical(double statistical) {
        this.statistical = statistical;
    }

    public double getTemporal() {
        return temporal;
    }

    public void setTemporal(double temporal) {
        this.temporal = temporal;
    }

    @Override
    public String toString() {
        return "WeightSettings" + asMap();
    }
}
