package com.farmsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Non-negative per-detector weights summing to 1.0.
 *
 * <p>
 * Instances are immutable. {@link #normalized(Map)} accepts any non-negative
 * map with a positive total and rescales it; {@link #of(Map)} requires the
 * weights to already sum to 1.0. A kind with weight 0 (or absent) does not
 * take part in the ensemble.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleWeights implements Serializable {

    private static final long serialVersionUID = 1L;

    static final double SUM_TOLERANCE = 1e-6;

    /** Global-outlier 0.3, local-density 0.3, statistical 0.2, temporal 0.2. */
    public static final EnsembleWeights DEFAULT = of(defaultMap());

    private final EnumMap<DetectorKind, Double> weights;

    private EnsembleWeights(EnumMap<DetectorKind, Double> weights) {
        this.weights = weights;
    }

    /**
     * @param weights weights that already sum to 1.0
     * @throws IllegalArgumentException if a weight is negative or not finite, or
     *                                  the total differs from 1.0
     */
    public static EnsembleWeights of(Map<DetectorKind, Double> weights) {
        EnumMap<DetectorKind, Double> copy = checked(weights);
        double total = total(copy);
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Ensemble weights must sum to 1.0, got: " + total);
        }
        return new EnsembleWeights(copy);
    }

    /**
     * @param weights non-negative weights with a positive total
     * @return the weights rescaled to sum to 1.0
     * @throws IllegalArgumentException if a weight is negative or the total is 0
     */
    public static EnsembleWeights normalized(Map<DetectorKind, Double> weights) {
        EnumMap<DetectorKind, Double> copy = checked(weights);
        double total = total(copy);
        if (total <= 0.0) {
            throw new IllegalArgumentException("Ensemble weights must have a positive total: " + weights);
        }
        copy.replaceAll((kind, w) -> w / total);
        return new EnsembleWeights(copy);
    }

    /**
     * @return the weight of {@code kind}, 0 when absent
     */
    public double weight(DetectorKind kind) {
        return weights.getOrDefault(kind, 0.0);
    }

    public boolean participates(DetectorKind kind) {
        return weight(kind) > 0.0;
    }

    /**
     * @return these weights with {@code kind} removed and the rest renormalized
     * @throws IllegalArgumentException if nothing would remain
     */
    public EnsembleWeights without(DetectorKind kind) {
        EnumMap<DetectorKind, Double> copy = new EnumMap<>(weights);
        copy.remove(kind);
        return normalized(copy);
    }

    public Map<DetectorKind, Double> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EnumMap<DetectorKind, Double> checked(Map<DetectorKind, Double> weights) {
        Objects.requireNonNull(weights, "weights must not be null");
        EnumMap<DetectorKind, Double> copy = new EnumMap<>(DetectorKind.class);
        weights.forEach((kind, w) -> {
            Objects.requireNonNull(kind, "detector kind must not be null");
            if (w == null || !Double.isFinite(w) || w < 0.0) {
                throw new IllegalArgumentException("Weight for " + kind + " must be a non-negative number, got: " + w);
            }
            copy.put(kind, w);
        });
        return copy;
    }

    private static double total(Map<DetectorKind, Double> weights) {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private static Map<DetectorKind, Double> defaultMap() {
        EnumMap<DetectorKind, Double> map = new EnumMap<>(DetectorKind.class);
        map.put(DetectorKind.GLOBAL_OUTLIER, 0.3);
        map.put(DetectorKind.LOCAL_DENSITY, 0.3);
        map.put(DetectorKind.STATISTICAL_THRESHOLD, 0.2);
        map.put(DetectorKind.TEMPORAL_PATTERN, 0.2);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnsembleWeights that))
            return false;
        return weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "EnsembleWeights" + weights;
    }
}
