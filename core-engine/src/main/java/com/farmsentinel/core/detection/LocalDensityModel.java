package com.farmsentinel.core.detection;

import com.farmsentinel.core.model.DetectorKind;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * The training window retained verbatim, with each member's k-distance and
 * local reachability density precomputed.
 *
 * @since 1.0.0
 */
public final class LocalDensityModel implements DetectorModel {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final int neighbors;
    private final double[][] features;
    private final Map<Instant, Integer> indexByTimestamp;
    private final double[] kDistance;
    private final double[] reachabilityDensity;

    LocalDensityModel(String metricName, int neighbors, double[][] features, Map<Instant, Integer> indexByTimestamp,
            double[] kDistance, double[] reachabilityDensity) {
        this.metricName = metricName;
        this.neighbors = neighbors;
        this.features = features;
        this.indexByTimestamp = Collections.unmodifiableMap(indexByTimestamp);
        this.kDistance = kDistance;
        this.reachabilityDensity = reachabilityDensity;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOCAL_DENSITY;
    }

    @Override
    public String getMetricName() {
        return metricName;
    }

    @Override
    public int getTrainingSize() {
        return features.length;
    }

    public int getNeighbors() {
        return neighbors;
    }

    double[] row(int i) {
        return features[i];
    }

    /**
     * @return index of the training member observed at {@code timestamp}, or -1
     */
    int indexOf(Instant timestamp) {
        Integer i = indexByTimestamp.get(timestamp);
        return i != null ? i : -1;
    }

    double kDistance(int i) {
        return kDistance[i];
    }

    double reachabilityDensity(int i) {
        return reachabilityDensity[i];
    }
}
