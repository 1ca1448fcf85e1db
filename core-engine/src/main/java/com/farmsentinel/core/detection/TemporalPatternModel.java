package com.farmsentinel.core.detection;

import com.farmsentinel.core.model.DetectorKind;

import java.time.Duration;
import java.time.Instant;

/**
 * The ordered training series plus the temporal thresholds it is scored with.
 *
 * @since 1.0.0
 */
public final class TemporalPatternModel implements DetectorModel {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final Instant[] timestamps;
    private final double[] values;
    private final Duration cadence;

    TemporalPatternModel(String metricName, Instant[] timestamps, double[] values, Duration cadence) {
        this.metricName = metricName;
        this.timestamps = timestamps;
        this.values = values;
        this.cadence = cadence;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.TEMPORAL_PATTERN;
    }

    @Override
    public String getMetricName() {
        return metricName;
    }

    @Override
    public int getTrainingSize() {
        return values.length;
    }

    public Duration getCadence() {
        return cadence;
    }

    Instant timestamp(int i) {
        return timestamps[i];
    }

    double value(int i) {
        return values[i];
    }
}
