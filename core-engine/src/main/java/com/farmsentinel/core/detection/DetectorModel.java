package com.farmsentinel.core.detection;

import com.farmsentinel.core.model.DetectorKind;

import java.io.Serializable;

/**
 * Fitted state produced by one {@link Detector}.
 *
 * <p>
 * Models are immutable once built and are shared read-only by concurrent
 * scoring calls. A re-fit produces a new model rather than mutating this one.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface DetectorModel extends Serializable
        permits GlobalOutlierModel, LocalDensityModel, StatisticalThresholdModel, TemporalPatternModel {

    DetectorKind kind();

    /**
     * @return metric the model was fitted on
     */
    String getMetricName();

    /**
     * @return number of points in the fitted window
     */
    int getTrainingSize();
}
