package com.farmsentinel.core.detection;

import com.farmsentinel.core.model.DetectorKind;

/**
 * Location and spread of one metric over the fitted window.
 *
 * @since 1.0.0
 */
public final class StatisticalThresholdModel implements DetectorModel {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final int trainingSize;
    private final int windowDays;
    private final double mean;
    private final double std;
    private final double q1;
    private final double q3;
    private final double deviationThreshold;
    private final double iqrMultiplier;

    StatisticalThresholdModel(String metricName, int trainingSize, int windowDays, double mean, double std,
            double q1, double q3, double deviationThreshold, double iqrMultiplier) {
        this.metricName = metricName;
        this.trainingSize = trainingSize;
        this.windowDays = windowDays;
        this.mean = mean;
        this.std = std;
        this.q1 = q1;
        this.q3 = q3;
        this.deviationThreshold = deviationThreshold;
        this.iqrMultiplier = iqrMultiplier;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL_THRESHOLD;
    }

    @Override
    public String getMetricName() {
        return metricName;
    }

    @Override
    public int getTrainingSize() {
        return trainingSize;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getLowerFence() {
        return q1 - iqrMultiplier * getIqr();
    }

    public double getUpperFence() {
        return q3 + iqrMultiplier * getIqr();
    }

    public double getDeviationThreshold() {
        return deviationThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }
}
