package com.farmsentinel.core.detection;

import com.farmsentinel.core.model.DetectorKind;
import smile.anomaly.IsolationForest;

/**
 * Isolation forest plus the range of raw scores it assigned to its own
 * training window.
 *
 * @since 1.0.0
 */
public final class GlobalOutlierModel implements DetectorModel {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final IsolationForest forest;
    private final int subsampleSize;
    private final double trainingMinScore;
    private final double trainingMaxScore;
    private final double contaminationCutoff;
    private final int trainingSize;

    GlobalOutlierModel(String metricName, IsolationForest forest, int subsampleSize, double trainingMinScore,
            double trainingMaxScore, double contaminationCutoff, int trainingSize) {
        this.metricName = metricName;
        this.forest = forest;
        this.subsampleSize = subsampleSize;
        this.trainingMinScore = trainingMinScore;
        this.trainingMaxScore = trainingMaxScore;
        this.contaminationCutoff = contaminationCutoff;
        this.trainingSize = trainingSize;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.GLOBAL_OUTLIER;
    }

    @Override
    public String getMetricName() {
        return metricName;
    }

    @Override
    public int getTrainingSize() {
        return trainingSize;
    }

    IsolationForest getForest() {
        return forest;
    }

    /**
     * @return number of window points each tree was grown on
     */
    public int getSubsampleSize() {
        return subsampleSize;
    }

    public double getTrainingMinScore() {
        return trainingMinScore;
    }

    public double getTrainingMaxScore() {
        return trainingMaxScore;
    }

    /**
     * @return raw score above which the expected contamination share of the
     *         training window lies
     */
    public double getContaminationCutoff() {
        return contaminationCutoff;
    }
}
