package com.farmsentinel.core.detection;

import com.farmsentinel.core.error.InsufficientDataException;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;

import java.util.List;

/**
 * Contract for the four detection strategies.
 *
 * <p>
 * Detectors are stateless and thread-safe: all fitted state lives in the
 * returned {@link DetectorModel}. Every normalized score lies in
 * {@code [0, 1]} with 1 the most anomalous, and a window of constant values
 * never produces a score above 0.
 * </p>
 *
 * @param <M> fitted model type
 * @since 1.0.0
 */
public sealed interface Detector<M extends DetectorModel>
        permits GlobalOutlierDetector, LocalDensityDetector, StatisticalThresholdDetector, TemporalPatternDetector {

    DetectorKind kind();

    Class<M> modelType();

    /**
     * Fit a baseline over the window.
     *
     * @throws InsufficientDataException if the window is too short or degenerate
     */
    M fit(SignalWindow window);

    /**
     * Score points against a fitted model.
     *
     * @return one result per point, in the order given
     */
    List<DetectionResult> score(M model, List<SignalPoint> points);

    /**
     * Score with a model held under its interface type, as the registry
     * stores it.
     *
     * @throws IllegalArgumentException if the model belongs to another detector
     */
    default List<DetectionResult> scoreFitted(DetectorModel model, List<SignalPoint> points) {
        if (!modelType().isInstance(model)) {
            throw new IllegalArgumentException(
                    kind() + " cannot score with a " + model.getClass().getSimpleName());
        }
        return score(modelType().cast(model), points);
    }
}
