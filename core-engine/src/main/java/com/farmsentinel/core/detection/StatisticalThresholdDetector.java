package com.farmsentinel.core.detection;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.error.InsufficientDataException;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Univariate detector combining a z-score rule with Tukey fences.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>z-score: {@code |z| / deviationThreshold}, reaching 1 when
 * {@code |z|} reaches the threshold</li>
 * <li>Tukey: 0 inside {@code [Q1, Q3]}, otherwise the distance beyond the
 * nearer quartile over {@code m * IQR}, reaching 1 at the fence. Disabled when
 * the IQR is 0.</li>
 * </ul>
 * <p>
 * The normalized score is the larger of the two, clipped to 1. The quartiles
 * are not moved by a single extreme reading, so the Tukey rule still fires when
 * an outlier inflates the standard deviation.
 * </p>
 *
 * <h3>Degenerate windows</h3>
 * <p>
 * Fitting fails with {@link InsufficientDataException} when the window holds
 * fewer than 2 distinct values.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticalThresholdDetector implements Detector<StatisticalThresholdModel> {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalThresholdDetector.class);

    static final int MIN_DISTINCT_VALUES = 2;

    private final double deviationThreshold;
    private final double iqrMultiplier;

    public StatisticalThresholdDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.deviationThreshold = settings.getDeviationThreshold();
        this.iqrMultiplier = settings.getIqrMultiplier();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL_THRESHOLD;
    }

    @Override
    public Class<StatisticalThresholdModel> modelType() {
        return StatisticalThresholdModel.class;
    }

    @Override
    public StatisticalThresholdModel fit(SignalWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        long distinct = window.distinctValueCount();
        if (distinct < MIN_DISTINCT_VALUES) {
            throw new InsufficientDataException(kind(),
                    "needs at least " + MIN_DISTINCT_VALUES + " distinct values, window has " + distinct);
        }

        double[] values = window.values();
        double mean = SeriesMath.mean(values);
        double std = SeriesMath.std(values, mean);
        double[] sorted = SeriesMath.sortedCopy(values);
        double q1 = SeriesMath.percentile(sorted, 25);
        double q3 = SeriesMath.percentile(sorted, 75);

        LOG.debug("Fitted statistics for {}: mean={} std={} q1={} q3={}", window.getMetricName(), mean, std, q1, q3);
        return new StatisticalThresholdModel(window.getMetricName(), values.length, window.getDays(),
                mean, std, q1, q3, deviationThreshold, iqrMultiplier);
    }

    @Override
    public List<DetectionResult> score(StatisticalThresholdModel model, List<SignalPoint> points) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(points, "points must not be null");

        double iqr = model.getIqr();
        List<DetectionResult> results = new ArrayList<>(points.size());
        for (SignalPoint p : points) {
            double v = p.getValue();
            double z = (v - model.getMean()) / model.getStd();
            double zPart = Math.abs(z) / model.getDeviationThreshold();

            double tukeyPart = 0.0;
            if (iqr > 0) {
                if (v > model.getQ3()) {
                    tukeyPart = (v - model.getQ3()) / (model.getIqrMultiplier() * iqr);
                } else if (v < model.getQ1()) {
                    tukeyPart = (model.getQ1() - v) / (model.getIqrMultiplier() * iqr);
                }
            }

            double raw = Math.max(zPart, tukeyPart);
            Map<String, Double> diagnostics = new LinkedHashMap<>();
            diagnostics.put("zScore", z);
            diagnostics.put("mean", model.getMean());
            diagnostics.put("std", model.getStd());
            diagnostics.put("q1", model.getQ1());
            diagnostics.put("q3", model.getQ3());
            diagnostics.put("lowerFence", model.getLowerFence());
            diagnostics.put("upperFence", model.getUpperFence());
            diagnostics.put("windowDays", (double) model.getWindowDays());
            diagnostics.put("zRuleFired", zPart >= 1.0 ? 1.0 : 0.0);
            diagnostics.put("iqrRuleFired", tukeyPart >= 1.0 ? 1.0 : 0.0);

            results.add(new DetectionResult(model.getMetricName(), p.getTimestamp(), v,
                    raw, SeriesMath.clip01(raw), kind(), diagnostics));
        }
        return results;
    }
}
