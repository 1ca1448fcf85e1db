package com.farmsentinel.core.detection;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.error.InsufficientDataException;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sequence detector scoring how a point moves relative to its neighbours in
 * time.
 *
 * <p>
 * Scored points are merged into the fitted series by timestamp; a point that
 * shares a timestamp with a window member replaces it. Three sub-scores are
 * computed, each as {@code clip((z - threshold) / threshold, 0, 1)}, and the
 * point's normalized score is their maximum:
 * </p>
 * <ul>
 * <li><b>velocity</b>: the first difference as a z-score against the mean and
 * standard deviation of all first differences</li>
 * <li><b>trend break</b>: the magnitude of the second difference relative to
 * the standard deviation of the preceding {@code rollingWindow} second
 * differences</li>
 * <li><b>seasonal</b>: when a season length is configured, the distance from
 * the average of earlier same-phase points in the same gap-free segment, in
 * series standard deviations</li>
 * </ul>
 *
 * <p>
 * Deviations within a relative tolerance of 1e-9 count as zero, so a steady
 * linear trend scores 0 everywhere. Gaps in the series only break seasonal
 * continuity.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemporalPatternDetector implements Detector<TemporalPatternModel> {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalPatternDetector.class);

    static final int MIN_WINDOW_SIZE = 3;

    private final double velocityThreshold;
    private final double trendBreakMultiplier;
    private final double seasonalThreshold;
    private final int rollingWindow;
    private final int seasonLength;
    private final double gapTolerance;

    public TemporalPatternDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.velocityThreshold = settings.getVelocityThreshold();
        this.trendBreakMultiplier = settings.getTrendBreakMultiplier();
        this.seasonalThreshold = settings.getSeasonalThreshold();
        this.rollingWindow = settings.getRollingWindow();
        this.seasonLength = settings.getSeasonLength();
        this.gapTolerance = settings.getGapTolerance();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.TEMPORAL_PATTERN;
    }

    @Override
    public Class<TemporalPatternModel> modelType() {
        return TemporalPatternModel.class;
    }

    @Override
    public TemporalPatternModel fit(SignalWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.size() < MIN_WINDOW_SIZE) {
            throw new InsufficientDataException(kind(),
                    "needs at least " + MIN_WINDOW_SIZE + " points, window has " + window.size());
        }
        if (seasonLength > 0 && window.size() < 2 * seasonLength) {
            LOG.debug("Window for {} has {} points, fewer than two seasons of {}; seasonal score disabled",
                    window.getMetricName(), window.size(), seasonLength);
        }

        List<SignalPoint> points = window.getPoints();
        Instant[] timestamps = new Instant[points.size()];
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = points.get(i).getTimestamp();
            values[i] = points.get(i).getValue();
        }
        return new TemporalPatternModel(window.getMetricName(), timestamps, values, window.getCadence());
    }

    @Override
    public List<DetectionResult> score(TemporalPatternModel model, List<SignalPoint> points) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(points, "points must not be null");

        TreeMap<Instant, Double> merged = new TreeMap<>();
        for (int i = 0; i < model.getTrainingSize(); i++) {
            merged.put(model.timestamp(i), model.value(i));
        }
        for (SignalPoint p : points) {
            merged.put(p.getTimestamp(), p.getValue());
        }

        int n = merged.size();
        Instant[] ts = merged.keySet().toArray(new Instant[0]);
        double[] x = new double[n];
        Map<Instant, Integer> indexOf = new HashMap<>();
        int k = 0;
        for (Map.Entry<Instant, Double> e : merged.entrySet()) {
            x[k] = e.getValue();
            indexOf.put(e.getKey(), k);
            k++;
        }

        double tol = SeriesMath.tolerance(x);
        double[] velocityZ = velocityZ(x, tol);
        double[] trendZ = trendBreakZ(x, tol);
        double[] seasonalZ = seasonalZ(ts, x, model.getCadence(), tol);

        List<DetectionResult> results = new ArrayList<>(points.size());
        for (SignalPoint p : points) {
            int i = indexOf.get(p.getTimestamp());
            double velocityScore = SeriesMath.excess(velocityZ[i], velocityThreshold);
            double trendScore = SeriesMath.excess(trendZ[i], trendBreakMultiplier);
            double seasonalScore = SeriesMath.excess(seasonalZ[i], seasonalThreshold);
            double normalized = Math.max(velocityScore, Math.max(trendScore, seasonalScore));
            double raw = Math.max(velocityZ[i], Math.max(trendZ[i], seasonalZ[i]));

            Map<String, Double> diagnostics = new LinkedHashMap<>();
            diagnostics.put("firstDifference", i > 0 ? x[i] - x[i - 1] : 0.0);
            diagnostics.put("velocityZ", SeriesMath.finite(velocityZ[i]));
            diagnostics.put("trendBreakZ", SeriesMath.finite(trendZ[i]));
            diagnostics.put("seasonalZ", SeriesMath.finite(seasonalZ[i]));
            diagnostics.put("velocityScore", velocityScore);
            diagnostics.put("trendBreakScore", trendScore);
            diagnostics.put("seasonalScore", seasonalScore);

            results.add(new DetectionResult(model.getMetricName(), p.getTimestamp(), p.getValue(),
                    SeriesMath.finite(raw), normalized, kind(), diagnostics));
        }
        return results;
    }

    // ---------------------------------------------------------------
    // Sub-scores
    // ---------------------------------------------------------------

    private static double[] velocityZ(double[] x, double tol) {
        double[] z = new double[x.length];
        double[] diffs = new double[x.length - 1];
        for (int i = 1; i < x.length; i++) {
            diffs[i - 1] = x[i] - x[i - 1];
        }
        double mean = SeriesMath.mean(diffs);
        double std = SeriesMath.std(diffs, mean);
        for (int i = 1; i < x.length; i++) {
            z[i] = SeriesMath.ratio(diffs[i - 1] - mean, std, tol);
        }
        return z;
    }

    private double[] trendBreakZ(double[] x, double tol) {
        int n = x.length;
        double[] z = new double[n];
        if (n < 3) {
            return z;
        }
        double[] second = new double[n];
        for (int i = 2; i < n; i++) {
            second[i] = (x[i] - x[i - 1]) - (x[i - 1] - x[i - 2]);
        }
        double[] all = new double[n - 2];
        System.arraycopy(second, 2, all, 0, n - 2);
        double overallStd = SeriesMath.std(all);

        for (int i = 2; i < n; i++) {
            int from = Math.max(2, i - rollingWindow);
            int count = i - from;
            double spread;
            if (count >= 2) {
                double[] previous = new double[count];
                System.arraycopy(second, from, previous, 0, count);
                spread = SeriesMath.std(previous);
            } else {
                spread = overallStd;
            }
            z[i] = SeriesMath.ratio(second[i], spread, tol);
        }
        return z;
    }

    private double[] seasonalZ(Instant[] ts, double[] x, Duration cadence, double tol) {
        int n = x.length;
        double[] z = new double[n];
        if (seasonLength < 2 || n < 2 * seasonLength) {
            return z;
        }

        double seriesStd = SeriesMath.std(x);
        long cadenceMillis = Math.max(1L, cadence.toMillis());
        long maxGapMillis = (long) (gapTolerance * cadenceMillis);

        // running (sum, count) per (segment, phase)
        Map<Long, double[]> phaseTotals = new HashMap<>();
        long segment = 0;
        for (int i = 0; i < n; i++) {
            if (i > 0 && Duration.between(ts[i - 1], ts[i]).toMillis() > maxGapMillis) {
                segment++;
            }
            long slot = Math.round((double) Duration.between(ts[0], ts[i]).toMillis() / cadenceMillis);
            long key = segment * seasonLength + Math.floorMod(slot, (long) seasonLength);

            double[] totals = phaseTotals.computeIfAbsent(key, ignored -> new double[2]);
            if (totals[1] > 0) {
                z[i] = SeriesMath.ratio(x[i] - totals[0] / totals[1], seriesStd, tol);
            }
            totals[0] += x[i];
            totals[1] += 1;
        }
        return z;
    }
}
