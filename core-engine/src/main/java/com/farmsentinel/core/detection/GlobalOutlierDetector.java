package com.farmsentinel.core.detection;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.error.InsufficientDataException;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree-partition outlier detector backed by Smile's {@link IsolationForest}.
 *
 * <h3>Forest</h3>
 * <p>
 * Each tree is grown on a random subsample of at most {@code sampleSize}
 * points, capped at 90% of the window, to a depth of ceil(log2(subsample)).
 * The configured seed seeds Smile's generator on the fitting thread. Smile
 * may grow trees on other pool threads, so raw scores for a window are
 * stable in ranking rather than bit-for-bit.
 * </p>
 *
 * <h3>Scoring</h3>
 * <p>
 * The raw score is the forest's isolation score {@code 2^(-E[h(x)]/c(n))}. It is min-max normalized over
 * the training window's raw scores together with the batch being scored, so a
 * single point can be scored on its own. When every raw score is equal, as for
 * a constant window, the normalized score is 0.
 * </p>
 *
 * <h3>Contamination</h3>
 * <p>
 * The (1 - contamination) quantile of the training raw scores is kept as a
 * cutoff and reported in the diagnostics; it does not change the normalized
 * score.
 * </p>
 *
 * @since 1.0.0
 */
public final class GlobalOutlierDetector implements Detector<GlobalOutlierModel> {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalOutlierDetector.class);

    static final int MIN_WINDOW_SIZE = 10;

    static final double MAX_SUBSAMPLE_RATE = 0.9;

    private final int trees;
    private final int sampleSize;
    private final double contamination;
    private final long seed;

    public GlobalOutlierDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.trees = settings.getTrees();
        this.sampleSize = settings.getSampleSize();
        this.contamination = settings.effectiveContamination();
        this.seed = settings.getSeed();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.GLOBAL_OUTLIER;
    }

    @Override
    public Class<GlobalOutlierModel> modelType() {
        return GlobalOutlierModel.class;
    }

    @Override
    public GlobalOutlierModel fit(SignalWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.size() < MIN_WINDOW_SIZE) {
            throw new InsufficientDataException(kind(),
                    "needs at least " + MIN_WINDOW_SIZE + " points, window has " + window.size());
        }

        double[][] features = window.features();
        double rate = Math.min((double) sampleSize / features.length, MAX_SUBSAMPLE_RATE);
        int subsampleSize = (int) Math.round(features.length * rate);
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(subsampleSize) / Math.log(2)));

        MathEx.setSeed(seed);
        IsolationForest forest = IsolationForest.fit(features, trees, maxDepth, rate, 0);

        double[] trainingScores = new double[features.length];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < features.length; i++) {
            trainingScores[i] = forest.score(features[i]);
            min = Math.min(min, trainingScores[i]);
            max = Math.max(max, trainingScores[i]);
        }
        double cutoff = SeriesMath.percentile(SeriesMath.sortedCopy(trainingScores), (1.0 - contamination) * 100.0);

        LOG.debug("Fitted isolation forest for {}: {} trees, psi={}, depth={}, raw range [{}, {}], cutoff={}",
                window.getMetricName(), trees, subsampleSize, maxDepth, min, max, cutoff);
        return new GlobalOutlierModel(window.getMetricName(), forest, subsampleSize, min, max, cutoff,
                window.size());
    }

    @Override
    public List<DetectionResult> score(GlobalOutlierModel model, List<SignalPoint> points) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(points, "points must not be null");

        IsolationForest forest = model.getForest();
        double expectedPath = SeriesMath.expectedPathLength(model.getSubsampleSize());
        double[] raw = new double[points.size()];
        double[] pathLengths = new double[points.size()];
        double lo = model.getTrainingMinScore();
        double hi = model.getTrainingMaxScore();
        for (int i = 0; i < raw.length; i++) {
            raw[i] = forest.score(new double[] { points.get(i).getValue() });
            pathLengths[i] = -expectedPath * Math.log(raw[i]) / Math.log(2);
            lo = Math.min(lo, raw[i]);
            hi = Math.max(hi, raw[i]);
        }

        double span = hi - lo;
        List<DetectionResult> results = new ArrayList<>(points.size());
        for (int i = 0; i < raw.length; i++) {
            SignalPoint p = points.get(i);
            double normalized = span <= SeriesMath.RELATIVE_EPSILON ? 0.0 : SeriesMath.clip01((raw[i] - lo) / span);

            Map<String, Double> diagnostics = new LinkedHashMap<>();
            diagnostics.put("pathLength", pathLengths[i]);
            diagnostics.put("expectedPathLength", expectedPath);
            diagnostics.put("contaminationCutoff", model.getContaminationCutoff());
            diagnostics.put("aboveCutoff", raw[i] > model.getContaminationCutoff() ? 1.0 : 0.0);

            results.add(new DetectionResult(model.getMetricName(), p.getTimestamp(), p.getValue(),
                    raw[i], normalized, kind(), diagnostics));
        }
        return results;
    }
}
