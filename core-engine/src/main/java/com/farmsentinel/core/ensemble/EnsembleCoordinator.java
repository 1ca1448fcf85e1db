package com.farmsentinel.core.ensemble;

import com.farmsentinel.core.detection.Detector;
import com.farmsentinel.core.detection.DetectorModel;
import com.farmsentinel.core.error.AllDetectorsFailedException;
import com.farmsentinel.core.error.FitFailureException;
import com.farmsentinel.core.explain.Explainer;
import com.farmsentinel.core.explain.Explanation;
import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.EnsembleScore;
import com.farmsentinel.core.model.EnsembleScore.Contribution;
import com.farmsentinel.core.model.EnsembleWeights;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;
import com.farmsentinel.core.registry.CacheKey;
import com.farmsentinel.core.registry.DetectorRegistry;
import com.farmsentinel.core.registry.FittedDetectorSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fits (or reuses) every detector for a window, scores points and combines the
 * results.
 *
 * <h3>Combination</h3>
 * <p>
 * For each point {@code combined = sum(w_k * s_k) / sum(w_k)} over the
 * detectors that produced a score. A detector with weight 0 does not take part.
 * A participating detector that was skipped, failed to fit or failed to score
 * is left out of both sums, so the remaining weights are renormalized rather
 * than counting the missing detector as 0.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * {@link FitFailureException} from the registry is logged and the partial set
 * it carries is used for this call only. If no participating detector scores,
 * {@link AllDetectorsFailedException} is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleCoordinator.class);

    private final List<Detector<?>> detectors;
    private final DetectorRegistry registry;
    private final SeverityClassifier classifier;
    private final Explainer explainer;
    private final DetectionMetrics metrics;
    private final Duration cacheTtl;
    private final Clock clock;
    private volatile EnsembleWeights defaultWeights;

    public EnsembleCoordinator(List<Detector<?>> detectors, DetectorRegistry registry, SeverityClassifier classifier,
            Explainer explainer, EnsembleWeights defaultWeights, Duration cacheTtl, DetectionMetrics metrics,
            Clock clock) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.explainer = Objects.requireNonNull(explainer, "explainer must not be null");
        this.defaultWeights = Objects.requireNonNull(defaultWeights, "defaultWeights must not be null");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Score points with the default weights.
     */
    public List<EnsembleScore> detect(SignalWindow window, List<SignalPoint> points) {
        return detect(window, points, defaultWeights);
    }

    /**
     * Score points with caller-supplied weights.
     *
     * @return one score per point, in the order given
     * @throws AllDetectorsFailedException if no participating detector scored
     */
    public List<EnsembleScore> detect(SignalWindow window, List<SignalPoint> points, EnsembleWeights weights) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        if (points.isEmpty()) {
            return List.of();
        }

        CacheKey key = CacheKey.of(window.getRoomId(), window.getMetricName());
        Map<DetectorKind, String> excluded = new EnumMap<>(DetectorKind.class);
        FittedDetectorSet fitted;
        try {
            fitted = registry.getOrFit(key, window, cacheTtl);
        } catch (FitFailureException e) {
            LOG.warn("Scoring {} with partially fitted detectors, excluded: {}", key, e.getFailures().keySet());
            fitted = e.getPartialSet();
            e.getFailures().forEach((kind, reason) -> excluded.put(kind, "fit failed: " + reason));
        }
        fitted.getSkipped().forEach((kind, reason) -> excluded.put(kind, "insufficient data: " + reason));

        Map<DetectorKind, List<DetectionResult>> resultsByKind = new EnumMap<>(DetectorKind.class);
        for (Detector<?> detector : detectors) {
            DetectorKind kind = detector.kind();
            if (!weights.participates(kind)) {
                excluded.remove(kind);
                continue;
            }
            Optional<DetectorModel> model = fitted.model(kind);
            if (model.isEmpty()) {
                excluded.putIfAbsent(kind, "not fitted");
                continue;
            }
            try {
                List<DetectionResult> results = detector.scoreFitted(model.get(), points);
                if (results.size() != points.size()) {
                    throw new IllegalStateException(kind + " returned " + results.size()
                            + " results for " + points.size() + " points");
                }
                resultsByKind.put(kind, results);
            } catch (RuntimeException e) {
                LOG.warn("Scoring with {} for {} failed", kind, key, e);
                metrics.recordDetectorFailure(kind);
                excluded.put(kind, "scoring failed: " + e.getMessage());
            }
        }

        if (resultsByKind.isEmpty()) {
            throw new AllDetectorsFailedException(key.getRoomId(), key.getMetricName(), excluded);
        }

        List<EnsembleScore> scores = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            scores.add(combine(key, points.get(i), i, resultsByKind, weights, excluded));
        }
        return scores;
    }

    /**
     * Build anomaly records for scores strictly above {@code sensitivity}.
     *
     * @param sensitivity threshold in [0, 1]
     * @return records in score order, highest first; not yet persisted
     */
    public List<AnomalyRecord> flag(List<EnsembleScore> scores, String farmId, double sensitivity) {
        Objects.requireNonNull(scores, "scores must not be null");
        if (!(sensitivity >= 0.0 && sensitivity <= 1.0)) {
            throw new IllegalArgumentException("sensitivity must be in [0, 1], got: " + sensitivity);
        }
        Instant now = clock.instant();
        List<AnomalyRecord> records = new ArrayList<>();
        for (EnsembleScore score : scores) {
            if (score.getCombinedScore() <= sensitivity) {
                continue;
            }
            Explanation explanation = explainer.explain(score);
            LOG.debug("Flagged {} {} at {}: {}", score.getRoomId(), score.getMetricName(), score.getTimestamp(),
                    explanation.getSummary());
            records.add(AnomalyRecord.builder()
                    .roomId(score.getRoomId())
                    .farmId(farmId)
                    .timestamp(score.getTimestamp())
                    .metricName(score.getMetricName())
                    .value(score.getValue())
                    .combinedScore(score.getCombinedScore())
                    .anomalyType(explanation.getAnomalyType())
                    .severity(score.getSeverity())
                    .description(explanation.getSummary())
                    .factors(explanation.getFactors())
                    .createdAt(now)
                    .build());
        }
        records.sort((a, b) -> Double.compare(b.getCombinedScore(), a.getCombinedScore()));
        return records;
    }

    public EnsembleWeights getDefaultWeights() {
        return defaultWeights;
    }

    /**
     * Replace the default weights used by {@link #detect(SignalWindow, List)}.
     */
    public void setDefaultWeights(EnsembleWeights weights) {
        this.defaultWeights = Objects.requireNonNull(weights, "weights must not be null");
        LOG.info("Default ensemble weights set to {}", weights);
    }

    public DetectorRegistry getRegistry() {
        return registry;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private EnsembleScore combine(CacheKey key, SignalPoint point, int index,
            Map<DetectorKind, List<DetectionResult>> resultsByKind, EnsembleWeights weights,
            Map<DetectorKind, String> excluded) {
        double weightSum = 0.0;
        double weighted = 0.0;
        for (Map.Entry<DetectorKind, List<DetectionResult>> e : resultsByKind.entrySet()) {
            double w = weights.weight(e.getKey());
            weightSum += w;
            weighted += w * e.getValue().get(index).getNormalizedScore();
        }

        List<Contribution> contributions = new ArrayList<>(resultsByKind.size());
        for (Map.Entry<DetectorKind, List<DetectionResult>> e : resultsByKind.entrySet()) {
            contributions.add(new Contribution(e.getKey(), weights.weight(e.getKey()) / weightSum,
                    e.getValue().get(index)));
        }

        double combined = Math.max(0.0, Math.min(1.0, weighted / weightSum));
        return new EnsembleScore(key.getRoomId(), key.getMetricName(), point.getTimestamp(), point.getValue(),
                combined, classifier.classify(combined), contributions, excluded);
    }
}
