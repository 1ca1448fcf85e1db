package com.farmsentinel.core.explain;

import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.EnsembleScore;
import com.farmsentinel.core.model.EnsembleScore.Contribution;
import com.farmsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Explainer}.
 */
class ExplainerTest {

    private static final Instant TS = Instant.parse("2024-03-16T00:00:00Z");

    private final Explainer explainer = new Explainer();

    @Test
    @DisplayName("Should attribute a dominated score to the dominant detector's type")
    void shouldUseDominantDetectorType() {
        EnsembleScore score = score(1.0, Severity.HIGH,
                new Contribution(DetectorKind.STATISTICAL_THRESHOLD, 1.0, statistical(1.0, true)));

        Explanation explanation = explainer.explain(score);

        assertThat(explanation.getAnomalyType()).isEqualTo(AnomalyType.UNIVARIATE);
        assertThat(explanation.getSummary()).isEqualTo(
                "High univariate anomaly in temperature (score 1.00): value 45.00 is 5.2 standard deviations "
                        + "from the 30-day mean of 23.17, outside the expected range [17.50, 27.50]");
    }

    @Test
    @DisplayName("Should call a score shared across detectors multivariate")
    void shouldUseMultivariateWhenBalanced() {
        EnsembleScore score = score(0.85, Severity.HIGH,
                new Contribution(DetectorKind.STATISTICAL_THRESHOLD, 0.5, statistical(0.9, false)),
                new Contribution(DetectorKind.LOCAL_DENSITY, 0.5, density(0.8)));

        Explanation explanation = explainer.explain(score);

        assertThat(explanation.getAnomalyType()).isEqualTo(AnomalyType.MULTIVARIATE);
        assertThat(explanation.getFactors()).extracting(f -> f.getDetector())
                .containsExactly(DetectorKind.STATISTICAL_THRESHOLD, DetectorKind.LOCAL_DENSITY);
        assertThat(explanation.getFactors().get(0).getContribution()).isEqualTo(0.45);
        assertThat(explanation.getFactors().get(0).getReason()).doesNotContain("expected range");
        assertThat(explanation.getFactors().get(1).getReason()).contains("sparser than its 20 nearest readings");
    }

    @Test
    @DisplayName("Should name a temporal anomaly when the temporal detector dominates")
    void shouldUseTemporalType() {
        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("velocityScore", 0.2);
        diagnostics.put("trendBreakScore", 1.0);
        diagnostics.put("seasonalScore", 0.0);
        diagnostics.put("trendBreakZ", Double.MAX_VALUE);
        DetectionResult temporal = new DetectionResult("temperature", TS, 45.0, Double.MAX_VALUE, 1.0,
                DetectorKind.TEMPORAL_PATTERN, diagnostics);
        EnsembleScore score = score(0.525, Severity.MEDIUM,
                new Contribution(DetectorKind.TEMPORAL_PATTERN, 0.5, temporal),
                new Contribution(DetectorKind.GLOBAL_OUTLIER, 0.5, global(0.05)));

        Explanation explanation = explainer.explain(score);

        assertThat(explanation.getAnomalyType()).isEqualTo(AnomalyType.TEMPORAL);
        assertThat(explanation.getSummary())
                .startsWith("Medium temporal anomaly in temperature (score 0.53)")
                .endsWith("abrupt break in an otherwise steady trend");
    }

    @Test
    @DisplayName("Should fall back to multivariate for a zero score")
    void shouldHandleZeroScore() {
        EnsembleScore score = score(0.0, Severity.LOW,
                new Contribution(DetectorKind.GLOBAL_OUTLIER, 1.0, global(0.0)));

        assertThat(explainer.explain(score).getAnomalyType()).isEqualTo(AnomalyType.MULTIVARIATE);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static EnsembleScore score(double combined, Severity severity, Contribution... contributions) {
        return new EnsembleScore("room-a", "temperature", TS, 45.0, combined, severity,
                List.of(contributions), Map.of());
    }

    private static DetectionResult statistical(double normalized, boolean iqrFired) {
        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("zScore", 5.2);
        diagnostics.put("mean", 23.17);
        diagnostics.put("windowDays", 30.0);
        diagnostics.put("lowerFence", 17.5);
        diagnostics.put("upperFence", 27.5);
        diagnostics.put("iqrRuleFired", iqrFired ? 1.0 : 0.0);
        return new DetectionResult("temperature", TS, 45.0, 1.7, normalized,
                DetectorKind.STATISTICAL_THRESHOLD, diagnostics);
    }

    private static DetectionResult density(double normalized) {
        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("lof", 1.0 / (1.0 - normalized));
        diagnostics.put("neighbors", 20.0);
        return new DetectionResult("temperature", TS, 45.0, 5.0, normalized,
                DetectorKind.LOCAL_DENSITY, diagnostics);
    }

    private static DetectionResult global(double normalized) {
        return new DetectionResult("temperature", TS, 45.0, 0.5, normalized,
                DetectorKind.GLOBAL_OUTLIER, Map.of("pathLength", 4.0, "expectedPathLength", 6.0));
    }
}
