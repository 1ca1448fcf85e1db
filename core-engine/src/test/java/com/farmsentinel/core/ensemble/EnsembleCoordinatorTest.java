package com.farmsentinel.core.ensemble;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.detection.Detector;
import com.farmsentinel.core.detection.DetectorFactory;
import com.farmsentinel.core.detection.DetectorModel;
import com.farmsentinel.core.error.AllDetectorsFailedException;
import com.farmsentinel.core.error.FitFailureException;
import com.farmsentinel.core.explain.Explainer;
import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.EnsembleScore;
import com.farmsentinel.core.model.EnsembleWeights;
import com.farmsentinel.core.model.Severity;
import com.farmsentinel.core.model.SignalWindow;
import com.farmsentinel.core.registry.DetectorRegistry;
import com.farmsentinel.core.registry.DetectorSetFitter;
import com.farmsentinel.core.registry.EnsembleFitter;
import com.farmsentinel.core.registry.FittedDetectorSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.farmsentinel.core.SignalFixtures.SPIKE_INDEX;
import static com.farmsentinel.core.SignalFixtures.SPIKE_VALUE;
import static com.farmsentinel.core.SignalFixtures.constant;
import static com.farmsentinel.core.SignalFixtures.daily;
import static com.farmsentinel.core.SignalFixtures.spikedTemperatures;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EnsembleCoordinator}.
 */
class EnsembleCoordinatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC);
    private static final double[] SHORT_SERIES = { 20, 21, 22, 21, 20, 21, 22, 35 };

    private List<Detector<?>> detectors;
    private DetectionMetrics metrics;
    private EnsembleCoordinator coordinator;

    @BeforeEach
    void setUp() {
        detectors = DetectorFactory.createAll(new DetectorSettings());
        metrics = DetectionMetrics.inMemory();
        coordinator = coordinator(new EnsembleFitter(detectors, metrics));
    }

    @Test
    @DisplayName("Should classify the 45 degree reading as a high univariate anomaly with statistical weights only")
    void shouldFlagSpikeWithStatisticalWeights() {
        SignalWindow window = daily(spikedTemperatures());
        EnsembleWeights statisticalOnly = EnsembleWeights.of(Map.of(DetectorKind.STATISTICAL_THRESHOLD, 1.0));

        List<EnsembleScore> scores = coordinator.detect(window, window.getPoints(), statisticalOnly);
        List<AnomalyRecord> records = coordinator.flag(scores, "farm-1", 0.8);

        assertThat(records).hasSize(1);
        AnomalyRecord record = records.get(0);
        assertThat(record.getValue()).isEqualTo(SPIKE_VALUE);
        assertThat(record.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(record.getAnomalyType()).isEqualTo(AnomalyType.UNIVARIATE);
        assertThat(record.getFarmId()).isEqualTo("farm-1");
        assertThat(record.getId()).isNull();
        assertThat(record.getDescription())
                .startsWith("High univariate anomaly in temperature")
                .contains("standard deviations from the 30-day mean");
        assertThat(record.getFactors()).hasSize(1);
        assertThat(record.getCreatedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("Should rate the 45 degree reading high with the default weights and leave the rest unflagged")
    void shouldFlagSpikeWithDefaultWeights() {
        SignalWindow window = daily(spikedTemperatures());

        List<EnsembleScore> scores = coordinator.detect(window, window.getPoints());

        EnsembleScore spike = scores.get(SPIKE_INDEX);
        assertThat(spike.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(spike.getContributions()).hasSize(4);
        assertThat(spike.getExcluded()).isEmpty();
        assertThat(scores).allSatisfy(s -> assertThat(s.getCombinedScore()).isBetween(0.0, 1.0));

        List<AnomalyRecord> records = coordinator.flag(scores, "farm-1", 0.8);
        assertThat(records).extracting(AnomalyRecord::getTimestamp).containsExactly(spike.getTimestamp());
        assertThat(records.get(0).getAnomalyType()).isEqualTo(AnomalyType.MULTIVARIATE);
    }

    @Test
    @DisplayName("Should renormalize weights over the detectors that could fit")
    void shouldRenormalizeWeightsOverFittedDetectors() {
        SignalWindow window = daily(SHORT_SERIES);
        EnsembleWeights remaining = EnsembleWeights.of(Map.of(
                DetectorKind.STATISTICAL_THRESHOLD, 0.5,
                DetectorKind.TEMPORAL_PATTERN, 0.5));

        List<EnsembleScore> withDefaults = coordinator.detect(window, window.getPoints());
        List<EnsembleScore> withRemaining = coordinator.detect(window, window.getPoints(), remaining);

        for (int i = 0; i < withDefaults.size(); i++) {
            assertThat(withDefaults.get(i).getCombinedScore())
                    .isCloseTo(withRemaining.get(i).getCombinedScore(), within(1e-12));
        }
        EnsembleScore last = withDefaults.get(SHORT_SERIES.length - 1);
        assertThat(last.getContributions()).extracting(EnsembleScore.Contribution::getWeight)
                .containsOnly(0.5);
        assertThat(last.getExcluded()).containsOnlyKeys(DetectorKind.GLOBAL_OUTLIER, DetectorKind.LOCAL_DENSITY);
        assertThat(last.getExcluded().get(DetectorKind.LOCAL_DENSITY)).startsWith("insufficient data");
    }

    @Test
    @DisplayName("Should leave zero-weight detectors out of the score")
    void shouldSkipZeroWeightDetectors() {
        SignalWindow window = daily(spikedTemperatures());
        Map<DetectorKind, Double> weights = new EnumMap<>(DetectorKind.class);
        weights.put(DetectorKind.GLOBAL_OUTLIER, 0.5);
        weights.put(DetectorKind.STATISTICAL_THRESHOLD, 0.5);
        weights.put(DetectorKind.TEMPORAL_PATTERN, 0.0);

        EnsembleScore spike = coordinator.detect(window, window.getPoints(), EnsembleWeights.of(weights))
                .get(SPIKE_INDEX);

        assertThat(spike.getContributions()).extracting(EnsembleScore.Contribution::getKind)
                .containsExactlyInAnyOrder(DetectorKind.GLOBAL_OUTLIER, DetectorKind.STATISTICAL_THRESHOLD);
        assertThat(spike.getExcluded()).isEmpty();
    }

    @Test
    @DisplayName("Should fail when no detector can handle the window")
    void shouldFailWhenEveryDetectorIsSkipped() {
        SignalWindow window = daily(constant(2, 5.0));

        assertThatThrownBy(() -> coordinator.detect(window, window.getPoints()))
                .isInstanceOf(AllDetectorsFailedException.class)
                .satisfies(e -> assertThat(((AllDetectorsFailedException) e).getReasons())
                        .containsOnlyKeys(DetectorKind.values()));
    }

    @Test
    @DisplayName("Should score with the detectors that fitted when others failed")
    void shouldUsePartialSetAfterFitFailure() {
        DetectorSettings settings = new DetectorSettings();
        DetectorSetFitter failingGlobal = (key, window) -> {
            Detector<?> statistical = DetectorFactory.create(DetectorKind.STATISTICAL_THRESHOLD, settings);
            Map<DetectorKind, DetectorModel> models = new EnumMap<>(DetectorKind.class);
            models.put(DetectorKind.STATISTICAL_THRESHOLD, statistical.fit(window));
            throw new FitFailureException(new FittedDetectorSet(key, models, Map.of()),
                    Map.of(DetectorKind.GLOBAL_OUTLIER, "forest exploded"), new IllegalStateException("boom"));
        };
        EnsembleCoordinator partial = coordinator(failingGlobal);
        SignalWindow window = daily(spikedTemperatures());

        EnsembleScore spike = partial.detect(window, window.getPoints()).get(SPIKE_INDEX);

        assertThat(spike.getCombinedScore()).isEqualTo(1.0);
        assertThat(spike.getExcluded().get(DetectorKind.GLOBAL_OUTLIER)).contains("forest exploded");
        assertThat(spike.getExcluded()).containsKeys(DetectorKind.LOCAL_DENSITY, DetectorKind.TEMPORAL_PATTERN);
        assertThat(partial.getRegistry().size()).isZero();
    }

    @Test
    @DisplayName("Should only flag scores strictly above the sensitivity")
    void shouldFlagStrictlyAboveSensitivity() {
        SignalWindow window = daily(spikedTemperatures());
        EnsembleWeights statisticalOnly = EnsembleWeights.of(Map.of(DetectorKind.STATISTICAL_THRESHOLD, 1.0));
        List<EnsembleScore> scores = coordinator.detect(window, window.getPoints(), statisticalOnly);

        long zeroScores = scores.stream().filter(s -> s.getCombinedScore() == 0.0).count();
        assertThat(zeroScores).isPositive();

        assertThat(coordinator.flag(scores, null, 1.0)).isEmpty();
        assertThat(coordinator.flag(scores, null, 0.0))
                .hasSize(scores.size() - (int) zeroScores)
                .allSatisfy(r -> assertThat(r.getCombinedScore()).isPositive())
                .isSortedAccordingTo((a, b) -> Double.compare(b.getCombinedScore(), a.getCombinedScore()));
        assertThatThrownBy(() -> coordinator.flag(scores, null, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reuse the fitted detectors across calls")
    void shouldReuseFittedDetectors() {
        SignalWindow window = daily(spikedTemperatures());

        coordinator.detect(window, window.getPoints());
        coordinator.detect(window, window.getPoints().subList(0, 5));

        assertThat(metrics.getRegistry().get("detector_fits_total").tag("detector", "global_outlier")
                .counter().count()).isEqualTo(1.0);
        assertThat(coordinator.detect(window, List.of())).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private EnsembleCoordinator coordinator(DetectorSetFitter fitter) {
        return new EnsembleCoordinator(detectors, new DetectorRegistry(fitter, CLOCK),
                SeverityClassifier.defaults(), new Explainer(), EnsembleWeights.DEFAULT,
                Duration.ofHours(1), metrics, CLOCK);
    }
}
