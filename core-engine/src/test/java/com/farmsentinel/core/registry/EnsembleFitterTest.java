package com.farmsentinel.core.registry;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.detection.DetectorFactory;
import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.DetectorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.farmsentinel.core.SignalFixtures.daily;
import static com.farmsentinel.core.SignalFixtures.spikedTemperatures;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EnsembleFitter}.
 */
class EnsembleFitterTest {

    private final DetectionMetrics metrics = DetectionMetrics.inMemory();
    private final EnsembleFitter fitter = new EnsembleFitter(
            DetectorFactory.createAll(new DetectorSettings()), metrics);

    @Test
    @DisplayName("Should fit every detector on a full window")
    void shouldFitAll() {
        FittedDetectorSet set = fitter.fit(CacheKey.of("room-a", "temperature"), daily(spikedTemperatures()));

        assertThat(set.getModels()).containsOnlyKeys(DetectorKind.values());
        assertThat(set.getSkipped()).isEmpty();
        assertThat(set.model(DetectorKind.LOCAL_DENSITY)).hasValueSatisfying(
                m -> assertThat(m.getTrainingSize()).isEqualTo(30));
    }

    @Test
    @DisplayName("Should skip detectors the window is too short for")
    void shouldSkipShortWindowDetectors() {
        double[] twelve = new double[12];
        for (int i = 0; i < twelve.length; i++) {
            twelve[i] = 18.0 + (i % 4);
        }

        FittedDetectorSet set = fitter.fit(CacheKey.of("room-a", "co2"), daily("room-a", "co2", twelve));

        assertThat(set.getModels()).containsOnlyKeys(DetectorKind.GLOBAL_OUTLIER,
                DetectorKind.STATISTICAL_THRESHOLD, DetectorKind.TEMPORAL_PATTERN);
        assertThat(set.getSkipped()).containsOnlyKeys(DetectorKind.LOCAL_DENSITY);
        assertThat(metrics.getRegistry().get("detector_skipped_total").tag("detector", "local_density")
                .counter().count()).isEqualTo(1.0);
    }
}
