package com.farmsentinel.core.registry;

import com.farmsentinel.core.detection.Detector;
import com.farmsentinel.core.detection.DetectorModel;
import com.farmsentinel.core.error.FitFailureException;
import com.farmsentinel.core.error.InsufficientDataException;
import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.SignalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DetectorSetFitter} that fits each configured detector in turn.
 *
 * <p>
 * {@link InsufficientDataException} marks the detector as skipped and is part
 * of a successful result. Any other exception is collected; once every
 * detector has been tried the partial set is thrown inside a
 * {@link FitFailureException}.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleFitter implements DetectorSetFitter {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleFitter.class);

    private final List<Detector<?>> detectors;
    private final DetectionMetrics metrics;

    public EnsembleFitter(List<Detector<?>> detectors, DetectionMetrics metrics) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public FittedDetectorSet fit(CacheKey key, SignalWindow window) {
        Map<DetectorKind, DetectorModel> models = new EnumMap<>(DetectorKind.class);
        Map<DetectorKind, String> skipped = new EnumMap<>(DetectorKind.class);
        Map<DetectorKind, String> failures = new EnumMap<>(DetectorKind.class);
        RuntimeException firstFailure = null;

        for (Detector<?> detector : detectors) {
            DetectorKind kind = detector.kind();
            try {
                models.put(kind, detector.fit(window));
                metrics.recordDetectorFit(kind);
            } catch (InsufficientDataException e) {
                LOG.warn("Skipping {} for {}: {}", kind, key, e.getMessage());
                skipped.put(kind, e.getMessage());
                metrics.recordDetectorSkipped(kind);
            } catch (RuntimeException e) {
                LOG.warn("Fit of {} for {} failed", kind, key, e);
                failures.put(kind, e.getClass().getSimpleName() + ": " + e.getMessage());
                metrics.recordDetectorFailure(kind);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        FittedDetectorSet set = new FittedDetectorSet(key, models, skipped);
        if (!failures.isEmpty()) {
            throw new FitFailureException(set, failures, firstFailure);
        }
        LOG.info("Fitted {} detector(s) for {} over {} point(s), {} skipped",
                models.size(), key, window.size(), skipped.size());
        return set;
    }
}
