package com.farmsentinel.core.detection;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates {@link Detector} instances from {@link DetectorSettings}.
 *
 * <p>
 * The switch over {@link DetectorKind} has no default branch, so adding a
 * kind without a detector fails to compile.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
    }

    /**
     * @throws NullPointerException if an argument is {@code null}
     */
    public static Detector<?> create(DetectorKind kind, DetectorSettings settings) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        return switch (kind) {
            case GLOBAL_OUTLIER -> new GlobalOutlierDetector(settings);
            case LOCAL_DENSITY -> new LocalDensityDetector(settings);
            case STATISTICAL_THRESHOLD -> new StatisticalThresholdDetector(settings);
            case TEMPORAL_PATTERN -> new TemporalPatternDetector(settings);
        };
    }

    /**
     * Create one detector per kind, in {@link DetectorKind} order.
     *
     * @return unmodifiable list of detectors
     */
    public static List<Detector<?>> createAll(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        settings.validate();
        LOG.info("Creating {} detector(s) with {}", DetectorKind.values().length, settings);
        List<Detector<?>> detectors = Arrays.stream(DetectorKind.values())
                .<Detector<?>>map(kind -> create(kind, settings))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
