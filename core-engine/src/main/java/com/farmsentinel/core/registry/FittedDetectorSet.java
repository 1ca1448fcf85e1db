package com.farmsentinel.core.registry;

import com.farmsentinel.core.detection.DetectorModel;
import com.farmsentinel.core.model.DetectorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The models fitted for one key in a single pass, plus the detectors that
 * declined the window.
 *
 * <p>
 * A kind is either fitted or skipped, never both.
 * </p>
 *
 * @since 1.0.0
 */
public final class FittedDetectorSet {

    private final CacheKey key;
    private final Map<DetectorKind, DetectorModel> models;
    private final Map<DetectorKind, String> skipped;

    public FittedDetectorSet(CacheKey key, Map<DetectorKind, DetectorModel> models, Map<DetectorKind, String> skipped) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        EnumMap<DetectorKind, DetectorModel> modelCopy = new EnumMap<>(DetectorKind.class);
        modelCopy.putAll(models);
        EnumMap<DetectorKind, String> skippedCopy = new EnumMap<>(DetectorKind.class);
        skippedCopy.putAll(skipped);
        for (DetectorKind kind : skippedCopy.keySet()) {
            if (modelCopy.containsKey(kind)) {
                throw new IllegalArgumentException(kind + " cannot be both fitted and skipped");
            }
        }
        this.models = Collections.unmodifiableMap(modelCopy);
        this.skipped = Collections.unmodifiableMap(skippedCopy);
    }

    public CacheKey getKey() {
        return key;
    }

    public Optional<DetectorModel> model(DetectorKind kind) {
        return Optional.ofNullable(models.get(kind));
    }

    public Map<DetectorKind, DetectorModel> getModels() {
        return models;
    }

    /**
     * @return reason per detector that could not fit this window
     */
    public Map<DetectorKind, String> getSkipped() {
        return skipped;
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }

    @Override
    public String toString() {
        return "FittedDetectorSet{" + key + ", fitted=" + models.keySet() + ", skipped=" + skipped.keySet() + '}';
    }
}
