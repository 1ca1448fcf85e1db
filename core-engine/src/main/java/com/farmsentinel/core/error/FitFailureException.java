package com.farmsentinel.core.error;

import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.registry.FittedDetectorSet;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One or more detectors failed unexpectedly while fitting a window.
 *
 * <p>
 * The registry does not cache the partially fitted set; it is carried here so
 * the current call can still score with the detectors that did fit.
 * </p>
 *
 * @since 1.0.0
 */
public class FitFailureException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final transient FittedDetectorSet partialSet;
    private final Map<DetectorKind, String> failures;

    public FitFailureException(FittedDetectorSet partialSet, Map<DetectorKind, String> failures, Throwable cause) {
        super("Fit failed for " + partialSet.getKey() + ": " + failures, cause);
        this.partialSet = partialSet;
        this.failures = Collections.unmodifiableMap(new EnumMap<>(failures));
    }

    public FittedDetectorSet getPartialSet() {
        return partialSet;
    }

    public Map<DetectorKind, String> getFailures() {
        return failures;
    }
}
