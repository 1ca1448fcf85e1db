package com.farmsentinel.core.registry;

import com.farmsentinel.core.error.FitFailureException;
import com.farmsentinel.core.model.SignalWindow;

/**
 * Fits every detector over a window in one pass.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DetectorSetFitter {

    /**
     * @return the complete fitted set; detectors refusing the window appear as
     *         skipped
     * @throws FitFailureException if any detector failed unexpectedly
     */
    FittedDetectorSet fit(CacheKey key, SignalWindow window);
}
