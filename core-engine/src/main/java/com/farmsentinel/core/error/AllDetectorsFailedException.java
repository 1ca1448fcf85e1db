package com.farmsentinel.core.error;

import com.farmsentinel.core.model.DetectorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * No participating detector produced a score, so no combined score can be
 * reported.
 *
 * @since 1.0.0
 */
public class AllDetectorsFailedException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final Map<DetectorKind, String> reasons;

    public AllDetectorsFailedException(String roomId, String metricName, Map<DetectorKind, String> reasons) {
        super("No detector could score " + roomId + "/" + metricName + ": " + reasons);
        this.reasons = reasons.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(reasons));
    }

    /**
     * @return why each participating detector was excluded
     */
    public Map<DetectorKind, String> getReasons() {
        return reasons;
    }
}
