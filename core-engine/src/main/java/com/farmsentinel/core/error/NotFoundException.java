package com.farmsentinel.core.error;

/**
 * Lookup or feedback on an anomaly id the sink does not know.
 *
 * @since 1.0.0
 */
public class NotFoundException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final long anomalyId;

    public NotFoundException(long anomalyId) {
        super("Anomaly not found: " + anomalyId);
        this.anomalyId = anomalyId;
    }

    public long getAnomalyId() {
        return anomalyId;
    }
}
