package com.farmsentinel.core.port;

import com.farmsentinel.core.error.NotFoundException;
import com.farmsentinel.core.model.AnomalyRecord;

import java.util.Optional;

/**
 * Store for anomaly records and their feedback.
 *
 * <p>
 * Implementations must be thread-safe. Records are never deleted.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalySink {

    /**
     * @return the id assigned to the stored record
     */
    long persist(AnomalyRecord record);

    Optional<AnomalyRecord> find(long anomalyId);

    /**
     * Apply operator feedback to a stored record. The read of the current state
     * and the write of the new one happen as one step.
     *
     * @return the updated record, whose last history entry describes this change
     * @throws NotFoundException if the id is unknown
     */
    AnomalyRecord updateFeedback(long anomalyId, boolean isReal, String notes);
}
