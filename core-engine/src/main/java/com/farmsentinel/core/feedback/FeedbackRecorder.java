package com.farmsentinel.core.feedback;

import com.farmsentinel.core.error.NotFoundException;
import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.FeedbackEntry;
import com.farmsentinel.core.port.AnomalySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Records operator feedback on detected anomalies.
 *
 * <p>
 * Feedback is stored as labelled ground truth only. It does not refit
 * detectors or change weights or thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackRecorder.class);

    private final AnomalySink sink;

    public FeedbackRecorder(AnomalySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Confirm ({@code isReal}) or dismiss an anomaly. Resolved records may be
     * relabelled.
     *
     * @return the updated record
     * @throws NotFoundException if the id is unknown
     */
    public AnomalyRecord recordFeedback(long anomalyId, boolean isReal, String notes) {
        AnomalyRecord after = sink.updateFeedback(anomalyId, isReal, notes);
        List<FeedbackEntry> history = after.getFeedbackHistory();
        // the entry written by this update carries the state it replaced
        FeedbackEntry change = history.get(history.size() - 1);
        LOG.info("Feedback on anomaly {}: {} -> {} at {} (notes: {})", anomalyId,
                change.getPreviousState(), change.getState(), change.getRecordedAt(), notes);
        return after;
    }

    /**
     * @throws NotFoundException if the id is unknown
     */
    public AnomalyRecord find(long anomalyId) {
        return sink.find(anomalyId).orElseThrow(() -> new NotFoundException(anomalyId));
    }
}
