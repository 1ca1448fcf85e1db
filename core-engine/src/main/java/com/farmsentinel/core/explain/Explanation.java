package com.farmsentinel.core.explain;

import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.ContributingFactor;

import java.util.List;
import java.util.Objects;

/**
 * Ranked contributing factors for one scored point.
 *
 * @since 1.0.0
 */
public final class Explanation {

    private final AnomalyType anomalyType;
    private final List<ContributingFactor> factors;
    private final String summary;

    public Explanation(AnomalyType anomalyType, List<ContributingFactor> factors, String summary) {
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        this.factors = List.copyOf(factors);
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    /**
     * @return factors ordered by contribution, largest first
     */
    public List<ContributingFactor> getFactors() {
        return factors;
    }

    public String getSummary() {
        return summary;
    }

    @Override
    public String toString() {
        return "Explanation{" + anomalyType + ", " + summary + '}';
    }
}
