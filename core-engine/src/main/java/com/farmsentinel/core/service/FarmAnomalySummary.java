package com.farmsentinel.core.service;

import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Anomalies of every room of a farm, grouped by room and severity.
 *
 * <p>
 * {@code byRoom} lists every room of the farm, including rooms with no
 * anomalies. {@code bySeverity} lists only tiers with at least one anomaly.
 * </p>
 *
 * @since 1.0.0
 */
public final class FarmAnomalySummary {

    private final String farmId;
    private final int periodDays;
    private final List<AnomalyRecord> anomalies;
    private final Map<String, Integer> byRoom;
    private final Map<Severity, Integer> bySeverity;
    private final AnomalyStatistics statistics;

    FarmAnomalySummary(String farmId, int periodDays, List<AnomalyRecord> anomalies, Map<String, Integer> byRoom) {
        this.farmId = Objects.requireNonNull(farmId, "farmId must not be null");
        this.periodDays = periodDays;
        this.anomalies = List.copyOf(anomalies);
        this.byRoom = Collections.unmodifiableMap(new LinkedHashMap<>(byRoom));
        Map<Severity, Integer> severities = new EnumMap<>(Severity.class);
        for (AnomalyRecord r : anomalies) {
            severities.merge(r.getSeverity(), 1, Integer::sum);
        }
        this.bySeverity = Collections.unmodifiableMap(severities);
        this.statistics = AnomalyStatistics.of(anomalies);
    }

    public String getFarmId() {
        return farmId;
    }

    public int getPeriodDays() {
        return periodDays;
    }

    /**
     * @return anomalies of all rooms, highest score first
     */
    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    public Map<String, Integer> getByRoom() {
        return byRoom;
    }

    public Map<Severity, Integer> getBySeverity() {
        return bySeverity;
    }

    public int getTotalAnomalies() {
        return anomalies.size();
    }

    public AnomalyStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "FarmAnomalySummary{farm='" + farmId + "', total=" + anomalies.size()
                + ", byRoom=" + byRoom + ", bySeverity=" + bySeverity + '}';
    }
}
