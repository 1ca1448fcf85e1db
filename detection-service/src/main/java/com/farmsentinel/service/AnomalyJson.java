package com.farmsentinel.service;

import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.service.AnomalyStatistics;
import com.farmsentinel.core.service.FarmAnomalySummary;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Tag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire format of the detection service.
 *
 * <p>
 * Instants are written as ISO-8601 strings and enums as their lowercase
 * labels. Severity and type maps are re-keyed by label so they do not depend
 * on enum constant names.
 * </p>
 */
final class AnomalyJson {

    private AnomalyJson() {
    }

    static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    static Map<String, Object> roomResponse(String roomId, int days, double sensitivity,
            List<AnomalyRecord> anomalies, int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("room_id", roomId);
        body.put("period_days", days);
        body.put("sensitivity", sensitivity);
        body.put("count", anomalies.size());
        body.put("anomalies", anomalies.subList(0, Math.min(limit, anomalies.size())));
        return body;
    }

    static Map<String, Object> farmResponse(FarmAnomalySummary summary) {
        Map<String, Object> bySeverity = new LinkedHashMap<>();
        summary.getBySeverity().forEach((severity, count) -> bySeverity.put(severity.getLabel(), count));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("farm_id", summary.getFarmId());
        body.put("period_days", summary.getPeriodDays());
        body.put("total_anomalies", summary.getTotalAnomalies());
        body.put("by_room", summary.getByRoom());
        body.put("by_severity", bySeverity);
        body.put("statistics", statistics(summary.getStatistics()));
        body.put("anomalies", summary.getAnomalies());
        return body;
    }

    static Map<String, Object> statistics(AnomalyStatistics stats) {
        Map<String, Object> bySeverity = new LinkedHashMap<>();
        stats.getBySeverity().forEach((severity, count) -> bySeverity.put(severity.getLabel(), count));
        Map<String, Object> byType = new LinkedHashMap<>();
        stats.getByType().forEach((type, count) -> byType.put(type.getLabel(), count));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total", stats.getTotal());
        body.put("by_severity", bySeverity);
        body.put("by_type", byType);
        body.put("average_score", stats.getAverageScore());
        body.put("max_score", stats.getMaxScore());
        body.put("min_score", stats.getMinScore());
        body.put("frequency", stats.getFrequency().getLabel());
        body.put("top_metric", stats.getTopMetric());
        return body;
    }

    static Map<String, Object> error(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }

    /**
     * Current value of every meter, sorted by name.
     */
    static List<Map<String, Object>> meters(MeterRegistry registry) {
        List<Meter> meters = new ArrayList<>(registry.getMeters());
        meters.sort(Comparator.comparing((Meter m) -> m.getId().getName())
                .thenComparing(m -> m.getId().getTags().toString()));

        List<Map<String, Object>> out = new ArrayList<>(meters.size());
        for (Meter meter : meters) {
            Map<String, Object> tags = new LinkedHashMap<>();
            for (Tag tag : meter.getId().getTags()) {
                tags.put(tag.getKey(), tag.getValue());
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (Measurement m : meter.measure()) {
                values.put(m.getStatistic().getTagValueRepresentation(), m.getValue());
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", meter.getId().getName());
            entry.put("tags", tags);
            entry.put("values", values);
            out.add(entry);
        }
        return out;
    }
}
