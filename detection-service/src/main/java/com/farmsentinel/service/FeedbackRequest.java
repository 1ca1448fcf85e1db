package com.farmsentinel.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /anomalies/feedback}.
 *
 * <pre>
 * {"anomaly_id": 17, "is_real": true, "notes": "heater fault"}
 * </pre>
 */
public class FeedbackRequest {

    @JsonProperty("anomaly_id")
    private Long anomalyId;

    @JsonProperty("is_real")
    private Boolean real;

    @JsonProperty("notes")
    private String notes;

    /**
     * @throws IllegalArgumentException if a required field is missing
     */
    void validate() {
        if (anomalyId == null) {
            throw new IllegalArgumentException("'anomaly_id' is required");
        }
        if (real == null) {
            throw new IllegalArgumentException("'is_real' is required");
        }
    }

    public Long getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(Long anomalyId) {
        this.anomalyId = anomalyId;
    }

    public Boolean getReal() {
        return real;
    }

    public void setReal(Boolean real) {
        this.real = real;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
