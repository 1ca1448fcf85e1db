package com.farmsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Lower bounds of the medium and high severity tiers.
 *
 * @since 1.0.0
 */
public class SeverityThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    private double medium = 0.5;
    private double high = 0.8;

    public SeverityThresholds() {
    }

    public SeverityThresholds(double medium, double high) {
        this.medium = medium;
        this.high = high;
    }

    void collectErrors(List<String> errors) {
        if (!(medium > 0.0 && medium < high && high <= 1.0)) {
            errors.add("severity thresholds must satisfy 0 < medium < high <= 1, got: medium="
                    + medium + ", high=" + high);
        }
    }

    // ------- Getters / Setters -------

    public double getMedium() {
        return medium;
    }

    public void setMedium(double medium) {
        this.medium = medium;
    }

    public double getHigh() {
        return high;
    }

    public void setHigh(double high) {
        this.high = high;
    }

    @Override
    public String toString() {
        return "SeverityThresholds{medium=" + medium + ", high=" + high + '}';
    }
}
