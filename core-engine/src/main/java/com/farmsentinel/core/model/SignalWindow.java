package com.farmsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of recent history for one (room, metric) pair.
 *
 * <p>
 * Points are ordered by strictly increasing timestamp. The sampling cadence is
 * either supplied by the producer or inferred as the median gap between
 * consecutive points.
 * </p>
 *
 * <h3>Features</h3>
 * <p>
 * {@link #features()} exposes the window as a row-per-point matrix. Windows
 * are univariate today, so every row has a single column; the multivariate
 * detectors are written against the matrix so additional columns need no
 * detector changes.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String roomId;
    private final String metricName;
    private final int days;
    private final Duration cadence;
    private final List<SignalPoint> points;

    private SignalWindow(Builder b) {
        this.roomId = Objects.requireNonNull(b.roomId, "roomId must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        if (b.days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got: " + b.days);
        }
        this.days = b.days;

        List<SignalPoint> copy = new ArrayList<>(b.points);
        for (int i = 1; i < copy.size(); i++) {
            Instant previous = copy.get(i - 1).getTimestamp();
            Instant current = copy.get(i).getTimestamp();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Window timestamps must be strictly increasing for " + roomId + "/" + metricName
                                + ": " + current + " does not follow " + previous);
            }
        }
        this.points = Collections.unmodifiableList(copy);
        this.cadence = b.cadence != null ? b.cadence : inferCadence(copy);
        if (cadence.isNegative() || cadence.isZero()) {
            throw new IllegalArgumentException("cadence must be positive, got: " + cadence);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRoomId() {
        return roomId;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return the number of days of history this window was requested for
     */
    public int getDays() {
        return days;
    }

    public Duration getCadence() {
        return cadence;
    }

    /**
     * @return unmodifiable, timestamp-ordered points
     */
    public List<SignalPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return a fresh array of the point values in window order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * @return a fresh row-per-point feature matrix
     */
    public double[][] features() {
        double[][] rows = new double[points.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[] { points.get(i).getValue() };
        }
        return rows;
    }

    /**
     * @return number of distinct values in the window
     */
    public long distinctValueCount() {
        return Arrays.stream(values()).distinct().count();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Duration inferCadence(List<SignalPoint> points) {
        if (points.size() < 2) {
            return Duration.ofDays(1);
        }
        long[] gaps = new long[points.size() - 1];
        for (int i = 1; i < points.size(); i++) {
            gaps[i - 1] = Duration.between(points.get(i - 1).getTimestamp(), points.get(i).getTimestamp()).toMillis();
        }
        Arrays.sort(gaps);
        return Duration.ofMillis(Math.max(1L, gaps[gaps.length / 2]));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SignalWindow}.
     *
     * <p>
     * {@link #build()} rejects out-of-order or duplicate timestamps.
     * </p>
     */
    public static class Builder {
        private String roomId;
        private String metricName;
        private int days = 30;
        private Duration cadence;
        private final List<SignalPoint> points = new ArrayList<>();

        public Builder roomId(String roomId) {
            this.roomId = roomId;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder days(int days) {
            this.days = days;
            return this;
        }

        public Builder cadence(Duration cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder point(Instant timestamp, double value) {
            this.points.add(new SignalPoint(timestamp, value));
            return this;
        }

        public Builder points(List<SignalPoint> points) {
            this.points.addAll(Objects.requireNonNull(points, "points must not be null"));
            return this;
        }

        public SignalWindow build() {
            return new SignalWindow(this);
        }
    }

    @Override
    public String toString() {
        return "SignalWindow{" +
                "roomId='" + roomId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", days=" + days +
                ", cadence=" + cadence +
                ", size=" + points.size() +
                '}';
    }
}
