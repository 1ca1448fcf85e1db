package com.farmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single time-stamped metric observation.
 *
 * @since 1.0.0
 */
public final class SignalPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp observation time; must not be {@code null}
     * @param value     observed value; must be finite
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public SignalPoint(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite, got: " + value + " at " + timestamp);
        }
        this.value = value;
    }

    public static SignalPoint of(Instant timestamp, double value) {
        return new SignalPoint(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "SignalPoint{" + timestamp + "=" + value + '}';
    }
}
