package com.farmsentinel.core.registry;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of a fitted detector set: one metric of one room.
 *
 * @since 1.0.0
 */
public final class CacheKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String roomId;
    private final String metricName;

    public CacheKey(String roomId, String metricName) {
        this.roomId = Objects.requireNonNull(roomId, "roomId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
    }

    public static CacheKey of(String roomId, String metricName) {
        return new CacheKey(roomId, metricName);
    }

    public String getRoomId() {
        return roomId;
    }

    public String getMetricName() {
        return metricName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CacheKey that))
            return false;
        return roomId.equals(that.roomId) && metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roomId, metricName);
    }

    @Override
    public String toString() {
        return roomId + "/" + metricName;
    }
}
