package com.farmsentinel.core.service;

import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.AnomalyRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded cache of room detection results, separate from the fitted-model
 * registry.
 *
 * <p>
 * Entries expire on TTL alone and are keyed by (room, days, sensitivity).
 * Concurrent requests for the same key compute once. Cached records are a
 * snapshot taken at detection time; feedback given later lives in the
 * anomaly sink.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionResultCache {

    static final String CACHE_NAME = "detection_results";

    private final Cache<Key, List<AnomalyRecord>> cache;

    public DetectionResultCache(long maximumSize, Duration ttl, DetectionMetrics metrics) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        this.cache = metrics.monitor(Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .<Key, List<AnomalyRecord>>build(), CACHE_NAME);
    }

    /**
     * @return the cached result, or the result of {@code detection} stored for later calls
     */
    public List<AnomalyRecord> get(String roomId, int days, double sensitivity, Supplier<List<AnomalyRecord>> detection) {
        return cache.get(new Key(roomId, days, sensitivity), key -> List.copyOf(detection.get()));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private static final class Key {
        private final String roomId;
        private final int days;
        private final double sensitivity;

        private Key(String roomId, int days, double sensitivity) {
            this.roomId = roomId;
            this.days = days;
            this.sensitivity = sensitivity;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Key that))
                return false;
            return days == that.days && Double.compare(sensitivity, that.sensitivity) == 0
                    && roomId.equals(that.roomId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(roomId, days, sensitivity);
        }
    }
}
