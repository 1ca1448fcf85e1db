package com.farmsentinel.core.service;

import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.AnomalyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionResultCache}.
 */
class DetectionResultCacheTest {

    private final DetectionMetrics metrics = DetectionMetrics.inMemory();
    private final DetectionResultCache cache = new DetectionResultCache(100, Duration.ofMinutes(10), metrics);
    private final AtomicInteger runs = new AtomicInteger();

    @Test
    @DisplayName("Should run detection once per room, window and sensitivity")
    void shouldCacheByRequest() {
        cache.get("room-a", 7, 0.8, this::detect);
        cache.get("room-a", 7, 0.8, this::detect);
        cache.get("room-a", 14, 0.8, this::detect);
        cache.get("room-a", 7, 0.7, this::detect);

        assertThat(runs).hasValue(3);
        assertThat(cache.estimatedSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should publish cache statistics to the meter registry")
    void shouldExposeCacheMetrics() {
        cache.get("room-a", 7, 0.8, this::detect);
        cache.get("room-a", 7, 0.8, this::detect);

        assertThat(metrics.getRegistry().find("cache.gets").tag("cache", "detection_results")
                .tag("result", "hit").functionCounter().count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<AnomalyRecord> detect() {
        runs.incrementAndGet();
        return List.of();
    }
}
