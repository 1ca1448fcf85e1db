package com.farmsentinel.core.metrics;

import com.farmsentinel.core.model.DetectorKind;
import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer meters for the detection pipeline.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code detection_requests_total}: room detections actually run (cache
 * hits excluded)</li>
 * <li>{@code anomalies_detected_total}: anomaly records created</li>
 * <li>{@code detector_fits_total}: successful fits, tagged by detector</li>
 * <li>{@code detector_fit_failures_total}: unexpected fit or scoring errors,
 * tagged by detector</li>
 * <li>{@code detector_skipped_total}: fits refused for insufficient data,
 * tagged by detector</li>
 * <li>{@code detection_latency}: timer around one room detection</li>
 * </ul>
 * <p>
 * The reporting backend is chosen by whoever owns the {@link MeterRegistry}.
 * </p>
 */
public class DetectionMetrics {

    static final String DETECTOR_TAG = "detector";

    private final MeterRegistry registry;
    private final Counter detectionRequests;
    private final Counter anomaliesDetected;
    private final Timer detectionLatency;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.detectionRequests = Counter.builder("detection_requests_total")
                .description("Room detections executed")
                .register(registry);
        this.anomaliesDetected = Counter.builder("anomalies_detected_total")
                .description("Anomaly records created")
                .register(registry);
        this.detectionLatency = Timer.builder("detection_latency")
                .description("Latency of a single room detection")
                .register(registry);
    }

    /**
     * @return metrics backed by a private in-memory registry
     */
    public static DetectionMetrics inMemory() {
        return new DetectionMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void incrementDetectionRequests() {
        detectionRequests.increment();
    }

    public void incrementAnomaliesDetected(int count) {
        anomaliesDetected.increment(count);
    }

    public void recordDetectorFit(DetectorKind kind) {
        detectorCounter("detector_fits_total", kind).increment();
    }

    public void recordDetectorFailure(DetectorKind kind) {
        detectorCounter("detector_fit_failures_total", kind).increment();
    }

    public void recordDetectorSkipped(DetectorKind kind) {
        detectorCounter("detector_skipped_total", kind).increment();
    }

    public void recordLatency(Duration duration) {
        detectionLatency.record(duration);
    }

    /**
     * Bind hit, miss, eviction and size statistics of a Caffeine cache built
     * with {@code recordStats()}.
     */
    public <K, V> Cache<K, V> monitor(Cache<K, V> cache, String cacheName) {
        return CaffeineCacheMetrics.monitor(registry, cache, cacheName);
    }

    private Counter detectorCounter(String name, DetectorKind kind) {
        return Counter.builder(name)
                .tag(DETECTOR_TAG, kind.getLabel())
                .register(registry);
    }
}
