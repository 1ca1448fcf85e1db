package com.farmsentinel.core.service;

import com.farmsentinel.core.config.EnsembleConfig;
import com.farmsentinel.core.detection.Detector;
import com.farmsentinel.core.detection.DetectorFactory;
import com.farmsentinel.core.ensemble.EnsembleCoordinator;
import com.farmsentinel.core.ensemble.SeverityClassifier;
import com.farmsentinel.core.error.AllDetectorsFailedException;
import com.farmsentinel.core.error.DetectionException;
import com.farmsentinel.core.error.NoDataException;
import com.farmsentinel.core.explain.Explainer;
import com.farmsentinel.core.feedback.FeedbackRecorder;
import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.EnsembleScore;
import com.farmsentinel.core.model.Severity;
import com.farmsentinel.core.model.SignalWindow;
import com.farmsentinel.core.port.AnomalySink;
import com.farmsentinel.core.port.FarmTopology;
import com.farmsentinel.core.port.WindowSupplier;
import com.farmsentinel.core.registry.DetectorRegistry;
import com.farmsentinel.core.registry.EnsembleFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Room and farm level anomaly detection.
 *
 * <h3>Room detection</h3>
 * <p>
 * Every metric of the room is fetched, scored point by point by the ensemble,
 * and points above the sensitivity become persisted anomaly records. A metric
 * with fewer than five readings in the period, or one no detector can score,
 * is logged and skipped; if that leaves the room with no
 * scored metric the failure is surfaced. Results are cached per (room, days,
 * sensitivity); a cached result is returned without detecting or persisting
 * again, with each record's feedback state read back from the sink.
 * </p>
 *
 * <h3>Farm detection</h3>
 * <p>
 * Rooms are detected in parallel on the supplied executor with the default
 * sensitivity. A room whose data is missing counts as having no anomalies.
 * The optional severity filter is applied before anything is counted.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}, which wires detectors, registry, coordinator and
 * caches from an {@link EnsembleConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionService {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final int MIN_METRIC_READINGS = 5;

    private final EnsembleConfig config;
    private final WindowSupplier windowSupplier;
    private final FarmTopology topology;
    private final AnomalySink sink;
    private final EnsembleCoordinator coordinator;
    private final DetectionResultCache resultCache;
    private final FeedbackRecorder feedbackRecorder;
    private final DetectionMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    private AnomalyDetectionService(Builder b, EnsembleCoordinator coordinator) {
        this.config = b.config;
        this.windowSupplier = b.windowSupplier;
        this.topology = b.topology;
        this.sink = b.sink;
        this.metrics = b.metrics;
        this.executor = b.executor;
        this.clock = b.clock;
        this.coordinator = coordinator;
        this.resultCache = new DetectionResultCache(config.getResultCacheSize(), config.resultCacheTtl(), metrics);
        this.feedbackRecorder = new FeedbackRecorder(sink);
    }

    // ---------------------------------------------------------------
    // Room
    // ---------------------------------------------------------------

    public List<AnomalyRecord> detectRoom(String roomId) {
        return detectRoom(roomId, config.getDefaultDays(), config.getSensitivity());
    }

    /**
     * @return persisted anomaly records, highest score first
     * @throws NoDataException             if the room has no readings
     * @throws AllDetectorsFailedException if no metric of the room could be scored
     * @throws IllegalArgumentException    if {@code days} or {@code sensitivity}
     *                                     is out of range
     */
    public List<AnomalyRecord> detectRoom(String roomId, int days, double sensitivity) {
        Objects.requireNonNull(roomId, "roomId must not be null");
        checkDays(days);
        if (!(sensitivity >= 0.0 && sensitivity <= 1.0)) {
            throw new IllegalArgumentException("sensitivity must be in [0, 1], got: " + sensitivity);
        }
        List<AnomalyRecord> cached = resultCache.get(roomId, days, sensitivity,
                () -> runRoomDetection(roomId, days, sensitivity));
        return withCurrentFeedback(cached);
    }

    /**
     * Swap cached records for their stored versions so feedback given after
     * detection is visible.
     */
    private List<AnomalyRecord> withCurrentFeedback(List<AnomalyRecord> records) {
        List<AnomalyRecord> current = new ArrayList<>(records.size());
        for (AnomalyRecord record : records) {
            current.add(sink.find(record.getId()).orElse(record));
        }
        return current;
    }

    private List<AnomalyRecord> runRoomDetection(String roomId, int days, double sensitivity) {
        List<String> metricNames = topology.metricsOf(roomId);
        if (metricNames.isEmpty()) {
            throw new NoDataException("No readings for room " + roomId);
        }
        metrics.incrementDetectionRequests();
        long started = clock.millis();
        String farmId = topology.farmOf(roomId).orElse(null);

        List<AnomalyRecord> flagged = new ArrayList<>();
        AllDetectorsFailedException lastFailure = null;
        int scoredMetrics = 0;
        for (String metricName : metricNames) {
            SignalWindow window = windowSupplier.fetchWindow(roomId, metricName, days);
            if (window.size() < MIN_METRIC_READINGS) {
                LOG.warn("Skipping {} in room {}: {} reading(s), needs at least {}",
                        metricName, roomId, window.size(), MIN_METRIC_READINGS);
                lastFailure = tooFewReadings(roomId, metricName, window.size());
                continue;
            }
            List<EnsembleScore> scores;
            try {
                scores = coordinator.detect(window, window.getPoints());
            } catch (AllDetectorsFailedException e) {
                LOG.warn("No detector could score {} in room {}: {}", metricName, roomId, e.getReasons());
                lastFailure = e;
                continue;
            }
            scoredMetrics++;
            flagged.addAll(coordinator.flag(scores, farmId, sensitivity));
        }
        if (scoredMetrics == 0) {
            throw lastFailure;
        }

        List<AnomalyRecord> persisted = new ArrayList<>(flagged.size());
        for (AnomalyRecord record : flagged) {
            persisted.add(record.withId(sink.persist(record)));
        }
        persisted.sort(Comparator.comparingDouble(AnomalyRecord::getCombinedScore).reversed());

        metrics.incrementAnomaliesDetected(persisted.size());
        metrics.recordLatency(Duration.ofMillis(clock.millis() - started));
        LOG.info("Room {}: {} anomal(y/ies) over {} day(s) across {} metric(s) at sensitivity {}",
                roomId, persisted.size(), days, scoredMetrics, sensitivity);
        return persisted;
    }

    private static AllDetectorsFailedException tooFewReadings(String roomId, String metricName, int size) {
        Map<DetectorKind, String> reasons = new EnumMap<>(DetectorKind.class);
        for (DetectorKind kind : DetectorKind.values()) {
            reasons.put(kind, "metric has " + size + " reading(s), needs at least " + MIN_METRIC_READINGS);
        }
        return new AllDetectorsFailedException(roomId, metricName, reasons);
    }

    // ---------------------------------------------------------------
    // Farm
    // ---------------------------------------------------------------

    /**
     * @param severityFilter keep only anomalies of this tier, when present
     * @throws NoDataException if the farm has no rooms
     */
    public FarmAnomalySummary detectFarm(String farmId, int days, Optional<Severity> severityFilter) {
        Objects.requireNonNull(farmId, "farmId must not be null");
        Objects.requireNonNull(severityFilter, "severityFilter must not be null");
        checkDays(days);
        List<String> rooms = topology.roomsOf(farmId);
        if (rooms.isEmpty()) {
            throw new NoDataException("No rooms for farm " + farmId);
        }

        double sensitivity = config.getSensitivity();
        List<CompletableFuture<List<AnomalyRecord>>> pending = new ArrayList<>(rooms.size());
        for (String roomId : rooms) {
            pending.add(CompletableFuture.supplyAsync(() -> detectRoomOrEmpty(roomId, days, sensitivity), executor));
        }

        Map<String, Integer> byRoom = new LinkedHashMap<>();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < rooms.size(); i++) {
            List<AnomalyRecord> roomAnomalies = join(pending.get(i)).stream()
                    .filter(r -> severityFilter.map(s -> s == r.getSeverity()).orElse(true))
                    .toList();
            byRoom.put(rooms.get(i), roomAnomalies.size());
            anomalies.addAll(roomAnomalies);
        }
        anomalies.sort(Comparator.comparingDouble(AnomalyRecord::getCombinedScore).reversed());

        FarmAnomalySummary summary = new FarmAnomalySummary(farmId, days, anomalies, byRoom);
        LOG.info("Farm {}: {}", farmId, summary);
        return summary;
    }

    private List<AnomalyRecord> detectRoomOrEmpty(String roomId, int days, double sensitivity) {
        try {
            return detectRoom(roomId, days, sensitivity);
        } catch (NoDataException | AllDetectorsFailedException e) {
            LOG.warn("Room {} skipped in farm detection: {}", roomId, e.getMessage());
            return List.of();
        }
    }

    private static List<AnomalyRecord> join(CompletableFuture<List<AnomalyRecord>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new DetectionException("Room detection failed", e.getCause());
        }
    }

    // ---------------------------------------------------------------
    // Feedback and lookup
    // ---------------------------------------------------------------

    public AnomalyRecord recordFeedback(long anomalyId, boolean isReal, String notes) {
        return feedbackRecorder.recordFeedback(anomalyId, isReal, notes);
    }

    public AnomalyRecord findAnomaly(long anomalyId) {
        return feedbackRecorder.find(anomalyId);
    }

    public EnsembleCoordinator getCoordinator() {
        return coordinator;
    }

    public EnsembleConfig getConfig() {
        return config;
    }

    public DetectionMetrics getMetrics() {
        return metrics;
    }

    private void checkDays(int days) {
        if (days < 1 || days > config.getMaxDays()) {
            throw new IllegalArgumentException("days must be in [1, " + config.getMaxDays() + "], got: " + days);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wires a service from configuration and collaborators. {@code config},
     * {@code windowSupplier}, {@code topology} and {@code sink} are required.
     */
    public static class Builder {
        private EnsembleConfig config;
        private WindowSupplier windowSupplier;
        private FarmTopology topology;
        private AnomalySink sink;
        private DetectionMetrics metrics;
        private Executor executor = Runnable::run;
        private Clock clock = Clock.systemUTC();

        public Builder config(EnsembleConfig config) {
            this.config = config;
            return this;
        }

        public Builder windowSupplier(WindowSupplier windowSupplier) {
            this.windowSupplier = windowSupplier;
            return this;
        }

        public Builder topology(FarmTopology topology) {
            this.topology = topology;
            return this;
        }

        public Builder sink(AnomalySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder metrics(DetectionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Executor for farm fan-out; defaults to the calling thread.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws IllegalStateException if the configuration is invalid
         */
        public AnomalyDetectionService build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(windowSupplier, "windowSupplier must not be null");
            Objects.requireNonNull(topology, "topology must not be null");
            Objects.requireNonNull(sink, "sink must not be null");
            Objects.requireNonNull(executor, "executor must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            config.validate();
            if (metrics == null) {
                metrics = DetectionMetrics.inMemory();
            }

            List<Detector<?>> detectors = DetectorFactory.createAll(config.getDetectors());
            DetectorRegistry registry = new DetectorRegistry(new EnsembleFitter(detectors, metrics), clock);
            EnsembleCoordinator coordinator = new EnsembleCoordinator(detectors, registry,
                    new SeverityClassifier(config.getSeverity()), new Explainer(),
                    config.getWeights().toEnsembleWeights(), config.cacheTtl(), metrics, clock);
            return new AnomalyDetectionService(this, coordinator);
        }
    }
}
