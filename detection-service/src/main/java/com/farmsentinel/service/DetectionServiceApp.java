package com.farmsentinel.service;

import com.farmsentinel.core.config.EnsembleConfig;
import com.farmsentinel.core.config.EnsembleConfigLoader;
import com.farmsentinel.core.metrics.DetectionMetrics;
import com.farmsentinel.core.port.InMemoryAnomalySink;
import com.farmsentinel.core.port.InMemoryWindowSupplier;
import com.farmsentinel.core.service.AnomalyDetectionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for the farm anomaly detection service.
 *
 * <h3>Startup</h3>
 * <ol>
 * <li>Resolve {@link ServiceConfig} from the environment</li>
 * <li>Load and validate the ensemble configuration</li>
 * <li>Load sensor readings from {@code READINGS_PATH}, if set</li>
 * <li>Wire the detection service and start the HTTP server</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class DetectionServiceApp {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionServiceApp.class);

    private DetectionServiceApp() {
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting farm detection service with config: {}", config);

        EnsembleConfig ensembleConfig = EnsembleConfigLoader.load(config.getEnsembleConfigPath());
        LOG.info("Ensemble sensitivity {}, default window {} day(s)",
                ensembleConfig.getSensitivity(), ensembleConfig.getDefaultDays());

        // 2. Load readings
        ObjectMapper mapper = AnomalyJson.newObjectMapper();
        InMemoryWindowSupplier readings = new InMemoryWindowSupplier();
        if (!config.getReadingsPath().isBlank()) {
            new ReadingsFileLoader(mapper).loadFile(Path.of(config.getReadingsPath()), readings);
        } else {
            LOG.warn("READINGS_PATH not set; starting with no sensor data");
        }

        // 3. Wire service and start HTTP server with shutdown hook
        ExecutorService detectionPool = newDetectionPool(config.getDetectionThreads());
        AnomalyDetectionService service = AnomalyDetectionService.builder()
                .config(ensembleConfig)
                .windowSupplier(readings)
                .topology(readings)
                .sink(new InMemoryAnomalySink(Clock.systemUTC()))
                .metrics(DetectionMetrics.inMemory())
                .executor(detectionPool)
                .build();

        DetectionHttpServer server = new DetectionHttpServer(service, mapper, config.getMaxReturnedAnomalies(),
                config.getDetectionThreads());
        server.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            detectionPool.shutdown();
        }, "detection-shutdown"));
    }

    private static ExecutorService newDetectionPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "room-detection-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
