package com.farmsentinel.service;

import com.farmsentinel.core.error.AllDetectorsFailedException;
import com.farmsentinel.core.error.NoDataException;
import com.farmsentinel.core.error.NotFoundException;
import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.Severity;
import com.farmsentinel.core.service.AnomalyDetectionService;
import com.farmsentinel.core.service.FarmAnomalySummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end of the detection service.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness}: {@code {"status":"UP"}}</li>
 * <li>{@code GET /metrics}: current meter values as JSON</li>
 * <li>{@code GET /anomalies/room/{roomId}?days=&sensitivity=}</li>
 * <li>{@code GET /anomalies/farm/{farmId}?days=&severity=}</li>
 * <li>{@code GET /anomalies/{id}}</li>
 * <li>{@code POST /anomalies/feedback}</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * <p>
 * Failures are returned as {@code {"error": ..., "message": ...}} with
 * 404 for unknown anomalies and rooms without data, 400 for malformed input,
 * 422 when no detector could score any metric and 500 otherwise.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionHttpServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final AnomalyDetectionService service;
    private final ObjectMapper mapper;
    private final int maxReturnedAnomalies;
    private final int workerThreads;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DetectionHttpServer(AnomalyDetectionService service, ObjectMapper mapper, int maxReturnedAnomalies,
            int workerThreads) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        if (maxReturnedAnomalies < 1) {
            throw new IllegalArgumentException("maxReturnedAnomalies must be >= 1");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        this.maxReturnedAnomalies = maxReturnedAnomalies;
        this.workerThreads = workerThreads;
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; 0 picks an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", DetectionHttpServer::handleHealthCheck);
            server.createContext("/readiness", DetectionHttpServer::handleHealthCheck);
            server.createContext("/metrics", this::handleMetrics);
            server.createContext("/anomalies", this::handleAnomalies);

            AtomicInteger counter = new AtomicInteger();
            executor = Executors.newFixedThreadPool(workerThreads, r -> {
                Thread t = new Thread(r, "detection-http-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Detection HTTP server started on port {}", getPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start HTTP server on port " + port, e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Detection HTTP server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful when started on port 0
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server has not been started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        writeJson(exchange, 200, AnomalyJson.meters(service.getMetrics().getRegistry()));
    }

    private void handleAnomalies(HttpExchange exchange) throws IOException {
        try {
            writeJson(exchange, 200, route(exchange));
        } catch (NotFoundException | NoDataException | RouteNotFoundException e) {
            writeJson(exchange, 404, AnomalyJson.error("not_found", e.getMessage()));
        } catch (AllDetectorsFailedException e) {
            writeJson(exchange, 422, AnomalyJson.error("detection_failed", e.getMessage()));
        } catch (JsonProcessingException e) {
            writeJson(exchange, 400, AnomalyJson.error("bad_request", "Malformed JSON body: " + e.getOriginalMessage()));
        } catch (IllegalArgumentException e) {
            writeJson(exchange, 400, AnomalyJson.error("bad_request", e.getMessage()));
        } catch (MethodNotAllowedException e) {
            writeJson(exchange, 405, AnomalyJson.error("method_not_allowed", e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            writeJson(exchange, 500, AnomalyJson.error("internal_error", e.getMessage()));
        }
    }

    private Object route(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String[] segments = exchange.getRequestURI().getPath().replaceAll("^/+|/+$", "").split("/");
        Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());

        // segments[0] is "anomalies"
        if (segments.length == 2 && "feedback".equals(segments[1])) {
            requireMethod(method, "POST");
            return feedback(exchange.getRequestBody());
        }
        if (segments.length == 3 && "room".equals(segments[1])) {
            requireMethod(method, "GET");
            return room(decode(segments[2]), query);
        }
        if (segments.length == 3 && "farm".equals(segments[1])) {
            requireMethod(method, "GET");
            return farm(decode(segments[2]), query);
        }
        if (segments.length == 2) {
            requireMethod(method, "GET");
            return service.findAnomaly(parseLong("id", segments[1]));
        }
        throw new RouteNotFoundException("No route for " + exchange.getRequestURI().getPath());
    }

    private Object room(String roomId, Map<String, String> query) {
        int days = query.containsKey("days")
                ? parseInt("days", query.get("days"))
                : service.getConfig().getDefaultDays();
        double sensitivity = query.containsKey("sensitivity")
                ? parseDouble("sensitivity", query.get("sensitivity"))
                : service.getConfig().getSensitivity();
        List<AnomalyRecord> anomalies = service.detectRoom(roomId, days, sensitivity);
        return AnomalyJson.roomResponse(roomId, days, sensitivity, anomalies, maxReturnedAnomalies);
    }

    private Object farm(String farmId, Map<String, String> query) {
        int days = query.containsKey("days")
                ? parseInt("days", query.get("days"))
                : service.getConfig().getDefaultDays();
        Optional<Severity> severity = Optional.ofNullable(query.get("severity")).map(Severity::fromLabel);
        FarmAnomalySummary summary = service.detectFarm(farmId, days, severity);
        return AnomalyJson.farmResponse(summary);
    }

    private Object feedback(InputStream body) throws IOException {
        FeedbackRequest request = mapper.readValue(body, FeedbackRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        request.validate();
        return service.recordFeedback(request.getAnomalyId(), request.getReal(), request.getNotes());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void requireMethod(String actual, String expected) {
        if (!expected.equalsIgnoreCase(actual)) {
            throw new MethodNotAllowedException("Expected " + expected + " but got " + actual);
        }
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            }
        }
        return params;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + name + "' must be an integer, got: " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + name + "' must be an integer, got: " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + name + "' must be a number, got: " + value, e);
        }
    }

    private static final class RouteNotFoundException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        RouteNotFoundException(String message) {
            super(message);
        }
    }

    private static final class MethodNotAllowedException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        MethodNotAllowedException(String message) {
            super(message);
        }
    }
}
