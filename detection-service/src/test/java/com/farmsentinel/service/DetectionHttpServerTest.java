package com.farmsentinel.service;

import com.farmsentinel.core.config.EnsembleConfigLoader;
import com.farmsentinel.core.port.InMemoryAnomalySink;
import com.farmsentinel.core.port.InMemoryWindowSupplier;
import com.farmsentinel.core.service.AnomalyDetectionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of {@link DetectionHttpServer} over a real socket.
 */
class DetectionHttpServerTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final ObjectMapper mapper = AnomalyJson.newObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private DetectionHttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        InMemoryWindowSupplier readings = new InMemoryWindowSupplier();
        for (int i = 0; i < 30; i++) {
            double value = 20.0 + ((i * 37) % 50) / 10.0;
            readings.addReading("farm-1", "room-a", "temperature", day(i), i == 15 ? 45.0 : value);
            readings.addReading("farm-1", "room-b", "temperature", day(i), value);
        }
        readings.addReading("farm-1", "room-c", "co2", day(0), 400);
        readings.addReading("farm-1", "room-c", "co2", day(1), 410);

        AnomalyDetectionService service = AnomalyDetectionService.builder()
                .config(EnsembleConfigLoader.fromClasspath(EnsembleConfigLoader.DEFAULT_RESOURCE))
                .windowSupplier(readings)
                .topology(readings)
                .sink(new InMemoryAnomalySink(Clock.systemUTC()))
                .build();

        server = new DetectionHttpServer(service, mapper, 20, 2);
        server.start(0);
        baseUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should answer health and readiness checks")
    void shouldServeHealth() throws Exception {
        assertThat(server.isRunning()).isTrue();
        assertThat(get("/health").body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should list room anomalies with labels and ISO timestamps")
    void shouldDetectRoom() throws Exception {
        HttpResponse<String> response = get("/anomalies/room/room-a?days=30&sensitivity=0.8");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("count").asInt()).isEqualTo(1);
        assertThat(body.get("period_days").asInt()).isEqualTo(30);
        JsonNode anomaly = body.get("anomalies").get(0);
        assertThat(anomaly.get("severity").asText()).isEqualTo("high");
        assertThat(anomaly.get("confirmationState").asText()).isEqualTo("detected");
        assertThat(anomaly.get("timestamp").asText()).isEqualTo("2024-03-16T00:00:00Z");
        assertThat(anomaly.get("factors").get(0).get("detector").asText()).isNotBlank();
    }

    @Test
    @DisplayName("Should summarize a farm with label-keyed severities")
    void shouldDetectFarm() throws Exception {
        JsonNode body = mapper.readTree(get("/anomalies/farm/farm-1?days=30").body());

        assertThat(body.get("total_anomalies").asInt()).isEqualTo(1);
        assertThat(body.get("by_severity").get("high").asInt()).isEqualTo(1);
        assertThat(body.get("by_room").get("room-a").asInt()).isEqualTo(1);
        assertThat(body.get("by_room").get("room-b").asInt()).isZero();
        assertThat(body.get("by_room").get("room-c").asInt()).isZero();
        assertThat(body.get("statistics").get("top_metric").asText()).isEqualTo("temperature");

        JsonNode filtered = mapper.readTree(get("/anomalies/farm/farm-1?days=30&severity=low").body());
        assertThat(filtered.get("total_anomalies").asInt()).isZero();
    }

    @Test
    @DisplayName("Should record feedback and return the updated anomaly")
    void shouldRecordFeedback() throws Exception {
        JsonNode room = mapper.readTree(get("/anomalies/room/room-a?days=30").body());
        long id = room.get("anomalies").get(0).get("id").asLong();

        HttpResponse<String> response = post("/anomalies/feedback",
                "{\"anomaly_id\":" + id + ",\"is_real\":true,\"notes\":\"heater fault\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode updated = mapper.readTree(response.body());
        assertThat(updated.get("confirmationState").asText()).isEqualTo("confirmed");
        assertThat(updated.get("feedbackNotes").asText()).isEqualTo("heater fault");

        JsonNode fetched = mapper.readTree(get("/anomalies/" + id).body());
        assertThat(fetched.get("confirmationState").asText()).isEqualTo("confirmed");
    }

    @Test
    @DisplayName("Should map failures to status codes with an error body")
    void shouldMapErrors() throws Exception {
        HttpResponse<String> unknown = get("/anomalies/9999");
        assertThat(unknown.statusCode()).isEqualTo(404);
        assertThat(mapper.readTree(unknown.body()).get("error").asText()).isEqualTo("not_found");

        assertThat(get("/anomalies/room/room-x").statusCode()).isEqualTo(404);
        assertThat(get("/anomalies/room/room-a?days=abc").statusCode()).isEqualTo(400);
        assertThat(get("/anomalies/room/room-a?days=365").statusCode()).isEqualTo(400);
        assertThat(get("/anomalies/farm/farm-1?severity=critical").statusCode()).isEqualTo(400);
        assertThat(get("/anomalies/room/room-c?days=30").statusCode()).isEqualTo(422);
        assertThat(post("/anomalies/feedback", "{\"is_real\":true}").statusCode()).isEqualTo(400);
        assertThat(post("/anomalies/feedback", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/anomalies/feedback", "{\"anomaly_id\":9999,\"is_real\":false}").statusCode())
                .isEqualTo(404);
        assertThat(post("/anomalies/room/room-a", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should expose detection counters on /metrics")
    void shouldServeMetrics() throws Exception {
        get("/anomalies/room/room-a?days=30");

        JsonNode meters = mapper.readTree(get("/metrics").body());

        boolean found = false;
        for (JsonNode meter : meters) {
            if ("detection_requests_total".equals(meter.get("name").asText())) {
                assertThat(meter.get("values").get("count").asDouble()).isEqualTo(1.0);
                found = true;
            }
        }
        assertThat(found).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static Instant day(int i) {
        return START.plus(Duration.ofDays(i));
    }
}
