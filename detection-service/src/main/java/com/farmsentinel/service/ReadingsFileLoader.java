package com.farmsentinel.service;

import com.farmsentinel.core.port.InMemoryWindowSupplier;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a JSON array of sensor readings into an {@link InMemoryWindowSupplier}.
 *
 * <pre>
 * [
 *   {"farmId": "farm-1", "roomId": "room-a", "metric": "temperature",
 *    "timestamp": "2024-03-01T00:00:00Z", "value": 21.4}
 * ]
 * </pre>
 *
 * <p>
 * Invalid rows are rejected together, listing every bad row index.
 * </p>
 */
public final class ReadingsFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ReadingsFileLoader.class);

    private final ObjectMapper mapper;

    public ReadingsFileLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @throws IllegalArgumentException if the file does not exist or a row is invalid
     * @throws IllegalStateException    if the file cannot be read or parsed
     */
    public int loadFile(Path path, InMemoryWindowSupplier target) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Readings file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            int loaded = load(is, target);
            LOG.info("Loaded {} reading(s) from {}", loaded, path);
            return loaded;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read readings file: " + path, e);
        }
    }

    /**
     * @return number of readings loaded
     */
    public int load(InputStream is, InMemoryWindowSupplier target) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        List<Reading> readings = mapper.readValue(is, new TypeReference<List<Reading>>() {
        });
        if (readings == null) {
            return 0;
        }

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < readings.size(); i++) {
            Reading r = readings.get(i);
            if (r == null || isBlank(r.getFarmId()) || isBlank(r.getRoomId()) || isBlank(r.getMetric())
                    || r.getTimestamp() == null || r.getValue() == null || !Double.isFinite(r.getValue())) {
                errors.add("row " + i);
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid readings (farmId, roomId, metric, timestamp and finite value "
                    + "are required): " + String.join(", ", errors));
        }

        for (Reading r : readings) {
            target.addReading(r.getFarmId(), r.getRoomId(), r.getMetric(), r.getTimestamp(), r.getValue());
        }
        return readings.size();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * One row of the readings file.
     */
    public static class Reading {
        private String farmId;
        private String roomId;
        private String metric;
        private Instant timestamp;
        private Double value;

        public String getFarmId() {
            return farmId;
        }

        public void setFarmId(String farmId) {
            this.farmId = farmId;
        }

        public String getRoomId() {
            return roomId;
        }

        public void setRoomId(String roomId) {
            this.roomId = roomId;
        }

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(Instant timestamp) {
            this.timestamp = timestamp;
        }

        public Double getValue() {
            return value;
        }

        public void setValue(Double value) {
            this.value = value;
        }
    }
}
