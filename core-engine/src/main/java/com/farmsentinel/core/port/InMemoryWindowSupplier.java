package com.farmsentinel.core.port;

import com.farmsentinel.core.error.NoDataException;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory reading store acting as both {@link WindowSupplier}
 * and {@link FarmTopology}.
 *
 * <h3>Window period</h3>
 * <p>
 * A window of {@code days} covers the readings newer than
 * {@code latest - days}, where {@code latest} is the newest reading of that
 * room and metric. A later reading at the same timestamp replaces the earlier
 * one.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryWindowSupplier implements WindowSupplier, FarmTopology {

    private final Map<String, List<String>> roomsByFarm = new ConcurrentHashMap<>();
    private final Map<String, String> farmByRoom = new ConcurrentHashMap<>();
    private final Map<String, List<String>> metricsByRoom = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Instant, Double>> series = new ConcurrentHashMap<>();

    /**
     * Register a room so it appears in its farm even before any reading.
     *
     * @throws IllegalArgumentException if the room already belongs to another farm
     */
    public InMemoryWindowSupplier registerRoom(String farmId, String roomId) {
        Objects.requireNonNull(farmId, "farmId must not be null");
        Objects.requireNonNull(roomId, "roomId must not be null");
        String existing = farmByRoom.putIfAbsent(roomId, farmId);
        if (existing != null && !existing.equals(farmId)) {
            throw new IllegalArgumentException("Room " + roomId + " already belongs to farm " + existing);
        }
        if (existing == null) {
            roomsByFarm.computeIfAbsent(farmId, f -> new CopyOnWriteArrayList<>()).add(roomId);
        }
        return this;
    }

    public InMemoryWindowSupplier addReading(String farmId, String roomId, String metricName, Instant timestamp,
            double value) {
        registerRoom(farmId, roomId);
        Objects.requireNonNull(metricName, "metricName must not be null");
        SignalPoint point = new SignalPoint(timestamp, value);
        series.computeIfAbsent(seriesKey(roomId, metricName), k -> {
            metricsByRoom.computeIfAbsent(roomId, r -> new CopyOnWriteArrayList<>()).add(metricName);
            return new ConcurrentSkipListMap<>();
        }).put(point.getTimestamp(), point.getValue());
        return this;
    }

    @Override
    public SignalWindow fetchWindow(String roomId, String metricName, int days) {
        Objects.requireNonNull(roomId, "roomId must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got: " + days);
        }
        NavigableMap<Instant, Double> readings = series.get(seriesKey(roomId, metricName));
        if (readings == null || readings.isEmpty()) {
            throw new NoDataException("No " + metricName + " readings for room " + roomId);
        }

        Instant latest = readings.lastKey();
        Instant from = latest.minus(Duration.ofDays(days));
        List<SignalPoint> points = new ArrayList<>();
        readings.subMap(from, false, latest, true)
                .forEach((ts, v) -> points.add(new SignalPoint(ts, v)));

        return SignalWindow.builder()
                .roomId(roomId)
                .metricName(metricName)
                .days(days)
                .points(points)
                .build();
    }

    @Override
    public List<String> roomsOf(String farmId) {
        return List.copyOf(roomsByFarm.getOrDefault(farmId, List.of()));
    }

    @Override
    public Optional<String> farmOf(String roomId) {
        return Optional.ofNullable(farmByRoom.get(roomId));
    }

    @Override
    public List<String> metricsOf(String roomId) {
        return List.copyOf(metricsByRoom.getOrDefault(roomId, List.of()));
    }

    private static String seriesKey(String roomId, String metricName) {
        return roomId + '\u0000' + metricName;
    }
}
