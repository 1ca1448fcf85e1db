package com.farmsentinel.core.port;

import com.farmsentinel.core.error.NotFoundException;
import com.farmsentinel.core.model.AnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link AnomalySink} held in a concurrent map, with sequential ids from 1.
 *
 * @since 1.0.0
 */
public class InMemoryAnomalySink implements AnomalySink {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAnomalySink.class);

    private final Map<Long, AnomalyRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryAnomalySink(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public long persist(AnomalyRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        long id = sequence.incrementAndGet();
        AnomalyRecord stored = record.toBuilder()
                .id(id)
                .createdAt(record.getCreatedAt() != null ? record.getCreatedAt() : clock.instant())
                .build();
        records.put(id, stored);
        LOG.debug("Persisted anomaly {}: {}", id, stored);
        return id;
    }

    @Override
    public Optional<AnomalyRecord> find(long anomalyId) {
        return Optional.ofNullable(records.get(anomalyId));
    }

    @Override
    public AnomalyRecord updateFeedback(long anomalyId, boolean isReal, String notes) {
        AnomalyRecord updated = records.computeIfPresent(anomalyId,
                (id, current) -> current.applyFeedback(isReal, notes, clock.instant()));
        if (updated == null) {
            throw new NotFoundException(anomalyId);
        }
        return updated;
    }

    /**
     * @return every stored record, ordered by id
     */
    public List<AnomalyRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(AnomalyRecord::getId))
                .toList();
    }

    public int size() {
        return records.size();
    }
}
