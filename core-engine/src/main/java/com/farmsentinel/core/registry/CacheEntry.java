package com.farmsentinel.core.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A fitted detector set and the period for which it may be reused.
 *
 * @since 1.0.0
 */
public final class CacheEntry {

    private final CacheKey key;
    private final FittedDetectorSet detectors;
    private final Instant fittedAt;
    private final Duration ttl;

    public CacheEntry(CacheKey key, FittedDetectorSet detectors, Instant fittedAt, Duration ttl) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.detectors = Objects.requireNonNull(detectors, "detectors must not be null");
        this.fittedAt = Objects.requireNonNull(fittedAt, "fittedAt must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    }

    /**
     * @return {@code true} once {@code now} is at or past {@code fittedAt + ttl}
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(fittedAt.plus(ttl));
    }

    public CacheKey getKey() {
        return key;
    }

    public FittedDetectorSet getDetectors() {
        return detectors;
    }

    public Instant getFittedAt() {
        return fittedAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    @Override
    public String toString() {
        return "CacheEntry{" + key + ", fittedAt=" + fittedAt + ", ttl=" + ttl + '}';
    }
}
