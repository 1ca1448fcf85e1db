package com.farmsentinel.core.registry;

import com.farmsentinel.core.error.DetectionException;
import com.farmsentinel.core.error.FitFailureException;
import com.farmsentinel.core.model.SignalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of fitted detector sets per (room, metric), with time-based expiry.
 *
 * <h3>Reuse</h3>
 * <p>
 * A hit within the entry's TTL is returned as is, without checking whether the
 * window has changed since the fit. Callers that know the data changed call
 * {@link #invalidate(CacheKey)}.
 * </p>
 *
 * <h3>Coalescing</h3>
 * <p>
 * At most one fit per key runs at a time. The first caller on a missing or
 * expired key registers a pending future and fits on its own thread; callers
 * arriving meanwhile wait on that future and receive the same set or the same
 * exception. Keys never block each other. A fit is not cancelled when waiters
 * give up; its result still populates the cache.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * A set is stored only when every detector fitted or was skipped. On
 * {@link FitFailureException} the previous entry, if any, stays in place.
 * </p>
 *
 * <h3>Eviction</h3>
 * <p>
 * Every successful fit also sweeps out expired entries of other keys, so keys
 * that are never requested again do not accumulate. {@link #evictExpired()}
 * can be called directly as well.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private final DetectorSetFitter fitter;
    private final Clock clock;
    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<CacheKey, CompletableFuture<FittedDetectorSet>> inFlight = new ConcurrentHashMap<>();

    public DetectorRegistry(DetectorSetFitter fitter, Clock clock) {
        this.fitter = Objects.requireNonNull(fitter, "fitter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Return the cached set for {@code key}, fitting {@code window} on a miss or
     * after expiry.
     *
     * @throws FitFailureException if the fit this call joined failed
     */
    public FittedDetectorSet getOrFit(CacheKey key, SignalWindow window, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");

        Optional<FittedDetectorSet> cached = fresh(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<FittedDetectorSet> mine = new CompletableFuture<>();
        CompletableFuture<FittedDetectorSet> pending = inFlight.putIfAbsent(key, mine);
        if (pending != null) {
            LOG.debug("Joining in-flight fit for {}", key);
            return await(pending);
        }

        try {
            // another leader may have finished between the cache check and registration
            Optional<FittedDetectorSet> raced = fresh(key);
            if (raced.isPresent()) {
                mine.complete(raced.get());
                return raced.get();
            }

            FittedDetectorSet set = fitter.fit(key, window);
            Instant fittedAt = clock.instant();
            entries.put(key, new CacheEntry(key, set, fittedAt, ttl));
            LOG.debug("Cached fitted set for {} until {}", key, fittedAt.plus(ttl));
            mine.complete(set);
            evictExpired();
            return set;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * @return the entry for {@code key} if present and unexpired
     */
    public Optional<CacheEntry> peek(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Drop the entry for {@code key} so the next request refits.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean invalidate(CacheKey key) {
        boolean removed = entries.remove(key) != null;
        if (removed) {
            LOG.info("Invalidated fitted detectors for {}", key);
        }
        return removed;
    }

    /**
     * @return number of expired entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int evicted = Math.max(0, before - entries.size());
        if (evicted > 0) {
            LOG.debug("Evicted {} expired fitted set(s)", evicted);
        }
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<FittedDetectorSet> fresh(CacheKey key) {
        return peek(key).map(CacheEntry::getDetectors);
    }

    private static FittedDetectorSet await(CompletableFuture<FittedDetectorSet> pending) {
        try {
            return pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new DetectionException("Fit failed", cause);
        }
    }
}
