package com.funnel.insights.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnel.insights.config.MetricsConfig;
import com.funnel.insights.exception.CacheUnavailableException;
import com.funnel.insights.model.CacheEntry;
import com.funnel.insights.model.CacheKeyInputs;
import com.funnel.insights.model.CacheLookup;
import com.funnel.insights.model.CacheOutcome;
import com.funnel.insights.model.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizes analysis results by input fingerprint for a fixed TTL.
 *
 * <p>Single-flight: for one fingerprint at most one computation runs at a time.
 * Concurrent callers that miss while a computation is in flight wait for it
 * and share its result instead of computing again.
 *
 * <p>Expiry is wall-clock TTL measured from {@code computedAt}, checked lazily on
 * lookup. {@link #evictExpired()} removes stale entries in bulk. Both only remove
 * the exact entry they read, never one stored after it.
 *
 * <p>If the store is unreachable the value is computed directly and reported
 * as {@link CacheOutcome#BYPASS}.
 */
public class FingerprintCache {

    private static final Logger log = LoggerFactory.getLogger(FingerprintCache.class);

    private final CacheStore store;
    private final FingerprintGenerator fingerprintGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final MetricsConfig metricsConfig;

    private final Map<String, CompletableFuture<CacheLookup<?>>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong bypasses = new AtomicLong();

    public FingerprintCache(CacheStore store, FingerprintGenerator fingerprintGenerator, ObjectMapper objectMapper,
                            Clock clock, Duration ttl, MetricsConfig metricsConfig) {
        this.store = store;
        this.fingerprintGenerator = fingerprintGenerator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = ttl;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Returns the live cached value for {@code keyInputs}, or runs {@code compute}
     * exactly once, stores its result and returns it.
     *
     * @param type    concrete type of the cached value, used to deserialize stored entries
     * @param compute invoked at most once per fingerprint within the TTL window
     */
    public <T> CacheLookup<T> getOrCompute(CacheKeyInputs keyInputs, Class<T> type, Supplier<T> compute) {
        String fingerprint = fingerprintGenerator.fingerprint(keyInputs);

        Optional<T> cached;
        try {
            cached = readLive(fingerprint, type);
        } catch (CacheUnavailableException e) {
            return bypass(fingerprint, compute, e);
        }
        if (cached.isPresent()) {
            return hit(fingerprint, cached.get());
        }

        CompletableFuture<CacheLookup<?>> flight = new CompletableFuture<>();
        CompletableFuture<CacheLookup<?>> existing = inFlight.putIfAbsent(fingerprint, flight);
        if (existing != null) {
            log.debug("Joining in-flight computation for {}", abbreviate(fingerprint));
            return joined(fingerprint, type, await(existing));
        }

        try {
            // A previous leader may have stored its result between our read and registration
            Optional<T> stored = readLive(fingerprint, type);
            if (stored.isPresent()) {
                CacheLookup<T> result = hit(fingerprint, stored.get());
                flight.complete(result);
                return result;
            }

            T value = storeComputed(fingerprint, type, compute.get());

            misses.incrementAndGet();
            metricsConfig.recordCacheLookup(CacheOutcome.MISS);
            log.debug("Cache miss: {}... computed and stored", abbreviate(fingerprint));
            CacheLookup<T> result = new CacheLookup<>(value, CacheOutcome.MISS, fingerprint);
            flight.complete(result);
            return result;
        } catch (CacheUnavailableException e) {
            try {
                CacheLookup<T> result = bypass(fingerprint, compute, e);
                flight.complete(result);
                return result;
            } catch (RuntimeException computeFailure) {
                flight.completeExceptionally(computeFailure);
                throw computeFailure;
            }
        } catch (RuntimeException e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, flight);
        }
    }

    /**
     * Removes every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        List<CacheEntry> entries = store.entries();
        int evicted = 0;
        for (CacheEntry entry : entries) {
            if (isExpired(entry) && store.evict(entry)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Cache sweep removed {} expired entries ({} remaining)", evicted, entries.size() - evicted);
        }
        return evicted;
    }

    public CacheStats stats() {
        List<CacheEntry> entries = store.entries();
        Long oldest = entries.stream().map(CacheEntry::getComputedAt).min(Long::compare).orElse(null);
        Long newest = entries.stream().map(CacheEntry::getComputedAt).max(Long::compare).orElse(null);

        return CacheStats.builder()
                .backend(store.name())
                .totalEntries(entries.size())
                .oldestEntry(oldest)
                .newestEntry(newest)
                .ttlSeconds(ttl.getSeconds())
                .hits(hits.get())
                .misses(misses.get())
                .bypasses(bypasses.get())
                .build();
    }

    public int clear() {
        int removed = store.clear();
        log.info("Cleared {} cache entries", removed);
        return removed;
    }

    public Duration getTtl() {
        return ttl;
    }

    private <T> Optional<T> readLive(String fingerprint, Class<T> type) {
        Optional<CacheEntry> found = store.find(fingerprint);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        CacheEntry entry = found.get();
        if (isExpired(entry)) {
            log.debug("Cache expired: {}... (age {}s)", abbreviate(fingerprint),
                    (clock.millis() - entry.getComputedAt()) / 1000);
            store.evict(entry);
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(entry.getPayload(), type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", abbreviate(fingerprint), e.getOriginalMessage());
            store.evict(entry);
            return Optional.empty();
        }
    }

    /**
     * Stores the computed value and returns its deserialized copy, so a miss and
     * a later hit hand out identical payloads.
     */
    private <T> T storeComputed(String fingerprint, Class<T> type, T value) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Result for {} is not serializable, returning it uncached: {}",
                    abbreviate(fingerprint), e.getOriginalMessage());
            return value;
        }

        CacheEntry entry = CacheEntry.builder()
                .fingerprint(fingerprint)
                .payload(payload)
                .computedAt(clock.millis())
                .build();
        try {
            store.put(entry, ttl);
        } catch (CacheUnavailableException e) {
            log.warn("Failed to store cache entry {}: {}", abbreviate(fingerprint), e.getMessage());
        }

        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cached payload for " + abbreviate(fingerprint) + " does not round-trip", e);
        }
    }

    private boolean isExpired(CacheEntry entry) {
        return clock.millis() - entry.getComputedAt() >= ttl.toMillis();
    }

    private <T> CacheLookup<T> hit(String fingerprint, T value) {
        hits.incrementAndGet();
        metricsConfig.recordCacheLookup(CacheOutcome.HIT);
        log.debug("Cache hit: {}...", abbreviate(fingerprint));
        return new CacheLookup<>(value, CacheOutcome.HIT, fingerprint);
    }

    private <T> CacheLookup<T> bypass(String fingerprint, Supplier<T> compute, CacheUnavailableException cause) {
        log.warn("Cache backend {} unavailable, computing {} directly: {}",
                store.name(), abbreviate(fingerprint), cause.getMessage());
        bypasses.incrementAndGet();
        metricsConfig.recordCacheLookup(CacheOutcome.BYPASS);
        return new CacheLookup<>(compute.get(), CacheOutcome.BYPASS, fingerprint);
    }

    /**
     * Result for a caller that waited on another caller's computation. It is a
     * hit when the leader's value came from or went into the store, and a
     * bypass when the leader could not reach it.
     */
    private <T> CacheLookup<T> joined(String fingerprint, Class<T> type, CacheLookup<?> leader) {
        T value = type.cast(leader.getValue());
        if (leader.getOutcome() == CacheOutcome.BYPASS) {
            bypasses.incrementAndGet();
            metricsConfig.recordCacheLookup(CacheOutcome.BYPASS);
            return new CacheLookup<>(value, CacheOutcome.BYPASS, fingerprint);
        }
        return hit(fingerprint, value);
    }

    private static CacheLookup<?> await(CompletableFuture<CacheLookup<?>> flight) {
        try {
            return flight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        } catch (CancellationException e) {
            throw new IllegalStateException("In-flight computation was cancelled", e);
        }
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 8 ? fingerprint.substring(0, 8) : fingerprint;
    }
}
