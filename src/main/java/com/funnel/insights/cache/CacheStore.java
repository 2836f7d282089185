package com.funnel.insights.cache;

import com.funnel.insights.exception.CacheUnavailableException;
import com.funnel.insights.model.CacheEntry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value storage behind the fingerprint cache. Implementations throw
 * {@link CacheUnavailableException} when the backend cannot be reached.
 * Expiry decisions are made by the cache, not the store.
 */
public interface CacheStore {

    String name();

    Optional<CacheEntry> find(String fingerprint);

    /**
     * @param ttl hint for backends that can expire records on their own
     */
    void put(CacheEntry entry, Duration ttl);

    /**
     * Removes {@code expected} only if the stored entry for its fingerprint is
     * still that entry. A newer entry written in the meantime is kept.
     *
     * @return whether the entry was removed
     */
    boolean evict(CacheEntry expected);

    List<CacheEntry> entries();

    /**
     * @return number of entries removed
     */
    int clear();
}
