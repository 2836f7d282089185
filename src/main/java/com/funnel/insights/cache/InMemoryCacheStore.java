package com.funnel.insights.cache;

import com.funnel.insights.model.CacheEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCacheStore implements CacheStore {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "MEMORY";
    }

    @Override
    public Optional<CacheEntry> find(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        entries.put(entry.getFingerprint(), entry);
    }

    @Override
    public boolean evict(CacheEntry expected) {
        return entries.remove(expected.getFingerprint(), expected);
    }

    @Override
    public List<CacheEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public int clear() {
        int size = entries.size();
        entries.clear();
        return size;
    }
}
