package com.funnel.insights.cache;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.funnel.insights.config.AerospikeConfig;
import com.funnel.insights.exception.CacheUnavailableException;
import com.funnel.insights.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Stores cache entries in the {@code analysis_cache} set. Records are written
 * with a server-side TTL matching the cache TTL, so Aerospike expires them
 * even if no lookup ever touches them again.
 */
public class AerospikeCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeCacheStore.class);

    private static final String BIN_FINGERPRINT = "fp";
    private static final String BIN_PAYLOAD = "payload";
    private static final String BIN_COMPUTED_AT = "computedAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeCacheStore(AerospikeClient client, String namespace,
                               WritePolicy writePolicy, Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public String name() {
        return "AEROSPIKE";
    }

    @Override
    public Optional<CacheEntry> find(String fingerprint) {
        try {
            Record record = client.get(readPolicy, key(fingerprint));
            if (record == null) {
                return Optional.empty();
            }
            return Optional.of(mapRecordToEntry(fingerprint, record));
        } catch (AerospikeException e) {
            throw new CacheUnavailableException("Aerospike read failed for " + abbreviate(fingerprint), e);
        }
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = (int) Math.min(Integer.MAX_VALUE, Math.max(1, ttl.getSeconds()));

        try {
            client.put(policy, key(entry.getFingerprint()),
                    new Bin(BIN_FINGERPRINT, entry.getFingerprint()),
                    new Bin(BIN_PAYLOAD, entry.getPayload()),
                    new Bin(BIN_COMPUTED_AT, entry.getComputedAt()));
        } catch (AerospikeException e) {
            throw new CacheUnavailableException("Aerospike write failed for " + abbreviate(entry.getFingerprint()), e);
        }
    }

    /**
     * Deletes the record only while its generation still matches the one read,
     * so a record rewritten since then survives.
     */
    @Override
    public boolean evict(CacheEntry expected) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = expected.getGeneration();

        try {
            return client.delete(policy, key(expected.getFingerprint()));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Cache record {} was rewritten, keeping it", abbreviate(expected.getFingerprint()));
                return false;
            }
            throw new CacheUnavailableException("Aerospike delete failed for " + abbreviate(expected.getFingerprint()), e);
        }
    }

    @Override
    public List<CacheEntry> entries() {
        List<CacheEntry> entries = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANALYSIS_CACHE,
                    (key, record) -> {
                        String fingerprint = record.getString(BIN_FINGERPRINT);
                        if (fingerprint != null) {
                            entries.add(mapRecordToEntry(fingerprint, record));
                        } else {
                            log.warn("Skipping cache record without fingerprint bin");
                        }
                    });
        } catch (AerospikeException e) {
            throw new CacheUnavailableException("Aerospike scan of " + AerospikeConfig.SET_ANALYSIS_CACHE + " failed", e);
        }
        return new ArrayList<>(entries);
    }

    @Override
    public int clear() {
        List<CacheEntry> existing = entries();
        for (CacheEntry entry : existing) {
            try {
                client.delete(writePolicy, key(entry.getFingerprint()));
            } catch (AerospikeException e) {
                throw new CacheUnavailableException("Aerospike delete failed for " + abbreviate(entry.getFingerprint()), e);
            }
        }
        return existing.size();
    }

    private Key key(String fingerprint) {
        return new Key(namespace, AerospikeConfig.SET_ANALYSIS_CACHE, fingerprint);
    }

    private CacheEntry mapRecordToEntry(String fingerprint, Record record) {
        return CacheEntry.builder()
                .fingerprint(fingerprint)
                .payload(record.getString(BIN_PAYLOAD))
                .computedAt(record.getLong(BIN_COMPUTED_AT))
                .generation(record.generation)
                .build();
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 8 ? fingerprint.substring(0, 8) : fingerprint;
    }
}
