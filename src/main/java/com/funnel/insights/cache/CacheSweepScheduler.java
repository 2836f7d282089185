package com.funnel.insights.cache;

import com.funnel.insights.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodically drops expired cache entries. Lookups check TTL on their own;
 * this only keeps the store from holding entries nobody asks for again.
 */
@Component
@ConditionalOnProperty(name = "funnel.cache.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class CacheSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(CacheSweepScheduler.class);

    private final FingerprintCache cache;

    public CacheSweepScheduler(FingerprintCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${funnel.cache.sweep-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${funnel.cache.sweep-interval-minutes:60}")
    public void sweepExpiredEntries() {
        try {
            cache.evictExpired();
        } catch (CacheUnavailableException e) {
            log.warn("Skipping cache sweep, backend unavailable: {}", e.getMessage());
        }
    }
}
