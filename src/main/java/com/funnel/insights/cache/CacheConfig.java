package com.funnel.insights.cache;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    @ConditionalOnProperty(name = "funnel.cache.backend", havingValue = "AEROSPIKE")
    public CacheStore aerospikeCacheStore(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        log.info("Analysis cache backed by Aerospike namespace '{}'", namespace);
        return new AerospikeCacheStore(client, namespace, writePolicy, readPolicy);
    }

    @Bean
    @ConditionalOnProperty(name = "funnel.cache.backend", havingValue = "MEMORY", matchIfMissing = true)
    public CacheStore inMemoryCacheStore() {
        log.info("Analysis cache backed by in-process memory");
        return new InMemoryCacheStore();
    }

    @Bean
    public FingerprintCache fingerprintCache(CacheStore cacheStore,
                                             FingerprintGenerator fingerprintGenerator,
                                             ObjectMapper objectMapper,
                                             Clock clock,
                                             FunnelAnalysisConfig config,
                                             MetricsConfig metricsConfig) {
        return new FingerprintCache(cacheStore, fingerprintGenerator, objectMapper, clock,
                config.getCache().getTtl(), metricsConfig);
    }
}
