package com.funnel.insights.config;

import com.funnel.insights.model.CacheOutcome;
import com.funnel.insights.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCacheLookup(CacheOutcome outcome) {
        Counter.builder("funnel.cache.lookup")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordOutlier(Severity severity, boolean lowConfidence) {
        Counter.builder("funnel.outlier.detected")
                .tag("severity", severity.name().toLowerCase(Locale.ROOT))
                .tag("low_confidence", String.valueOf(lowConfidence))
                .register(registry)
                .increment();
    }

    public void recordDimensionFailure(String dimension) {
        Counter.builder("funnel.dimension.failed")
                .tag("dimension", dimension)
                .register(registry)
                .increment();
    }

    public void recordSummarization(int olderRecords, int summarizedRecords) {
        Counter.builder("funnel.history.summarized")
                .register(registry)
                .increment();

        DistributionSummary.builder("funnel.history.collapsed_records")
                .register(registry)
                .record(Math.max(0, olderRecords - summarizedRecords));
    }

    public void recordPayloadSavings(double savingsPercent) {
        DistributionSummary.builder("funnel.payload.savings_percent")
                .register(registry)
                .record(savingsPercent);
    }
}
