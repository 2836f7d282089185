package com.funnel.insights.config;

import com.funnel.insights.model.Severity;
import com.funnel.insights.model.SeverityBand;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "funnel")
public class FunnelAnalysisConfig {

    // Dimensions analyzed when a request does not name any
    private List<String> defaultDimensions = new ArrayList<>(List.of("channel", "device", "browser"));

    private Outlier outlier = new Outlier();

    private Cache cache = new Cache();

    private History history = new History();

    private Payload payload = new Payload();

    @Data
    public static class Outlier {
        // Minimum |deviation| from baseline, as a fraction (0.20 = 20%)
        private double threshold = 0.20;

        // Metrics whose view_item count is below this are reported but flagged low-confidence
        private long minSampleSize = 30;

        // Decimal places for rates and deviations
        private int ratePrecision = 4;

        // Evaluated top-down by lower bound; first match wins
        private List<SeverityBand> severityBands = new ArrayList<>(List.of(
                new SeverityBand(Severity.CRITICAL, 0.50),
                new SeverityBand(Severity.HIGH, 0.35),
                new SeverityBand(Severity.MEDIUM, 0.20)));
    }

    @Data
    public static class Cache {
        private Backend backend = Backend.MEMORY;
        private Duration ttl = Duration.ofHours(24);
        // Baseline rates are rounded to this many decimals before fingerprinting
        private int fingerprintPrecision = 4;
        private boolean sweepEnabled = true;
        private int sweepIntervalMinutes = 60;
    }

    @Data
    public static class History {
        private int keepLastNDays = 30;
        // Inputs larger than this are summarized before analysis
        private int summarizeThreshold = 1000;
        private BucketSize bucket = BucketSize.WEEK;
        private int maxBuckets = 52;
    }

    @Data
    public static class Payload {
        private int topN = 5;
        private int maxTextLength = 200;
        private int maxActionLength = 150;
        private int maxImpactLength = 100;
    }

    public enum Backend {
        MEMORY,
        AEROSPIKE
    }

    public enum BucketSize {
        WEEK,
        MONTH
    }
}
