package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduced analysis for long-term storage and display. Lossy: never fed back
 * into analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Storage-optimized analysis: top-N highlights, truncated text, no per-value metrics")
public class OptimizedPayload {

    private String model;

    private double viewToCartRate;
    private double cartToPurchaseRate;
    private double overallConversionRate;

    @Builder.Default
    private List<Highlight> criticalIssues = new ArrayList<>();

    @Builder.Default
    private List<Highlight> opportunities = new ArrayList<>();

    @Builder.Default
    private List<CompactRecommendation> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> failedDimensions = new ArrayList<>();

    private long computedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Highlight {
        private String dimension;
        private String value;
        private FunnelStage stage;
        private double deviation;
        private Severity severity;
        private boolean lowConfidence;
        // Narrative text for this dimension value, truncated
        private String note;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompactRecommendation {
        private int priority;
        private String action;
        private String impact;
        private String implementation;
    }
}
