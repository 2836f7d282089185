package com.funnel.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.config.MetricsConfig;
import com.funnel.insights.model.DimensionFailure;
import com.funnel.insights.model.FunnelAnalysisResult;
import com.funnel.insights.model.InsightNarrative;
import com.funnel.insights.model.OptimizationResult;
import com.funnel.insights.model.OptimizedPayload;
import com.funnel.insights.model.Outlier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reduces a full analysis to what is worth persisting: top-N critical issues
 * and opportunities, top-N recommendations, truncated text and no per-value
 * metrics. Suggested tests are dropped.
 */
@Service
public class PayloadOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PayloadOptimizer.class);
    private static final String ELLIPSIS = "...";

    private final FunnelAnalysisConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsConfig metricsConfig;

    public PayloadOptimizer(FunnelAnalysisConfig config, ObjectMapper objectMapper, MetricsConfig metricsConfig) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.metricsConfig = metricsConfig;
    }

    public OptimizationResult optimize(FunnelAnalysisResult result) {
        FunnelAnalysisConfig.Payload limits = config.getPayload();
        int topN = limits.getTopN();
        InsightNarrative narrative = result.getNarrative();

        Map<String, String> issueNotes = narrative == null ? Map.of() : narrative.getCriticalIssues().stream()
                .filter(i -> i.getIssue() != null)
                .collect(Collectors.toMap(i -> key(i.getDimension(), i.getValue()),
                        InsightNarrative.NarrativeIssue::getIssue, (a, b) -> a));
        Map<String, String> opportunityNotes = narrative == null ? Map.of() : narrative.getOpportunities().stream()
                .filter(o -> o.getOpportunity() != null)
                .collect(Collectors.toMap(o -> key(o.getDimension(), o.getValue()),
                        InsightNarrative.NarrativeOpportunity::getOpportunity, (a, b) -> a));

        List<OptimizedPayload.Highlight> criticalIssues = OutlierRanking
                .criticalIssues(sourceOf(result.getCriticalIssues(), result.getOutliers()), topN).stream()
                .map(o -> highlight(o, issueNotes))
                .toList();
        List<OptimizedPayload.Highlight> opportunities = OutlierRanking
                .opportunities(sourceOf(result.getOpportunities(), result.getOutliers()), topN).stream()
                .map(o -> highlight(o, opportunityNotes))
                .toList();

        List<OptimizedPayload.CompactRecommendation> recommendations = narrative == null ? List.of()
                : narrative.getRecommendations().stream()
                .sorted(Comparator.comparingInt(InsightNarrative.Recommendation::getPriority))
                .limit(topN)
                .map(r -> OptimizedPayload.CompactRecommendation.builder()
                        .priority(r.getPriority())
                        .action(truncate(r.getAction(), limits.getMaxActionLength()))
                        .impact(truncate(r.getExpectedImpact(), limits.getMaxImpactLength()))
                        .implementation(truncate(r.getImplementation(), limits.getMaxTextLength()))
                        .build())
                .toList();

        OptimizedPayload.OptimizedPayloadBuilder payload = OptimizedPayload.builder()
                .model(narrative != null ? narrative.getModel() : null)
                .criticalIssues(criticalIssues)
                .opportunities(opportunities)
                .recommendations(recommendations)
                .failedDimensions(result.getFailures().stream().map(DimensionFailure::getDimension).toList())
                .computedAt(result.getComputedAt());
        if (result.getBaseline() != null) {
            payload.viewToCartRate(result.getBaseline().getViewToCartRate())
                    .cartToPurchaseRate(result.getBaseline().getCartToPurchaseRate())
                    .overallConversionRate(result.getBaseline().getOverallConversionRate());
        }
        OptimizedPayload optimized = payload.build();

        long originalSize = sizeOf(result);
        long optimizedSize = sizeOf(optimized);
        double savings = savingsPercent(originalSize, optimizedSize);

        log.debug("Optimized payload: {} -> {} bytes ({}% saved)", originalSize, optimizedSize, savings);
        metricsConfig.recordPayloadSavings(savings);

        return OptimizationResult.builder()
                .payload(optimized)
                .originalSize(originalSize)
                .optimizedSize(optimizedSize)
                .savingsPercent(savings)
                .build();
    }

    static double savingsPercent(long originalSize, long optimizedSize) {
        if (originalSize <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf((originalSize - optimizedSize) * 100.0 / originalSize)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    // Pre-ranked lists may already be capped; fall back to all outliers when they are empty
    private static List<Outlier> sourceOf(List<Outlier> ranked, List<Outlier> all) {
        return ranked != null && !ranked.isEmpty() ? ranked : Objects.requireNonNullElse(all, List.of());
    }

    private OptimizedPayload.Highlight highlight(Outlier outlier, Map<String, String> notes) {
        return OptimizedPayload.Highlight.builder()
                .dimension(outlier.getDimension())
                .value(outlier.getValue())
                .stage(outlier.getStage())
                .deviation(outlier.getDeviation())
                .severity(outlier.getSeverity())
                .lowConfidence(outlier.isLowConfidence())
                .note(truncate(notes.get(key(outlier.getDimension(), outlier.getValue())),
                        config.getPayload().getMaxTextLength()))
                .build();
    }

    private long sizeOf(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String key(String dimension, String value) {
        return dimension + "=" + value;
    }
}
