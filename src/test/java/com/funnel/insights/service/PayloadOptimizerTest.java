package com.funnel.insights.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnel.insights.model.*;
import com.funnel.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.funnel.insights.testutil.TestDataFactory.baseline;
import static com.funnel.insights.testutil.TestDataFactory.metric;
import static com.funnel.insights.testutil.TestDataFactory.outlier;
import static org.assertj.core.api.Assertions.assertThat;

class PayloadOptimizerTest {

    private PayloadOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new PayloadOptimizer(TestDataFactory.defaultConfig(), new ObjectMapper().findAndRegisterModules(),
                TestDataFactory.metrics());
    }

    @Test
    void optimize_twelveCriticalIssues_keepsTopFiveBySeverity() {
        List<Outlier> issues = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            issues.add(outlier("device", "D-" + i, FunnelStage.CART_TO_PURCHASE, -0.36 - i / 100.0, Severity.HIGH));
        }
        issues.addAll(TestDataFactory.criticalOutliers(6));

        OptimizationResult result = optimizer.optimize(analysis(issues));

        assertThat(result.getPayload().getCriticalIssues()).hasSize(5)
                .allMatch(h -> h.getSeverity() == Severity.CRITICAL);
        assertThat(result.getPayload().getCriticalIssues()).extracting(OptimizedPayload.Highlight::getValue)
                .containsExactly("C-5", "C-4", "C-3", "C-2", "C-1");
        assertThat(result.getSavingsPercent()).isGreaterThan(0.0);
        assertThat(result.getOptimizedSize()).isLessThan(result.getOriginalSize());
    }

    @Test
    void optimize_opportunitiesRankedByLift() {
        FunnelAnalysisResult analysis = analysis(List.of());
        analysis.setOpportunities(List.of(
                outlier("channel", "Email", FunnelStage.VIEW_TO_CART, 0.25, Severity.MEDIUM),
                outlier("channel", "Direct", FunnelStage.VIEW_TO_CART, 0.80, Severity.CRITICAL)));

        OptimizationResult result = optimizer.optimize(analysis);

        assertThat(result.getPayload().getOpportunities()).extracting(OptimizedPayload.Highlight::getValue)
                .containsExactly("Direct", "Email");
    }

    @Test
    void optimize_narrative_truncatedAndCapped() {
        FunnelAnalysisResult analysis = analysis(List.of(
                outlier("channel", "Social", FunnelStage.VIEW_TO_CART, -0.5, Severity.CRITICAL)));
        List<InsightNarrative.Recommendation> recommendations = new ArrayList<>();
        for (int p = 8; p >= 1; p--) {
            recommendations.add(InsightNarrative.Recommendation.builder()
                    .priority(p)
                    .action("a".repeat(400))
                    .expectedImpact("i".repeat(400))
                    .implementation("short")
                    .build());
        }
        analysis.setNarrative(InsightNarrative.builder()
                .model("narrator-v1")
                .criticalIssues(List.of(InsightNarrative.NarrativeIssue.builder()
                        .dimension("channel").value("Social").issue("x".repeat(500)).impact("high").build()))
                .recommendations(recommendations)
                .suggestedTests(List.of(InsightNarrative.SuggestedTest.builder().testName("t").build()))
                .build());

        OptimizedPayload payload = optimizer.optimize(analysis).getPayload();

        assertThat(payload.getModel()).isEqualTo("narrator-v1");
        assertThat(payload.getCriticalIssues().get(0).getNote()).hasSize(200).endsWith("...");
        assertThat(payload.getRecommendations()).hasSize(5)
                .extracting(OptimizedPayload.CompactRecommendation::getPriority).containsExactly(1, 2, 3, 4, 5);
        assertThat(payload.getRecommendations().get(0).getAction()).hasSize(150);
        assertThat(payload.getRecommendations().get(0).getImpact()).hasSize(100);
        assertThat(payload.getRecommendations().get(0).getImplementation()).isEqualTo("short");
    }

    @Test
    void optimize_noRankedLists_fallsBackToAllOutliers() {
        FunnelAnalysisResult analysis = analysis(List.of());
        analysis.setOutliers(List.of(
                outlier("channel", "Social", FunnelStage.VIEW_TO_CART, -0.5, Severity.CRITICAL),
                outlier("channel", "Email", FunnelStage.VIEW_TO_CART, 0.5, Severity.CRITICAL)));

        OptimizedPayload payload = optimizer.optimize(analysis).getPayload();

        assertThat(payload.getCriticalIssues()).extracting(OptimizedPayload.Highlight::getValue).containsExactly("Social");
        assertThat(payload.getOpportunities()).extracting(OptimizedPayload.Highlight::getValue).containsExactly("Email");
    }

    @Test
    void optimize_carriesBaselineAndFailedDimensions() {
        FunnelAnalysisResult analysis = analysis(List.of());
        analysis.setFailures(List.of(new DimensionFailure("browser", "missing", 2)));

        OptimizedPayload payload = optimizer.optimize(analysis).getPayload();

        assertThat(payload.getViewToCartRate()).isEqualTo(0.2);
        assertThat(payload.getFailedDimensions()).containsExactly("browser");
        assertThat(payload.getComputedAt()).isEqualTo(1_739_886_764_000L);
    }

    @Test
    void savingsPercent_roundedToOneDecimal_zeroForEmptyOriginal() {
        assertThat(PayloadOptimizer.savingsPercent(3, 1)).isEqualTo(66.7);
        assertThat(PayloadOptimizer.savingsPercent(0, 10)).isZero();
    }

    @Test
    void truncate_shortTextUntouched() {
        assertThat(PayloadOptimizer.truncate("ok", 10)).isEqualTo("ok");
        assertThat(PayloadOptimizer.truncate(null, 10)).isNull();
        assertThat(PayloadOptimizer.truncate("abcdefghijk", 10)).isEqualTo("abcdefg...");
    }

    private static FunnelAnalysisResult analysis(List<Outlier> criticalIssues) {
        Map<String, Map<String, DimensionMetric>> metrics = new TreeMap<>();
        Map<String, DimensionMetric> channel = new TreeMap<>();
        for (int i = 0; i < 20; i++) {
            channel.put("C-" + i, metric("channel", "C-" + i, 1000 + i, 100, 10));
        }
        metrics.put("channel", channel);

        return FunnelAnalysisResult.builder()
                .propertyId("123")
                .dateRange("last_30_days")
                .dimensions(List.of("channel"))
                .baseline(baseline(0.2, 0.1))
                .metrics(metrics)
                .outliers(new ArrayList<>(criticalIssues))
                .criticalIssues(new ArrayList<>(criticalIssues))
                .recordCount(600)
                .computedAt(1_739_886_764_000L)
                .build();
    }
}
