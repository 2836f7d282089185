package com.funnel.insights.service;

import com.funnel.insights.model.FunnelStage;
import com.funnel.insights.model.Outlier;
import com.funnel.insights.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.funnel.insights.testutil.TestDataFactory.outlier;
import static org.assertj.core.api.Assertions.assertThat;

class OutlierRankingTest {

    private final List<Outlier> outliers = List.of(
            outlier("channel", "Paid", FunnelStage.VIEW_TO_CART, -0.36, Severity.HIGH),
            outlier("channel", "Social", FunnelStage.VIEW_TO_CART, -0.50, Severity.CRITICAL),
            outlier("device", "tablet", FunnelStage.CART_TO_PURCHASE, -0.62, Severity.CRITICAL),
            outlier("channel", "Email", FunnelStage.VIEW_TO_CART, 0.50, Severity.CRITICAL),
            outlier("channel", "Direct", FunnelStage.VIEW_TO_CART, 0.22, Severity.MEDIUM));

    @Test
    void byMagnitude_largestAbsoluteDeviationFirst_tiesByDimensionAndValue() {
        assertThat(OutlierRanking.byMagnitude(outliers)).extracting(Outlier::getValue)
                .containsExactly("tablet", "Email", "Social", "Paid", "Direct");
    }

    @Test
    void criticalIssues_onlyBelow_severityThenMagnitude() {
        assertThat(OutlierRanking.criticalIssues(outliers, 5)).extracting(Outlier::getValue)
                .containsExactly("tablet", "Social", "Paid");
    }

    @Test
    void opportunities_onlyAbove_largestLiftFirst_capped() {
        assertThat(OutlierRanking.opportunities(outliers, 1)).extracting(Outlier::getValue)
                .containsExactly("Email");
    }
}
