package com.funnel.insights.engine;

import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.model.BaselineRates;
import com.funnel.insights.model.DimensionMetric;
import com.funnel.insights.model.Direction;
import com.funnel.insights.model.FunnelStage;
import com.funnel.insights.model.Outlier;
import com.funnel.insights.model.Severity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares each dimension value's stage rates to baseline and emits one
 * {@link Outlier} per (dimension, value, stage) whose relative deviation
 * reaches the threshold. Output is unordered; ranking is done by the caller.
 */
@Component
public class OutlierDetector {

    private final FunnelAnalysisConfig config;

    public OutlierDetector(FunnelAnalysisConfig config) {
        this.config = config;
    }

    public Set<Outlier> detectAll(BaselineRates baseline, Map<String, Map<String, DimensionMetric>> metricsByDimension) {
        Set<Outlier> outliers = new LinkedHashSet<>();
        metricsByDimension.values().forEach(metrics -> outliers.addAll(detect(baseline, metrics)));
        return outliers;
    }

    /**
     * Outliers among the values of a single dimension.
     */
    public Set<Outlier> detect(BaselineRates baseline, Map<String, DimensionMetric> metrics) {
        SeverityBands bands = SeverityBands.of(config.getOutlier().getSeverityBands());
        Set<Outlier> outliers = new LinkedHashSet<>();

        for (DimensionMetric metric : metrics.values()) {
            for (FunnelStage stage : FunnelStage.values()) {
                evaluate(baseline, metric, stage, bands).ifPresent(outliers::add);
            }
        }
        return outliers;
    }

    private Optional<Outlier> evaluate(BaselineRates baseline, DimensionMetric metric,
                                       FunnelStage stage, SeverityBands bands) {
        // Deviation uses the exact count ratios; the rounded rates are for display only
        double exactBaseline = stage == FunnelStage.VIEW_TO_CART
                ? StepCounts.rate(baseline.getTotalAddToCart(), baseline.getTotalViewItem())
                : StepCounts.rate(baseline.getTotalPurchase(), baseline.getTotalAddToCart());
        if (exactBaseline == 0.0) {
            // Deviation is undefined against a zero baseline
            return Optional.empty();
        }

        double exactMetric = stage == FunnelStage.VIEW_TO_CART
                ? StepCounts.rate(metric.getAddToCart(), metric.getViewItem())
                : StepCounts.rate(metric.getPurchase(), metric.getAddToCart());
        double deviation = StepCounts.round((exactMetric - exactBaseline) / exactBaseline,
                config.getOutlier().getRatePrecision());

        if (Math.abs(deviation) < config.getOutlier().getThreshold()) {
            return Optional.empty();
        }

        Optional<Severity> severity = bands.classify(deviation);
        if (severity.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(Outlier.builder()
                .dimension(metric.getDimension())
                .value(metric.getValue())
                .stage(stage)
                .metricRate(metric.rateFor(stage))
                .baselineRate(baseline.rateFor(stage))
                .deviation(deviation)
                .severity(severity.get())
                .direction(deviation > 0 ? Direction.ABOVE : Direction.BELOW)
                .sampleSize(metric.getSampleSize())
                .lowConfidence(!metric.isReliable() || metric.isLowSample())
                .build());
    }
}
