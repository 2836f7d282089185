package com.funnel.insights.engine;

import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.exception.UnknownDimensionException;
import com.funnel.insights.model.DimensionMetric;
import com.funnel.insights.model.FunnelRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups records by the value of one dimension and computes a
 * {@link DimensionMetric} per value. Records that lack the dimension are
 * grouped under {@code "(not set)"}. Days on which a value is absent are
 * simply not summed; presence on every day is not required.
 */
@Component
public class DimensionAggregator {

    private final FunnelAnalysisConfig config;

    public DimensionAggregator(FunnelAnalysisConfig config) {
        this.config = config;
    }

    /**
     * @return value label to metric, sorted by label
     * @throws UnknownDimensionException if no record carries {@code dimension}
     */
    public Map<String, DimensionMetric> aggregate(List<FunnelRecord> records, String dimension) {
        if (dimension == null || dimension.isBlank()) {
            throw new IllegalArgumentException("Dimension name must not be blank");
        }

        boolean seen = false;
        Map<String, StepCounts> groups = new TreeMap<>();
        for (FunnelRecord record : records) {
            seen |= record.hasDimension(dimension);
            groups.computeIfAbsent(record.dimensionValue(dimension).getLabel(), k -> new StepCounts())
                    .add(record);
        }

        if (!seen) {
            throw new UnknownDimensionException(dimension, records.size());
        }

        Map<String, DimensionMetric> metrics = new TreeMap<>();
        groups.forEach((value, counts) -> metrics.put(value, toMetric(dimension, value, counts)));
        return metrics;
    }

    DimensionMetric toMetric(String dimension, String value, StepCounts counts) {
        int scale = config.getOutlier().getRatePrecision();
        boolean zeroDenominator = counts.getViewItem() <= 0 || counts.getAddToCart() <= 0;

        return DimensionMetric.builder()
                .dimension(dimension)
                .value(value)
                .viewItem(counts.getViewItem())
                .addToCart(counts.getAddToCart())
                .purchase(counts.getPurchase())
                .viewToCartRate(counts.viewToCartRate(scale))
                .cartToPurchaseRate(counts.cartToPurchaseRate(scale))
                .overallConversionRate(counts.overallConversionRate(scale))
                .viewToCartDropoff(Math.max(0, counts.getViewItem() - counts.getAddToCart()))
                .cartToPurchaseDropoff(Math.max(0, counts.getAddToCart() - counts.getPurchase()))
                .sampleSize(counts.getViewItem())
                .lowSample(zeroDenominator)
                .reliable(counts.getViewItem() >= config.getOutlier().getMinSampleSize())
                .build();
    }
}
