package com.funnel.insights.engine;

import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.exception.InsufficientDataException;
import com.funnel.insights.model.BaselineRates;
import com.funnel.insights.model.FunnelRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes overall step-conversion rates by summing counts across all records
 * and dividing the sums.
 */
@Component
public class BaselineCalculator {

    private final FunnelAnalysisConfig config;

    public BaselineCalculator(FunnelAnalysisConfig config) {
        this.config = config;
    }

    /**
     * @throws InsufficientDataException if {@code records} is empty or has no view_item events
     */
    public BaselineRates calculate(List<FunnelRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException("No funnel records to compute a baseline from", 0);
        }

        StepCounts totals = new StepCounts();
        records.forEach(totals::add);

        if (totals.getViewItem() <= 0) {
            throw new InsufficientDataException("Total view_item count is zero, baseline rates are undefined",
                    records.size());
        }

        int scale = config.getOutlier().getRatePrecision();
        return BaselineRates.builder()
                .viewToCartRate(totals.viewToCartRate(scale))
                .cartToPurchaseRate(totals.cartToPurchaseRate(scale))
                .overallConversionRate(totals.overallConversionRate(scale))
                .totalViewItem(totals.getViewItem())
                .totalAddToCart(totals.getAddToCart())
                .totalPurchase(totals.getPurchase())
                .recordCount(records.size())
                .build();
    }
}
