package com.funnel.insights.engine;

import com.funnel.insights.model.FunnelRecord;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Running sums of funnel step counts. Rates are always derived from these
 * sums, never by averaging per-record rates.
 */
@Getter
public class StepCounts {

    private long viewItem;
    private long addToCart;
    private long purchase;
    private int records;

    public StepCounts add(FunnelRecord record) {
        viewItem += record.getViewItem();
        addToCart += record.getAddToCart();
        purchase += record.getPurchase();
        records++;
        return this;
    }

    public StepCounts add(StepCounts other) {
        viewItem += other.viewItem;
        addToCart += other.addToCart;
        purchase += other.purchase;
        records += other.records;
        return this;
    }

    public double viewToCartRate(int scale) {
        return ratio(addToCart, viewItem, scale);
    }

    public double cartToPurchaseRate(int scale) {
        return ratio(purchase, addToCart, scale);
    }

    public double overallConversionRate(int scale) {
        return ratio(purchase, viewItem, scale);
    }

    /**
     * numerator / denominator clamped to [0, 1]; 0 when the denominator is not positive.
     */
    static double ratio(long numerator, long denominator, int scale) {
        return round(rate(numerator, denominator), scale);
    }

    /**
     * Unrounded form of {@link #ratio(long, long, int)}.
     */
    static double rate(long numerator, long denominator) {
        if (denominator <= 0 || numerator <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) numerator / denominator);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
