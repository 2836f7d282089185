package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Funnel counts and conversion rates for one value of one dimension")
public class DimensionMetric {

    @Schema(description = "Dimension name", example = "channel")
    String dimension;

    @Schema(description = "Dimension value", example = "Social")
    String value;

    long viewItem;
    long addToCart;
    long purchase;

    double viewToCartRate;
    double cartToPurchaseRate;
    double overallConversionRate;

    long viewToCartDropoff;
    long cartToPurchaseDropoff;

    @Schema(description = "Number of view_item events behind the rates", example = "800")
    long sampleSize;

    @Schema(description = "A rate denominator was zero, so that rate is reported as 0")
    boolean lowSample;

    @Schema(description = "Sample size reached the configured minimum")
    boolean reliable;

    public double rateFor(FunnelStage stage) {
        return stage == FunnelStage.VIEW_TO_CART ? viewToCartRate : cartToPurchaseRate;
    }
}
