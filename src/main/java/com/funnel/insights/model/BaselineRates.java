package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Overall step-conversion rates computed across all records of an analysis")
public class BaselineRates {

    @Schema(description = "add_to_cart / view_item", example = "0.152")
    double viewToCartRate;

    @Schema(description = "purchase / add_to_cart", example = "0.087")
    double cartToPurchaseRate;

    @Schema(description = "purchase / view_item", example = "0.0132")
    double overallConversionRate;

    long totalViewItem;
    long totalAddToCart;
    long totalPurchase;
    int recordCount;

    public double rateFor(FunnelStage stage) {
        return stage == FunnelStage.VIEW_TO_CART ? viewToCartRate : cartToPurchaseRate;
    }
}
