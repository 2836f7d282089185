package com.funnel.insights.model;

/**
 * Step transitions of the view_item -> add_to_cart -> purchase funnel
 * that are compared against baseline.
 */
public enum FunnelStage {
    VIEW_TO_CART,
    CART_TO_PURCHASE
}
