package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "One funnel observation: step counts for a combination of dimension values on a date")
public class FunnelRecord {

    @Schema(description = "Dimension name to value", example = "{\"channel\": \"Social\", \"device\": \"mobile\"}")
    @Singular
    Map<String, DimensionValue> dimensions;

    @Schema(description = "view_item event count", example = "800")
    long viewItem;

    @Schema(description = "add_to_cart event count", example = "65")
    long addToCart;

    @Schema(description = "purchase event count", example = "5")
    long purchase;

    @Schema(description = "Observation date", example = "2025-02-18")
    LocalDate date;

    @Schema(description = "True for synthetic records produced by historical summarization")
    boolean summary;

    public boolean hasDimension(String dimension) {
        DimensionValue value = dimensions.get(dimension);
        return value != null && !value.isNotSet();
    }

    /**
     * Value of the given dimension, or {@link DimensionValue#notSet()} when the
     * record does not carry it.
     */
    public DimensionValue dimensionValue(String dimension) {
        DimensionValue value = dimensions.get(dimension);
        return value != null ? value : DimensionValue.notSet();
    }
}
