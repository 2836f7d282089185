package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The semantically relevant inputs of an analysis. Two requests with equal
 * inputs (after sorting dimensions and rounding rates) share a cache entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheKeyInputs {
    private List<String> dimensions;
    private String propertyId;
    private String dateRange;
    private BaselineRates baseline;
}
