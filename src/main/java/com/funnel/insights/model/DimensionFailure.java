package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A requested dimension that could not be analyzed. Other dimensions of the
 * same analysis are unaffected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionFailure {
    private String dimension;
    private String reason;
    private int recordCount;
}
