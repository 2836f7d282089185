package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the severity table: an absolute deviation at or above
 * {@code lowerBound} is labelled {@code severity}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeverityBand {
    private Severity severity;
    private double lowerBound;
}
