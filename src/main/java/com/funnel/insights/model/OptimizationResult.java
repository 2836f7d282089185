package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResult {
    private OptimizedPayload payload;
    // Serialized JSON sizes in bytes
    private long originalSize;
    private long optimizedSize;
    private double savingsPercent;
}
