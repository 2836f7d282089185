package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "A dimension value whose stage conversion deviates from baseline by at least the outlier threshold")
public class Outlier {

    @Schema(description = "Dimension name", example = "channel")
    String dimension;

    @Schema(description = "Dimension value", example = "Social")
    String value;

    @Schema(description = "Funnel stage that deviates", example = "VIEW_TO_CART")
    FunnelStage stage;

    @Schema(description = "Stage rate of this dimension value", example = "0.0813")
    double metricRate;

    @Schema(description = "Baseline stage rate", example = "0.152")
    double baselineRate;

    @Schema(description = "Signed relative deviation (metric - baseline) / baseline", example = "-0.465")
    double deviation;

    @Schema(description = "Severity band of |deviation|", example = "CRITICAL")
    Severity severity;

    @Schema(description = "ABOVE baseline (opportunity) or BELOW (issue)", example = "BELOW")
    Direction direction;

    long sampleSize;

    @Schema(description = "Sample below the reliability minimum or a zero rate denominator; treat as advisory")
    boolean lowConfidence;

    public double absoluteDeviation() {
        return Math.abs(deviation);
    }
}
