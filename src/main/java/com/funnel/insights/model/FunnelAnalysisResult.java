package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Full analysis payload: what the narrative layer consumes and what the
 * fingerprint cache stores.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Baseline, per-dimension metrics and outliers of one funnel analysis")
public class FunnelAnalysisResult {

    @Schema(description = "Upstream analytics property", example = "123456789")
    private String propertyId;

    @Schema(description = "Date range of the input", example = "last_30_days")
    private String dateRange;

    private List<String> dimensions;

    private BaselineRates baseline;

    @Schema(description = "dimension -> value -> metric")
    @Builder.Default
    private Map<String, Map<String, DimensionMetric>> metrics = new TreeMap<>();

    @Schema(description = "All outliers, largest |deviation| first")
    @Builder.Default
    private List<Outlier> outliers = new ArrayList<>();

    @Schema(description = "BELOW outliers, most severe first")
    @Builder.Default
    private List<Outlier> criticalIssues = new ArrayList<>();

    @Schema(description = "ABOVE outliers, largest lift first")
    @Builder.Default
    private List<Outlier> opportunities = new ArrayList<>();

    @Builder.Default
    private List<DimensionFailure> failures = new ArrayList<>();

    private InsightNarrative narrative;

    private int recordCount;

    @Schema(description = "Epoch millis when the analysis was computed", example = "1739886764000")
    private long computedAt;
}
