package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Analysis result, its storage-optimized form and cache bookkeeping")
public class AnalysisResponse {

    @Schema(description = "Full analysis for the narrative layer")
    private FunnelAnalysisResult result;

    @Schema(description = "Size-optimized payload for persistence")
    private OptimizedPayload optimized;

    @Schema(description = "Whether the result came from the cache", example = "true")
    private boolean cacheUsed;

    @Schema(description = "HIT, MISS or BYPASS (cache unavailable)", example = "HIT")
    private CacheOutcome cacheOutcome;

    @Schema(description = "Fingerprint of the analysis inputs", example = "9f86d081884c7d65...")
    private String cacheKey;

    private long originalSize;
    private long optimizedSize;

    @Schema(description = "Size reduction of the optimized payload in percent", example = "72.4")
    private double savingsPercent;

    @Schema(description = "Whether older history was collapsed into bucket aggregates")
    private boolean summarized;

    private int inputRecordCount;
    private int analyzedRecordCount;
}
