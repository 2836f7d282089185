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
@Schema(description = "Analysis cache occupancy and lookup counters since startup")
public class CacheStats {

    @Schema(description = "Storage backend", example = "MEMORY")
    private String backend;

    private int totalEntries;

    @Schema(description = "computedAt of the oldest entry (epoch millis), null when empty")
    private Long oldestEntry;

    @Schema(description = "computedAt of the newest entry (epoch millis), null when empty")
    private Long newestEntry;

    private long ttlSeconds;
    private long hits;
    private long misses;
    private long bypasses;
}
