package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private String fingerprint;
    // JSON serialization of the cached value
    private String payload;
    private long computedAt;
    // Backend record version, 0 for stores that compare whole entries
    private int generation;
}
