package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Recent records kept verbatim plus one aggregate per (bucket, dimension
 * combination) for everything older. Derived per run, never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalWindow {

    @Builder.Default
    private List<FunnelRecord> recent = new ArrayList<>();

    @Builder.Default
    private List<FunnelRecord> summarized = new ArrayList<>();

    private int olderRecordCount;
    private int bucketCount;

    public List<FunnelRecord> combined() {
        List<FunnelRecord> all = new ArrayList<>(recent.size() + summarized.size());
        all.addAll(recent);
        all.addAll(summarized);
        return all;
    }

    public int size() {
        return recent.size() + summarized.size();
    }
}
