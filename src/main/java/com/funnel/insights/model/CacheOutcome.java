package com.funnel.insights.model;

public enum CacheOutcome {
    HIT,
    MISS,
    // Cache backend unreachable; result computed directly
    BYPASS;

    public boolean isCacheUsed() {
        return this == HIT;
    }
}
