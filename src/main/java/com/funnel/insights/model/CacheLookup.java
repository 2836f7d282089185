package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Value returned by the fingerprint cache together with how it was obtained.
 */
@Data
@AllArgsConstructor
public class CacheLookup<T> {
    private T value;
    private CacheOutcome outcome;
    private String fingerprint;

    public boolean isCacheUsed() {
        return outcome.isCacheUsed();
    }
}
