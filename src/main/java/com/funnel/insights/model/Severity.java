package com.funnel.insights.model;

public enum Severity {
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Higher rank means more severe. Used to order critical issues.
     */
    public int rank() {
        return ordinal();
    }
}
