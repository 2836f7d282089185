package com.funnel.insights.model;

public enum Direction {
    // Converts better than baseline (opportunity)
    ABOVE,
    // Converts worse than baseline (issue)
    BELOW
}
