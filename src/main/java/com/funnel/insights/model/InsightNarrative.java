package com.funnel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable commentary attached to an analysis by an external narrative
 * generator. Shape mirrors what that generator returns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsightNarrative {

    private String model;

    @Builder.Default
    private List<NarrativeIssue> criticalIssues = new ArrayList<>();

    @Builder.Default
    private List<NarrativeOpportunity> opportunities = new ArrayList<>();

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();

    @Builder.Default
    private List<SuggestedTest> suggestedTests = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NarrativeIssue {
        private String dimension;
        private String value;
        private String issue;
        private String impact;  // "high", "medium" or "low"
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NarrativeOpportunity {
        private String dimension;
        private String value;
        private String opportunity;
        private String potentialLift;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recommendation {
        private int priority;   // 1 = most important
        private String action;
        private String expectedImpact;
        private String implementation;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SuggestedTest {
        private String testName;
        private String hypothesis;
        private String metric;
    }
}
