package com.funnel.insights.service;

import com.funnel.insights.model.FunnelAnalysisResult;
import com.funnel.insights.model.InsightNarrative;

import java.util.Optional;

/**
 * Seam for an external generator that turns an analysis into human-readable
 * issues, opportunities and recommendations. No implementation ships with
 * this service; when none is registered results carry no narrative.
 */
public interface InsightNarrator {

    Optional<InsightNarrative> narrate(FunnelAnalysisResult result);
}
