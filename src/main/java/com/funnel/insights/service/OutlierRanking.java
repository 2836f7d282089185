package com.funnel.insights.service;

import com.funnel.insights.model.Direction;
import com.funnel.insights.model.Outlier;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Presentation orderings for outliers. Ties are broken by dimension, value
 * and stage so the same outliers always rank the same way.
 */
public final class OutlierRanking {

    private static final Comparator<Outlier> TIE_BREAK = Comparator
            .comparing(Outlier::getDimension)
            .thenComparing(Outlier::getValue)
            .thenComparing(Outlier::getStage);

    public static final Comparator<Outlier> BY_MAGNITUDE = Comparator
            .comparingDouble(Outlier::absoluteDeviation).reversed()
            .thenComparing(TIE_BREAK);

    public static final Comparator<Outlier> BY_SEVERITY = Comparator
            .comparingInt((Outlier o) -> o.getSeverity().rank()).reversed()
            .thenComparing(Comparator.comparingDouble(Outlier::absoluteDeviation).reversed())
            .thenComparing(TIE_BREAK);

    public static final Comparator<Outlier> BY_LIFT = Comparator
            .comparingDouble(Outlier::getDeviation).reversed()
            .thenComparing(TIE_BREAK);

    private OutlierRanking() {}

    public static List<Outlier> byMagnitude(Collection<Outlier> outliers) {
        return outliers.stream().sorted(BY_MAGNITUDE).toList();
    }

    /**
     * Below-baseline outliers, most severe first.
     */
    public static List<Outlier> criticalIssues(Collection<Outlier> outliers, int limit) {
        return outliers.stream()
                .filter(o -> o.getDirection() == Direction.BELOW)
                .sorted(BY_SEVERITY)
                .limit(limit)
                .toList();
    }

    /**
     * Above-baseline outliers, largest positive deviation first.
     */
    public static List<Outlier> opportunities(Collection<Outlier> outliers, int limit) {
        return outliers.stream()
                .filter(o -> o.getDirection() == Direction.ABOVE)
                .sorted(BY_LIFT)
                .limit(limit)
                .toList();
    }
}
