package com.funnel.insights.engine;

import com.funnel.insights.model.Severity;
import com.funnel.insights.model.SeverityBand;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered severity table. Bands are checked from the highest lower bound down
 * and the first band the absolute deviation reaches wins, so a larger
 * deviation never maps to a lower severity.
 */
public final class SeverityBands {

    private final List<SeverityBand> bands;

    private SeverityBands(List<SeverityBand> bands) {
        this.bands = bands;
    }

    public static SeverityBands of(List<SeverityBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("At least one severity band is required");
        }
        List<SeverityBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(SeverityBand::getLowerBound).reversed());
        return new SeverityBands(List.copyOf(sorted));
    }

    public Optional<Severity> classify(double deviation) {
        double magnitude = Math.abs(deviation);
        for (SeverityBand band : bands) {
            if (magnitude >= band.getLowerBound()) {
                return Optional.of(band.getSeverity());
            }
        }
        return Optional.empty();
    }

    public List<SeverityBand> asList() {
        return bands;
    }
}
