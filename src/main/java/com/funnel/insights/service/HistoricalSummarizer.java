package com.funnel.insights.service;

import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.config.MetricsConfig;
import com.funnel.insights.engine.StepCounts;
import com.funnel.insights.model.DimensionValue;
import com.funnel.insights.model.FunnelRecord;
import com.funnel.insights.model.HistoricalWindow;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bounds the size of multi-day history.
 *
 * <p>Records dated within the last {@code keepLastNDays} days are kept as-is.
 * Older records are grouped by calendar bucket (week or month) and, within a
 * bucket, by their exact combination of dimension values; each group collapses
 * into one synthetic record holding the summed step counts. Every dimension
 * value seen in older data therefore survives in some aggregate, while the
 * output grows with buckets and dimension cardinality rather than row count.
 *
 * <p>At most {@code maxBuckets} buckets are produced; anything older folds into
 * the oldest retained bucket.
 */
@Service
public class HistoricalSummarizer {

    private static final Logger log = LoggerFactory.getLogger(HistoricalSummarizer.class);

    private final FunnelAnalysisConfig config;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    public HistoricalSummarizer(FunnelAnalysisConfig config, Clock clock, MetricsConfig metricsConfig) {
        this.config = config;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "history.summarize", contextualName = "summarize-history")
    public HistoricalWindow summarize(List<FunnelRecord> records) {
        return summarize(records, config.getHistory().getKeepLastNDays());
    }

    public HistoricalWindow summarize(List<FunnelRecord> records, int keepLastNDays) {
        if (keepLastNDays < 0) {
            throw new IllegalArgumentException("keepLastNDays must be >= 0, got " + keepLastNDays);
        }

        LocalDate cutoff = LocalDate.now(clock).minusDays(keepLastNDays);
        List<FunnelRecord> recent = new ArrayList<>();
        List<FunnelRecord> older = new ArrayList<>();

        for (FunnelRecord record : records) {
            // Undated records cannot be bucketed; keep them verbatim
            if (record.getDate() == null || !record.getDate().isBefore(cutoff)) {
                recent.add(record);
            } else {
                older.add(record);
            }
        }

        if (older.isEmpty()) {
            return HistoricalWindow.builder()
                    .recent(recent)
                    .olderRecordCount(0)
                    .bucketCount(0)
                    .build();
        }

        // Newest bucket first so the cap keeps the most recent history
        TreeMap<LocalDate, Map<Map<String, DimensionValue>, StepCounts>> buckets =
                new TreeMap<>(Comparator.reverseOrder());
        for (FunnelRecord record : older) {
            buckets.computeIfAbsent(bucketStart(record.getDate()), k -> new LinkedHashMap<>())
                    .computeIfAbsent(new TreeMap<>(record.getDimensions()), k -> new StepCounts())
                    .add(record);
        }
        foldOverflow(buckets, Math.max(1, config.getHistory().getMaxBuckets()));

        List<FunnelRecord> summarized = new ArrayList<>();
        buckets.forEach((start, groups) -> groups.forEach((dimensions, counts) ->
                summarized.add(FunnelRecord.builder()
                        .dimensions(dimensions)
                        .viewItem(counts.getViewItem())
                        .addToCart(counts.getAddToCart())
                        .purchase(counts.getPurchase())
                        .date(start)
                        .summary(true)
                        .build())));

        log.info("Summarized {} records older than {} into {} aggregates across {} {} buckets (kept {} recent)",
                older.size(), cutoff, summarized.size(), buckets.size(),
                config.getHistory().getBucket().name().toLowerCase(), recent.size());
        metricsConfig.recordSummarization(older.size(), summarized.size());

        return HistoricalWindow.builder()
                .recent(recent)
                .summarized(summarized)
                .olderRecordCount(older.size())
                .bucketCount(buckets.size())
                .build();
    }

    LocalDate bucketStart(LocalDate date) {
        if (config.getHistory().getBucket() == FunnelAnalysisConfig.BucketSize.MONTH) {
            return date.withDayOfMonth(1);
        }
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private void foldOverflow(TreeMap<LocalDate, Map<Map<String, DimensionValue>, StepCounts>> buckets,
                              int maxBuckets) {
        if (buckets.size() <= maxBuckets) {
            return;
        }

        LocalDate oldestKept = buckets.keySet().stream().skip(maxBuckets - 1L).findFirst().orElseThrow();
        Map<Map<String, DimensionValue>, StepCounts> target = buckets.get(oldestKept);

        // tailMap(k, false) in reverse order = every bucket older than oldestKept
        Map<LocalDate, Map<Map<String, DimensionValue>, StepCounts>> overflow =
                new TreeMap<>(buckets.tailMap(oldestKept, false));
        overflow.forEach((start, groups) -> {
            groups.forEach((dimensions, counts) ->
                    target.computeIfAbsent(dimensions, k -> new StepCounts()).add(counts));
            buckets.remove(start);
        });
        log.debug("Folded {} overflow buckets into {}", overflow.size(), oldestKept);
    }
}
