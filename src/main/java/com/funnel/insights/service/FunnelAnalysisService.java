package com.funnel.insights.service;

import com.funnel.insights.cache.FingerprintCache;
import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.config.MetricsConfig;
import com.funnel.insights.engine.BaselineCalculator;
import com.funnel.insights.engine.DimensionAggregator;
import com.funnel.insights.engine.OutlierDetector;
import com.funnel.insights.exception.UnknownDimensionException;
import com.funnel.insights.model.AnalysisRequest;
import com.funnel.insights.model.AnalysisResponse;
import com.funnel.insights.model.BaselineRates;
import com.funnel.insights.model.CacheKeyInputs;
import com.funnel.insights.model.CacheLookup;
import com.funnel.insights.model.DimensionFailure;
import com.funnel.insights.model.DimensionMetric;
import com.funnel.insights.model.FunnelAnalysisResult;
import com.funnel.insights.model.FunnelRecord;
import com.funnel.insights.model.HistoricalWindow;
import com.funnel.insights.model.OptimizationResult;
import com.funnel.insights.model.Outlier;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs one funnel analysis end to end:
 * <ol>
 *   <li>resolve records (request or mock data) and summarize long history</li>
 *   <li>compute the baseline and fingerprint the analysis inputs</li>
 *   <li>on a cache miss, aggregate and detect outliers per dimension</li>
 *   <li>reduce the result to a storage-optimized payload</li>
 * </ol>
 * A dimension that cannot be analyzed is recorded as a failure and the
 * remaining dimensions are still analyzed.
 */
@Service
public class FunnelAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FunnelAnalysisService.class);

    private final FunnelAnalysisConfig config;
    private final BaselineCalculator baselineCalculator;
    private final DimensionAggregator dimensionAggregator;
    private final OutlierDetector outlierDetector;
    private final FingerprintCache fingerprintCache;
    private final HistoricalSummarizer historicalSummarizer;
    private final PayloadOptimizer payloadOptimizer;
    private final MockFunnelDataGenerator mockDataGenerator;
    private final Optional<InsightNarrator> insightNarrator;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public FunnelAnalysisService(FunnelAnalysisConfig config,
                                 BaselineCalculator baselineCalculator,
                                 DimensionAggregator dimensionAggregator,
                                 OutlierDetector outlierDetector,
                                 FingerprintCache fingerprintCache,
                                 HistoricalSummarizer historicalSummarizer,
                                 PayloadOptimizer payloadOptimizer,
                                 MockFunnelDataGenerator mockDataGenerator,
                                 Optional<InsightNarrator> insightNarrator,
                                 Tracer tracer,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.config = config;
        this.baselineCalculator = baselineCalculator;
        this.dimensionAggregator = dimensionAggregator;
        this.outlierDetector = outlierDetector;
        this.fingerprintCache = fingerprintCache;
        this.historicalSummarizer = historicalSummarizer;
        this.payloadOptimizer = payloadOptimizer;
        this.mockDataGenerator = mockDataGenerator;
        this.insightNarrator = insightNarrator;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if no records are supplied and mock data is not requested,
     *                                  or a dimension name is blank
     * @throws com.funnel.insights.exception.InsufficientDataException if the records have no views
     */
    @Observed(name = "funnel.analyze", contextualName = "analyze-funnel")
    public AnalysisResponse analyze(AnalysisRequest request) {
        List<String> dimensions = resolveDimensions(request.getDimensions());
        List<FunnelRecord> input = resolveRecords(request);

        List<FunnelRecord> records = input;
        boolean summarized = false;
        if (input.size() > config.getHistory().getSummarizeThreshold()) {
            HistoricalWindow window = historicalSummarizer.summarize(input);
            records = window.combined();
            summarized = window.getOlderRecordCount() > 0;
        }

        BaselineRates baseline = baselineCalculator.calculate(records);

        CacheKeyInputs keyInputs = CacheKeyInputs.builder()
                .dimensions(dimensions)
                .propertyId(request.getPropertyId())
                .dateRange(request.getDateRange())
                .baseline(baseline)
                .build();

        List<FunnelRecord> analyzed = records;
        CacheLookup<FunnelAnalysisResult> lookup = fingerprintCache.getOrCompute(keyInputs, FunnelAnalysisResult.class,
                () -> computeAnalysis(request.getPropertyId(), request.getDateRange(), dimensions, analyzed, baseline));

        FunnelAnalysisResult result = lookup.getValue();
        OptimizationResult optimization = payloadOptimizer.optimize(result);

        log.info("Funnel analysis for property={} range={}: {} records ({} analyzed), {} outliers, cache={}",
                request.getPropertyId(), request.getDateRange(), input.size(), records.size(),
                result.getOutliers().size(), lookup.getOutcome());

        return AnalysisResponse.builder()
                .result(result)
                .optimized(optimization.getPayload())
                .cacheUsed(lookup.isCacheUsed())
                .cacheOutcome(lookup.getOutcome())
                .cacheKey(lookup.getFingerprint())
                .originalSize(optimization.getOriginalSize())
                .optimizedSize(optimization.getOptimizedSize())
                .savingsPercent(optimization.getSavingsPercent())
                .summarized(summarized)
                .inputRecordCount(input.size())
                .analyzedRecordCount(records.size())
                .build();
    }

    /**
     * Aggregates every dimension, detects outliers against {@code baseline} and
     * attaches a narrative when a narrator is registered. Uncached.
     */
    public FunnelAnalysisResult computeAnalysis(String propertyId, String dateRange, List<String> dimensions,
                                                List<FunnelRecord> records, BaselineRates baseline) {
        Map<String, Map<String, DimensionMetric>> metrics = new TreeMap<>();
        Set<Outlier> outliers = new LinkedHashSet<>();
        List<DimensionFailure> failures = new ArrayList<>();

        for (String dimension : dimensions) {
            Span span = tracer.nextSpan()
                    .name("funnel.dimension." + dimension)
                    .tag("dimension", dimension)
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Map<String, DimensionMetric> values = dimensionAggregator.aggregate(records, dimension);
                Set<Outlier> found = outlierDetector.detect(baseline, values);
                metrics.put(dimension, values);
                outliers.addAll(found);
                found.forEach(o -> metricsConfig.recordOutlier(o.getSeverity(), o.isLowConfidence()));

                span.tag("dimension.values", String.valueOf(values.size()));
                span.tag("dimension.outliers", String.valueOf(found.size()));
            } catch (UnknownDimensionException e) {
                span.error(e);
                log.warn("Skipping dimension {}: {}", dimension, e.getMessage());
                failures.add(DimensionFailure.builder()
                        .dimension(dimension)
                        .reason(e.getMessage())
                        .recordCount(e.getRecordCount())
                        .build());
                metricsConfig.recordDimensionFailure(dimension);
            } finally {
                span.end();
            }
        }

        int topN = config.getPayload().getTopN();
        FunnelAnalysisResult result = FunnelAnalysisResult.builder()
                .propertyId(propertyId)
                .dateRange(dateRange)
                .dimensions(dimensions)
                .baseline(baseline)
                .metrics(metrics)
                .outliers(OutlierRanking.byMagnitude(outliers))
                .criticalIssues(OutlierRanking.criticalIssues(outliers, topN))
                .opportunities(OutlierRanking.opportunities(outliers, topN))
                .failures(failures)
                .recordCount(records.size())
                .computedAt(clock.millis())
                .build();

        insightNarrator.ifPresent(narrator -> attachNarrative(narrator, result));
        return result;
    }

    private void attachNarrative(InsightNarrator narrator, FunnelAnalysisResult result) {
        try {
            narrator.narrate(result).ifPresent(result::setNarrative);
        } catch (RuntimeException e) {
            // Narrative is optional; the metrics are still worth returning
            log.warn("Insight narrator {} failed, returning analysis without narrative: {}",
                    narrator.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    List<String> resolveDimensions(List<String> requested) {
        List<String> source = requested == null || requested.isEmpty() ? config.getDefaultDimensions() : requested;
        Set<String> distinct = new LinkedHashSet<>();
        for (String dimension : source) {
            if (dimension == null || dimension.isBlank()) {
                throw new IllegalArgumentException("Dimension names must not be blank");
            }
            distinct.add(dimension.trim());
        }
        // Sorted so that requests differing only in order produce identical results
        return distinct.stream().sorted().toList();
    }

    private List<FunnelRecord> resolveRecords(AnalysisRequest request) {
        if (request.getRecords() != null && !request.getRecords().isEmpty()) {
            return request.getRecords();
        }
        if (request.isUseMockData()) {
            return mockDataGenerator.generate(LocalDate.now(clock));
        }
        throw new IllegalArgumentException("No records supplied and useMockData is false");
    }
}
