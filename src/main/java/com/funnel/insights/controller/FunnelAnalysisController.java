package com.funnel.insights.controller;

import com.funnel.insights.cache.FingerprintCache;
import com.funnel.insights.exception.CacheUnavailableException;
import com.funnel.insights.exception.InsufficientDataException;
import com.funnel.insights.model.AnalysisRequest;
import com.funnel.insights.model.AnalysisResponse;
import com.funnel.insights.service.FunnelAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/funnel")
@Tag(name = "Funnel Analysis", description = "Conversion baseline, dimension outliers and analysis cache")
public class FunnelAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(FunnelAnalysisController.class);

    private final FunnelAnalysisService analysisService;
    private final FingerprintCache fingerprintCache;

    public FunnelAnalysisController(FunnelAnalysisService analysisService, FingerprintCache fingerprintCache) {
        this.analysisService = analysisService;
        this.fingerprintCache = fingerprintCache;
    }

    @PostMapping("/analyze")
    @Operation(summary = "Analyze funnel records",
               description = "Computes baseline rates, per-dimension metrics and outliers. "
                       + "Results are cached by input fingerprint for the configured TTL.")
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "request body is required"));
        }
        if ((request.getRecords() == null || request.getRecords().isEmpty()) && !request.isUseMockData()) {
            return ResponseEntity.badRequest().body(Map.of("error", "records are required unless useMockData is true"));
        }

        try {
            AnalysisResponse response = analysisService.analyze(request);
            return ResponseEntity.ok(response);
        } catch (InsufficientDataException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("recordCount", e.getRecordCount());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/cache/stats")
    @Operation(summary = "Cache statistics",
               description = "Entry count, oldest/newest entry, TTL and hit/miss/bypass counters")
    public ResponseEntity<?> cacheStats() {
        try {
            return ResponseEntity.ok(fingerprintCache.stats());
        } catch (CacheUnavailableException e) {
            log.warn("Cache stats unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear the analysis cache")
    public ResponseEntity<?> clearCache() {
        try {
            int removed = fingerprintCache.clear();
            return ResponseEntity.ok(Map.of("removed", removed));
        } catch (CacheUnavailableException e) {
            log.warn("Cache clear failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }
}
