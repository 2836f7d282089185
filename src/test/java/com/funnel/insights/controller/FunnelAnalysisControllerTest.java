package com.funnel.insights.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnel.insights.cache.FingerprintCache;
import com.funnel.insights.exception.CacheUnavailableException;
import com.funnel.insights.exception.InsufficientDataException;
import com.funnel.insights.model.*;
import com.funnel.insights.service.FunnelAnalysisService;
import com.funnel.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FunnelAnalysisController.class)
class FunnelAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FunnelAnalysisService analysisService;

    @MockBean
    private FingerprintCache fingerprintCache;

    @Test
    void analyze_success() throws Exception {
        AnalysisResponse response = AnalysisResponse.builder()
                .result(FunnelAnalysisResult.builder()
                        .propertyId("123")
                        .baseline(TestDataFactory.baseline(0.2, 0.15))
                        .criticalIssues(List.of(TestDataFactory.outlier("channel", "Social",
                                FunnelStage.VIEW_TO_CART, -0.5, Severity.CRITICAL)))
                        .build())
                .optimized(OptimizedPayload.builder().build())
                .cacheUsed(true)
                .cacheOutcome(CacheOutcome.HIT)
                .cacheKey("abc")
                .build();
        when(analysisService.analyze(any())).thenReturn(response);

        mockMvc.perform(post("/api/v1/funnel/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheUsed").value(true))
                .andExpect(jsonPath("$.cacheOutcome").value("HIT"))
                .andExpect(jsonPath("$.result.criticalIssues[0].value").value("Social"))
                .andExpect(jsonPath("$.result.criticalIssues[0].severity").value("CRITICAL"));
    }

    @Test
    void analyze_acceptsDimensionValuesAsPlainStrings() throws Exception {
        when(analysisService.analyze(any())).thenReturn(AnalysisResponse.builder().build());
        String body = """
                {"propertyId": "123", "dimensions": ["channel"],
                 "records": [{"dimensions": {"channel": "Social"}, "viewItem": 100, "addToCart": 10,
                              "purchase": 1, "date": "2025-02-18"}]}
                """;

        mockMvc.perform(post("/api/v1/funnel/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());
    }

    @Test
    void analyze_noRecordsAndNoMockData_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/funnel/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"propertyId\": \"123\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verify(analysisService, never()).analyze(any());
    }

    @Test
    void analyze_insufficientData_returns422() throws Exception {
        when(analysisService.analyze(any()))
                .thenThrow(new InsufficientDataException("Total view_item count is zero", 2));

        mockMvc.perform(post("/api/v1/funnel/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.recordCount").value(2));
    }

    @Test
    void analyze_illegalArgument_returns400() throws Exception {
        when(analysisService.analyze(any())).thenThrow(new IllegalArgumentException("Dimension names must not be blank"));

        mockMvc.perform(post("/api/v1/funnel/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Dimension names must not be blank"));
    }

    @Test
    void cacheStats_success() throws Exception {
        when(fingerprintCache.stats()).thenReturn(CacheStats.builder()
                .backend("MEMORY").totalEntries(3).ttlSeconds(86_400).hits(5).misses(3).build());

        mockMvc.perform(get("/api/v1/funnel/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("MEMORY"))
                .andExpect(jsonPath("$.totalEntries").value(3))
                .andExpect(jsonPath("$.ttlSeconds").value(86400));
    }

    @Test
    void cacheStats_backendDown_returns503() throws Exception {
        when(fingerprintCache.stats()).thenThrow(new CacheUnavailableException("scan failed", null));

        mockMvc.perform(get("/api/v1/funnel/cache/stats"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void clearCache_success() throws Exception {
        when(fingerprintCache.clear()).thenReturn(4);

        mockMvc.perform(delete("/api/v1/funnel/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));
    }

    private static AnalysisRequest request() {
        return AnalysisRequest.builder()
                .propertyId("123")
                .dateRange("last_30_days")
                .dimensions(List.of("channel"))
                .records(TestDataFactory.socialEmailScenario())
                .build();
    }
}
