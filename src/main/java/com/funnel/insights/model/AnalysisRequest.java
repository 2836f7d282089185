package com.funnel.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel analysis request")
public class AnalysisRequest {

    @Schema(description = "Upstream analytics property identifier", example = "123456789")
    private String propertyId;

    @Schema(description = "Date range label of the records", example = "last_30_days")
    private String dateRange;

    @Schema(description = "Dimensions to break down. Defaults to funnel.default-dimensions when empty",
            example = "[\"channel\", \"device\"]")
    @Builder.Default
    private List<String> dimensions = new ArrayList<>();

    @Schema(description = "Raw or historical funnel records")
    @Builder.Default
    private List<FunnelRecord> records = new ArrayList<>();

    @Schema(description = "Generate deterministic mock records when none are supplied", example = "false")
    private boolean useMockData;
}
