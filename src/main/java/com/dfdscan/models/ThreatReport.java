package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Отчет по модели угроз
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatReport {
    private String title;
    private String description;
    private Instant generatedAt;

    @JsonProperty("executive_summary")
    private ReportSummary executiveSummary;

    @Builder.Default
    @JsonProperty("elements_analysis")
    private List<ElementAnalysis> elementsAnalysis = new ArrayList<>();

    @Builder.Default
    @JsonProperty("dataflow_analysis")
    private List<DataflowAnalysis> dataflowAnalysis = new ArrayList<>();

    /**
     * Ключи: отображаемые имена категорий STRIDE, пустые категории не включаются
     */
    @Builder.Default
    @JsonProperty("stride_breakdown")
    private Map<String, List<ThreatFinding>> strideBreakdown = new LinkedHashMap<>();

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();
}
