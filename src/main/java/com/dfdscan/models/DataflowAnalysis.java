package com.dfdscan.models;

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
public class DataflowAnalysis {
    private String dataflowId;
    private String dataflowName;
    private String from;
    private String to;
    private int threatCount;
    @Builder.Default
    private List<ThreatFinding> threats = new ArrayList<>();
}
