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
public class ElementAnalysis {
    private String elementId;
    private String elementName;
    private String elementType;
    private int threatCount;
    @Builder.Default
    private List<ThreatFinding> threats = new ArrayList<>();
}
