package com.dfdscan.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Executive summary отчета: количество угроз по уровням и общий риск
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSummary {
    private int totalThreats;
    private int criticalThreats;
    private int highThreats;
    private int mediumThreats;
    private int lowThreats;
    private Severity overallRisk;
}
