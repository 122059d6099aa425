package com.dfdscan.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Модель угроз для одной DFD.
 * Угрозы отсортированы по убыванию критичности, при равенстве в порядке обнаружения.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatModel {
    private String id;
    private String dfdId;
    private String dfdName;
    @Builder.Default
    private List<ThreatFinding> findings = new ArrayList<>();
    private int totalThreats;
    @Builder.Default
    private RiskSummary riskSummary = new RiskSummary();
    private Instant createdAt;
    @Builder.Default
    private boolean owaspMapped = true;

    public List<ThreatFinding> findingsFor(SubjectKind kind, String subjectId) {
        return findings.stream()
            .filter(f -> f.getSubject() != null && f.getSubject().refersTo(kind, subjectId))
            .collect(Collectors.toList());
    }

    public List<ThreatFinding> findingsWithSeverity(Severity severity) {
        return findings.stream()
            .filter(f -> f.getSeverity() == severity)
            .collect(Collectors.toList());
    }
}
