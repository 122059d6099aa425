package com.dfdscan.reports;

import com.dfdscan.config.ScannerConfig;
import com.dfdscan.models.Dataflow;
import com.dfdscan.models.DataflowAnalysis;
import com.dfdscan.models.DfdElement;
import com.dfdscan.models.DfdModel;
import com.dfdscan.models.ElementAnalysis;
import com.dfdscan.models.Recommendation;
import com.dfdscan.models.ReportSummary;
import com.dfdscan.models.RiskSummary;
import com.dfdscan.models.Severity;
import com.dfdscan.models.StrideCategory;
import com.dfdscan.models.SubjectKind;
import com.dfdscan.models.SubjectRef;
import com.dfdscan.models.ThreatFinding;
import com.dfdscan.models.ThreatModel;
import com.dfdscan.models.ThreatReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Построение отчета по модели угроз: executive summary, группировка по объектам,
 * разбивка по STRIDE и приоритизированные рекомендации
 */
@Slf4j
public class ThreatReportGenerator {

    private final String titlePrefix;

    public ThreatReportGenerator() {
        this(ScannerConfig.load());
    }

    public ThreatReportGenerator(ScannerConfig config) {
        this.titlePrefix = config.getReport().getTitlePrefix();
    }

    public ThreatReport generateReport(ThreatModel threatModel, DfdModel dfd) {
        if (threatModel == null || dfd == null) {
            throw new IllegalArgumentException("ThreatModel и DFD обязательны для отчета");
        }
        log.info("Формирование отчета по DFD '{}'", dfd.getName());

        List<ThreatFinding> findings = threatModel.getFindings();

        ThreatReport report = ThreatReport.builder()
            .title(titlePrefix + dfd.getName())
            .description(dfd.getDescription())
            .generatedAt(Instant.now())
            .executiveSummary(buildSummary(threatModel))
            .elementsAnalysis(analyzeElements(threatModel, dfd))
            .dataflowAnalysis(analyzeDataflows(threatModel, dfd))
            .strideBreakdown(breakdownByStride(findings))
            .recommendations(buildRecommendations(threatModel))
            .build();

        log.info("Отчет сформирован: общий риск {}, рекомендаций {}",
            report.getExecutiveSummary().getOverallRisk().getLabel(), report.getRecommendations().size());
        return report;
    }

    static ReportSummary buildSummary(ThreatModel threatModel) {
        RiskSummary risk = threatModel.getRiskSummary();
        Severity overall;
        if (risk.getCritical() > 0) {
            overall = Severity.CRITICAL;
        } else if (risk.getHigh() > 0) {
            overall = Severity.HIGH;
        } else {
            overall = Severity.MEDIUM;
        }
        return ReportSummary.builder()
            .totalThreats(threatModel.getTotalThreats())
            .criticalThreats(risk.getCritical())
            .highThreats(risk.getHigh())
            .mediumThreats(risk.getMedium())
            .lowThreats(risk.getLow())
            .overallRisk(overall)
            .build();
    }

    private static List<ElementAnalysis> analyzeElements(ThreatModel threatModel, DfdModel dfd) {
        List<ElementAnalysis> result = new ArrayList<>();
        if (dfd.getElements() == null) {
            return result;
        }
        for (DfdElement element : dfd.getElements()) {
            List<ThreatFinding> threats = threatModel.findingsFor(SubjectKind.ELEMENT, element.getId());
            if (threats.isEmpty()) {
                continue;
            }
            result.add(ElementAnalysis.builder()
                .elementId(element.getId())
                .elementName(element.getName())
                .elementType(SubjectRef.of(element).getType())
                .threatCount(threats.size())
                .threats(threats)
                .build());
        }
        return result;
    }

    private static List<DataflowAnalysis> analyzeDataflows(ThreatModel threatModel, DfdModel dfd) {
        List<DataflowAnalysis> result = new ArrayList<>();
        if (dfd.getDataflows() == null) {
            return result;
        }
        for (Dataflow dataflow : dfd.getDataflows()) {
            List<ThreatFinding> threats = threatModel.findingsFor(SubjectKind.DATAFLOW, dataflow.getId());
            if (threats.isEmpty()) {
                continue;
            }
            result.add(DataflowAnalysis.builder()
                .dataflowId(dataflow.getId())
                .dataflowName(dataflow.getName())
                .from(dataflow.getFrom())
                .to(dataflow.getTo())
                .threatCount(threats.size())
                .threats(threats)
                .build());
        }
        return result;
    }

    /**
     * Угроза с несколькими категориями STRIDE попадает в каждую; пустые категории отбрасываются
     */
    static Map<String, List<ThreatFinding>> breakdownByStride(List<ThreatFinding> findings) {
        Map<StrideCategory, List<ThreatFinding>> buckets = new EnumMap<>(StrideCategory.class);
        for (StrideCategory category : StrideCategory.values()) {
            buckets.put(category, new ArrayList<>());
        }
        if (findings != null) {
            for (ThreatFinding finding : findings) {
                if (finding.getStride() == null) {
                    continue;
                }
                for (StrideCategory category : finding.getStride()) {
                    buckets.get(category).add(finding);
                }
            }
        }

        Map<String, List<ThreatFinding>> breakdown = new LinkedHashMap<>();
        buckets.forEach((category, threats) -> {
            if (!threats.isEmpty()) {
                breakdown.put(category.getLabel(), threats);
            }
        });
        return breakdown;
    }

    static List<Recommendation> buildRecommendations(ThreatModel threatModel) {
        List<Recommendation> recommendations = new ArrayList<>();
        int critical = threatModel.findingsWithSeverity(Severity.CRITICAL).size();
        int high = threatModel.findingsWithSeverity(Severity.HIGH).size();

        if (critical > 0) {
            recommendations.add(Recommendation.builder()
                .priority(Severity.CRITICAL)
                .action(String.format("Address %d critical threats immediately", critical))
                .details("Critical threats pose immediate risk to system security and data integrity")
                .timeline("Immediate (within 24-48 hours)")
                .build());
        }

        if (high > 0) {
            recommendations.add(Recommendation.builder()
                .priority(Severity.HIGH)
                .action(String.format("Implement mitigations for %d high-severity threats", high))
                .details("High threats should be addressed in the next development cycle")
                .timeline("Within 1-2 sprints")
                .build());
        }

        recommendations.add(Recommendation.builder()
            .priority(Severity.MEDIUM)
            .action("Implement security best practices")
            .details("Follow OWASP top 10 principles and secure coding standards")
            .timeline("Ongoing")
            .build());

        recommendations.add(Recommendation.builder()
            .priority(Severity.LOW)
            .action("Conduct security awareness training")
            .details("Train team on threat modeling and secure development")
            .timeline("Quarterly")
            .build());

        return recommendations;
    }
}
