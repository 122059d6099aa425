package com.dfdscan.models;

import lombok.Data;

import java.util.List;

/**
 * Количество угроз по уровням критичности
 */
@Data
public class RiskSummary {
    private int critical;
    private int high;
    private int medium;
    private int low;

    public static RiskSummary tally(List<ThreatFinding> findings) {
        RiskSummary summary = new RiskSummary();
        if (findings != null) {
            findings.forEach(f -> summary.increment(f.getSeverity()));
        }
        return summary;
    }

    public void increment(Severity severity) {
        if (severity == null) {
            throw new IllegalArgumentException("Угроза без уровня критичности");
        }
        switch (severity) {
            case CRITICAL -> critical++;
            case HIGH -> high++;
            case MEDIUM -> medium++;
            case LOW -> low++;
        }
    }

    public int count(Severity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }

    public int total() {
        return critical + high + medium + low;
    }
}
