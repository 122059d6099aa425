package com.dfdscan.integration;

import com.dfdscan.models.RiskSummary;
import com.dfdscan.models.ThreatModel;
import com.dfdscan.models.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Интеграция с CI/CD системами: коды возврата и краткая сводка
 */
@Slf4j
public final class CICDIntegration {

    public static final int EXIT_OK = 0;
    public static final int EXIT_THREATS = 1;
    public static final int EXIT_INVALID_DFD = 2;

    private CICDIntegration() {}

    /**
     * Определить exit code на основе модели угроз
     *
     * @param model модель угроз
     * @param failOnCritical прерывать ли сборку при CRITICAL угрозах
     * @param failOnHigh прерывать ли сборку при HIGH угрозах
     * @return 0 = успех, 1 = провал
     */
    public static int getExitCode(ThreatModel model, boolean failOnCritical, boolean failOnHigh) {
        if (model == null) {
            log.warn("Модель угроз null, возвращаем код успеха");
            return EXIT_OK;
        }
        RiskSummary risk = model.getRiskSummary();
        if (failOnCritical && risk.getCritical() > 0) {
            log.error("Обнаружено {} CRITICAL угроз. Сборка провалена.", risk.getCritical());
            return EXIT_THREATS;
        }
        if (failOnHigh && (risk.getCritical() > 0 || risk.getHigh() > 0)) {
            log.error("Обнаружены HIGH угрозы. Сборка провалена.");
            return EXIT_THREATS;
        }
        return EXIT_OK;
    }

    /**
     * Вывести ошибки валидации DFD (отказ в обработке)
     */
    public static void printValidationFailure(ValidationResult validation, PrintStream out) {
        out.println("\n=== DFD Validation Failed ===");
        validation.getErrors().forEach(e -> out.println("  ERROR:   " + e));
        validation.getWarnings().forEach(w -> out.println("  WARNING: " + w));
        out.println("=============================\n");
    }

    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(ThreatModel model, ValidationResult validation, PrintStream out) {
        if (model == null) {
            log.warn("Модель угроз null, пропускаем вывод");
            return;
        }
        RiskSummary risk = model.getRiskSummary();
        out.println("\n=== DFD Threat Model Summary ===");
        out.println("DFD: " + (model.getDfdName() != null ? model.getDfdName() : "Unknown")
            + " (" + model.getDfdId() + ")");
        out.println("Generated: " + (model.getCreatedAt() != null ? model.getCreatedAt() : "N/A"));
        out.println("\nThreats:");
        out.println("  CRITICAL: " + risk.getCritical());
        out.println("  HIGH:     " + risk.getHigh());
        out.println("  MEDIUM:   " + risk.getMedium());
        out.println("  LOW:      " + risk.getLow());
        out.println("\nTotal: " + model.getTotalThreats() + " threats");
        if (validation != null) {
            out.println("Validation warnings: " + validation.getWarnings().size());
        }
        out.println("================================\n");
    }
}
