package com.dfdscan.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Сводка по DFD: структурная валидация, проблемы безопасности и полнота описания
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DfdSummary {
    private ValidationResult validation;
    private SecurityValidation security;
    private Completeness completeness;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Completeness {
        private boolean hasDescription;
        private boolean hasTrustBoundaries;
        private boolean allElementsConnected;
        private boolean allDataflowsSecured;
    }
}
