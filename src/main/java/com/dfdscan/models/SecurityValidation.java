package com.dfdscan.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат проверки DFD на проблемы безопасности (независимо от структурной валидности)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityValidation {
    private boolean hasSecurityIssues;
    @Builder.Default
    private List<SecurityIssue> issues = new ArrayList<>();
}
