package com.dfdscan.core;

import com.dfdscan.config.ScannerConfig;
import com.dfdscan.models.Dataflow;
import com.dfdscan.models.DfdElement;
import com.dfdscan.models.DfdModel;
import com.dfdscan.models.DfdSummary;
import com.dfdscan.models.SecurityIssue;
import com.dfdscan.models.SecurityValidation;
import com.dfdscan.models.Severity;
import com.dfdscan.models.TrustLevel;
import com.dfdscan.models.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Валидатор DFD.
 *
 * Проверяет структурную целостность диаграммы (ошибки блокируют генерацию угроз)
 * и гигиену безопасности (предупреждения, генерацию не блокируют).
 * Никогда не бросает исключений: все проблемы возвращаются в результате.
 * Входная диаграмма не изменяется, роли элементов вычисляются из типа.
 */
@Slf4j
public class DfdValidator {

    static final String NOT_CONNECTED_MARKER = "is not connected to any dataflow";

    private final Set<String> insecureProtocols;

    public DfdValidator() {
        this(ScannerConfig.load());
    }

    public DfdValidator(ScannerConfig config) {
        this.insecureProtocols = config.getValidation().insecureProtocolSet();
    }

    /**
     * Структурная валидация и рекомендательные предупреждения
     */
    public ValidationResult validate(DfdModel dfd) {
        if (dfd == null) {
            return ValidationResult.builder()
                .valid(false)
                .errors(new ArrayList<>(List.of("DFD object is required")))
                .build();
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (isBlank(dfd.getId())) errors.add("DFD ID is required");
        if (isBlank(dfd.getName())) errors.add("DFD name is required");
        if (dfd.getElements() == null || dfd.getElements().isEmpty()) {
            errors.add("DFD must have at least one element");
        }
        if (dfd.getDataflows() == null) {
            errors.add("DFD must have dataflows array");
        }

        Set<String> elementIds = new HashSet<>();
        if (dfd.getElements() != null) {
            validateElements(dfd.getElements(), elementIds, errors, warnings);
        }
        if (dfd.getDataflows() != null) {
            validateDataflows(dfd.getDataflows(), elementIds, errors, warnings);
        }

        // Элементы без потоков
        if (dfd.getElements() != null && dfd.getDataflows() != null) {
            Set<String> connected = new HashSet<>();
            for (Dataflow dataflow : dfd.getDataflows()) {
                if (dataflow == null) {
                    continue;
                }
                connected.add(dataflow.getFrom());
                connected.add(dataflow.getTo());
            }
            for (DfdElement element : dfd.getElements()) {
                if (element != null && !connected.contains(element.getId())) {
                    warnings.add(String.format("Element '%s' %s", element.getName(), NOT_CONNECTED_MARKER));
                }
            }
        }

        if (dfd.trustBoundaryCount() == 0) {
            warnings.add("No trust boundaries defined. Consider adding trust boundaries to your DFD");
        }

        boolean valid = errors.isEmpty();
        if (valid) {
            log.debug("DFD '{}' валидна, предупреждений: {}", dfd.getName(), warnings.size());
        } else {
            log.warn("DFD '{}' не прошла валидацию: {} ошибок", dfd.getName(), errors.size());
        }

        return ValidationResult.builder()
            .valid(valid)
            .errors(errors)
            .warnings(warnings)
            .elementCount(dfd.elementCount())
            .dataflowCount(dfd.dataflowCount())
            .trustBoundaryCount(dfd.trustBoundaryCount())
            .build();
    }

    private void validateElements(List<DfdElement> elements, Set<String> elementIds,
                                  List<String> errors, List<String> warnings) {
        for (int index = 0; index < elements.size(); index++) {
            DfdElement element = elements.get(index);
            if (element == null) {
                errors.add(String.format("Element %d is null", index));
                continue;
            }
            if (isBlank(element.getId())) errors.add(String.format("Element %d missing required field: id", index));
            if (isBlank(element.getName())) errors.add(String.format("Element %d missing required field: name", index));
            if (isBlank(element.getType())) {
                errors.add(String.format("Element %d missing required field: type", index));
            } else if (element.getElementType() == null) {
                errors.add(String.format("Element %d has invalid type: %s", index, element.getType()));
            }

            if (!isBlank(element.getId()) && !elementIds.add(element.getId())) {
                errors.add("Duplicate element ID: " + element.getId());
            }

            if (element.isDatastore() && isBlank(element.getDescription())) {
                warnings.add(String.format("Datastore '%s' should have description", element.getName()));
            }
        }
    }

    private void validateDataflows(List<Dataflow> dataflows, Set<String> elementIds,
                                   List<String> errors, List<String> warnings) {
        Set<String> dataflowIds = new HashSet<>();
        for (int index = 0; index < dataflows.size(); index++) {
            Dataflow dataflow = dataflows.get(index);
            if (dataflow == null) {
                errors.add(String.format("Dataflow %d is null", index));
                continue;
            }
            if (isBlank(dataflow.getId())) errors.add(String.format("Dataflow %d missing required field: id", index));
            if (isBlank(dataflow.getFrom())) errors.add(String.format("Dataflow %d missing required field: from", index));
            if (isBlank(dataflow.getTo())) errors.add(String.format("Dataflow %d missing required field: to", index));
            if (isBlank(dataflow.getName())) errors.add(String.format("Dataflow %d missing required field: name", index));

            if (!isBlank(dataflow.getId()) && !dataflowIds.add(dataflow.getId())) {
                errors.add("Duplicate dataflow ID: " + dataflow.getId());
            }

            if (!isBlank(dataflow.getFrom()) && !elementIds.contains(dataflow.getFrom())) {
                errors.add(String.format("Dataflow '%s': source element '%s' not found",
                    dataflow.getName(), dataflow.getFrom()));
            }
            if (!isBlank(dataflow.getTo()) && !elementIds.contains(dataflow.getTo())) {
                errors.add(String.format("Dataflow '%s': destination element '%s' not found",
                    dataflow.getName(), dataflow.getTo()));
            }

            if (dataflow.carriesSensitiveData() && !dataflow.encrypted()) {
                warnings.add(String.format("Dataflow '%s' carries sensitive data but is not encrypted",
                    dataflow.getName()));
            }
            String protocol = dataflow.normalizedProtocol();
            if (protocol != null && insecureProtocols.contains(protocol)) {
                warnings.add(String.format("Dataflow '%s' uses unencrypted protocol: %s",
                    dataflow.getName(), dataflow.getProtocol()));
            }
            if (dataflow.crossesNetwork() && !dataflow.hasAuthentication()) {
                warnings.add(String.format("Dataflow '%s' crosses network boundary but lacks authentication",
                    dataflow.getName()));
            }
        }
    }

    /**
     * Проверка проблем безопасности, независимо от структурной валидности
     */
    public SecurityValidation validateSecurity(DfdModel dfd) {
        List<SecurityIssue> issues = new ArrayList<>();
        if (dfd == null) {
            return SecurityValidation.builder().hasSecurityIssues(false).issues(issues).build();
        }

        if (dfd.getDataflows() != null) {
            for (Dataflow dataflow : dfd.getDataflows()) {
                if (dataflow == null) {
                    continue;
                }
                if (dataflow.carriesSensitiveData() && !dataflow.encrypted()) {
                    issues.add(SecurityIssue.builder()
                        .severity(Severity.HIGH)
                        .message("Sensitive data in unencrypted dataflow: " + dataflow.getName())
                        .recommendation("Enable encryption (TLS 1.2+) for this dataflow")
                        .build());
                }
                if ("http".equals(dataflow.normalizedProtocol())) {
                    issues.add(SecurityIssue.builder()
                        .severity(Severity.HIGH)
                        .message("Insecure protocol HTTP used in dataflow: " + dataflow.getName())
                        .recommendation("Use HTTPS instead of HTTP")
                        .build());
                }
            }
        }

        if (dfd.getElements() != null) {
            for (DfdElement element : dfd.getElements()) {
                if (element == null) {
                    continue;
                }
                if (element.isDatastore() && isBlank(element.getTrustLevel())) {
                    issues.add(SecurityIssue.builder()
                        .severity(Severity.MEDIUM)
                        .message(String.format("Datastore '%s' has no trust level defined", element.getName()))
                        .recommendation("Define appropriate trust level (trusted/partially-trusted/untrusted)")
                        .build());
                }
                if (element.isExternalEntity() && element.getTrust() == TrustLevel.TRUSTED) {
                    issues.add(SecurityIssue.builder()
                        .severity(Severity.MEDIUM)
                        .message(String.format("External entity '%s' marked as trusted", element.getName()))
                        .recommendation("External entities should be marked as untrusted by default")
                        .build());
                }
            }
        }

        return SecurityValidation.builder()
            .hasSecurityIssues(!issues.isEmpty())
            .issues(issues)
            .build();
    }

    /**
     * Сводка: структурная валидация + проблемы безопасности + полнота описания
     */
    public DfdSummary getSummary(DfdModel dfd) {
        ValidationResult validation = validate(dfd);
        SecurityValidation security = validateSecurity(dfd);

        List<String> orphanWarnings = validation.getWarnings().stream()
            .filter(Objects::nonNull)
            .filter(w -> w.contains(NOT_CONNECTED_MARKER))
            .collect(Collectors.toList());

        DfdSummary.Completeness completeness = DfdSummary.Completeness.builder()
            .hasDescription(dfd != null && !isBlank(dfd.getDescription()))
            .hasTrustBoundaries(dfd != null && dfd.trustBoundaryCount() > 0)
            .allElementsConnected(orphanWarnings.isEmpty())
            .allDataflowsSecured(security.getIssues().isEmpty())
            .build();

        return DfdSummary.builder()
            .validation(validation)
            .security(security)
            .completeness(completeness)
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
