package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Шаблон угрозы из библиотеки.
 * Применимость задается либо списком типов элементов (targets),
 * либо флагом appliesToDataflow с необязательным списком протоколов.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ThreatPattern {
    String id;
    String title;
    String description;
    String category;
    List<StrideCategory> stride;
    Severity severity;
    String impact;
    List<String> targets;
    boolean appliesToDataflow;
    List<String> protocols;
    List<String> mitigations;
    List<String> references;
    String owaspCategory;

    /**
     * Применим ли шаблон к элементу указанного типа.
     * Шаблон без targets применим к любому элементу.
     */
    public boolean appliesToElement(String rawType, ElementType normalizedType) {
        if (targets == null || targets.isEmpty()) {
            return true;
        }
        if (normalizedType != null && targets.contains(normalizedType.getValue())) {
            return true;
        }
        return rawType != null && targets.contains(rawType);
    }

    /**
     * Применим ли шаблон к потоку с указанным протоколом.
     * Список протоколов сравнивается с учетом регистра.
     */
    public boolean appliesToProtocol(String protocol) {
        if (!appliesToDataflow) {
            return false;
        }
        if (protocols == null || protocols.isEmpty()) {
            return true;
        }
        return protocol != null && protocols.contains(protocol);
    }

    public boolean hasStride(StrideCategory category) {
        return stride != null && stride.contains(category);
    }
}
