package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Категории STRIDE в фиксированном порядке
 */
public enum StrideCategory {
    SPOOFING("Spoofing"),
    TAMPERING("Tampering"),
    REPUDIATION("Repudiation"),
    INFORMATION_DISCLOSURE("Information Disclosure"),
    DENIAL_OF_SERVICE("Denial of Service"),
    ELEVATION_OF_PRIVILEGE("Elevation of Privilege");

    private final String label;

    StrideCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Найти категорию по отображаемому имени или имени константы, null если не найдена
     */
    public static StrideCategory fromLabel(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (StrideCategory category : values()) {
            if (category.label.equalsIgnoreCase(trimmed) || category.name().equalsIgnoreCase(trimmed)) {
                return category;
            }
        }
        return null;
    }

    @JsonCreator
    public static StrideCategory fromJson(String value) {
        StrideCategory category = fromLabel(value);
        if (category == null) {
            throw new IllegalArgumentException("Неизвестная категория STRIDE: " + value);
        }
        return category;
    }
}
