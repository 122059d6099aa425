package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Уровни критичности угроз.
 * Ранг задает порядок сортировки: CRITICAL(0) идет первым.
 */
public enum Severity {
    CRITICAL("Critical", "Критический", 0),
    HIGH("High", "Высокий", 1),
    MEDIUM("Medium", "Средний", 2),
    LOW("Low", "Низкий", 3);

    private final String label;
    private final String russianName;
    private final int rank;

    Severity(String label, String russianName, int rank) {
        this.label = label;
        this.russianName = russianName;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Вернуть более критичный из двух уровней (нижняя граница)
     */
    public Severity atLeast(Severity floor) {
        if (floor == null) {
            return this;
        }
        return floor.rank < this.rank ? floor : this;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Неизвестный уровень критичности: " + value);
    }
}
