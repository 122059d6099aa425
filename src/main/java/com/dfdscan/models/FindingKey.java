package com.dfdscan.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Стабильный ключ угрозы: id объекта и id правила.
 * В отличие от id угрозы, сохраняется между повторными генерациями по одной DFD.
 */
@Getter
@EqualsAndHashCode
public final class FindingKey {
    private final String subjectId;
    private final String ruleId;

    public FindingKey(String subjectId, String ruleId) {
        this.subjectId = subjectId;
        this.ruleId = ruleId;
    }

    public static FindingKey of(String subjectId, String ruleId) {
        return new FindingKey(subjectId, ruleId);
    }

    @Override
    public String toString() {
        return subjectId + "/" + ruleId;
    }
}
