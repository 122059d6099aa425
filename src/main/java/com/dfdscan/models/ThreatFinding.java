package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Угроза, выведенная для одного элемента или потока данных.
 * Id генерируется заново при каждой генерации модели.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatFinding {
    private String id;
    private String ruleId;
    private String title;
    private String description;
    private String category;
    @Builder.Default
    private List<StrideCategory> stride = new ArrayList<>();
    private Severity severity;
    private String likelihood;
    private String impact;
    @Builder.Default
    private List<String> mitigations = new ArrayList<>();
    @Builder.Default
    private List<String> references = new ArrayList<>();
    private String owaspCategory;
    private SubjectRef subject;

    @JsonIgnore
    public FindingKey getKey() {
        return FindingKey.of(subject != null ? subject.getId() : null, ruleId);
    }

    public boolean hasStride(StrideCategory category) {
        return stride != null && stride.contains(category);
    }
}
