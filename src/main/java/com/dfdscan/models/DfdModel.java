package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Диаграмма потоков данных (DFD).
 * Коллекции не инициализируются по умолчанию: их отсутствие проверяет валидатор.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DfdModel {
    private String id;
    private String name;
    private String description;
    private List<DfdElement> elements;
    private List<Dataflow> dataflows;
    private List<TrustBoundary> trustBoundaries;

    public int elementCount() {
        return elements == null ? 0 : elements.size();
    }

    public int dataflowCount() {
        return dataflows == null ? 0 : dataflows.size();
    }

    public int trustBoundaryCount() {
        return trustBoundaries == null ? 0 : trustBoundaries.size();
    }
}
