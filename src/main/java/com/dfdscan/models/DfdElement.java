package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Элемент DFD: актор, процесс, хранилище или внешняя сущность.
 * Роли (isExternalEntity, isDatastore, isProcess) вычисляются из типа и не хранятся.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DfdElement {
    private String id;
    private String name;
    private String type;
    private String description;
    private String trustLevel;
    private Map<String, Object> properties;

    /**
     * Нормализованный тип, null если тип не распознан
     */
    @JsonIgnore
    public ElementType getElementType() {
        return ElementType.fromValue(type);
    }

    @JsonIgnore
    public TrustLevel getTrust() {
        return TrustLevel.fromValue(trustLevel);
    }

    @JsonProperty(value = "isExternalEntity", access = JsonProperty.Access.READ_ONLY)
    public boolean isExternalEntity() {
        ElementType elementType = getElementType();
        return elementType != null && elementType.isExternal();
    }

    @JsonProperty(value = "isDatastore", access = JsonProperty.Access.READ_ONLY)
    public boolean isDatastore() {
        return getElementType() == ElementType.DATASTORE;
    }

    @JsonProperty(value = "isProcess", access = JsonProperty.Access.READ_ONLY)
    public boolean isProcess() {
        return getElementType() == ElementType.PROCESS;
    }
}
