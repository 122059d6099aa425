package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Поток данных между двумя элементами DFD
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Dataflow {
    private String id;
    private String name;
    private String from;
    private String to;
    private String description;
    private String data;
    private String protocol;
    private String port;
    private Boolean hasSensitiveData;
    private Boolean isEncrypted;
    private Boolean isCrossNetwork;
    private String authentication;
    private String type;

    public boolean carriesSensitiveData() {
        return Boolean.TRUE.equals(hasSensitiveData);
    }

    public boolean encrypted() {
        return Boolean.TRUE.equals(isEncrypted);
    }

    public boolean crossesNetwork() {
        return Boolean.TRUE.equals(isCrossNetwork);
    }

    public boolean hasAuthentication() {
        return authentication != null && !authentication.isEmpty();
    }

    /**
     * Протокол в нижнем регистре, null если не указан
     */
    public String normalizedProtocol() {
        return protocol == null ? null : protocol.trim().toLowerCase(Locale.ROOT);
    }
}
