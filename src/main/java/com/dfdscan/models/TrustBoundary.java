package com.dfdscan.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Граница доверия. Носит рекомендательный характер, потоки через нее не проверяются.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrustBoundary {
    private String id;
    private String name;
    @Builder.Default
    private List<String> elements = new ArrayList<>();
}
