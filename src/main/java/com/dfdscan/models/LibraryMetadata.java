package com.dfdscan.models;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class LibraryMetadata {
    String version;
    String source;
    int totalPatterns;
    Set<String> categories;
    Set<StrideCategory> strideCoverage;
    Set<String> supportedSubjectTypes;
}
