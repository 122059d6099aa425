package com.dfdscan.core;

import com.dfdscan.models.Severity;
import com.dfdscan.models.StrideCategory;

import java.util.List;

import static com.dfdscan.models.StrideCategory.ELEVATION_OF_PRIVILEGE;
import static com.dfdscan.models.StrideCategory.INFORMATION_DISCLOSURE;
import static com.dfdscan.models.StrideCategory.REPUDIATION;
import static com.dfdscan.models.StrideCategory.SPOOFING;
import static com.dfdscan.models.StrideCategory.TAMPERING;

/**
 * Встроенные правила, срабатывающие по ролям элементов и свойствам потоков.
 * Применяются независимо от шаблонов библиотеки, без дедупликации с ними.
 */
public enum BuiltInRule {

    MALICIOUS_EXTERNAL_ACTOR(
        "ROLE-EXT",
        "Malicious External Actor",
        "External entity may be compromised or act maliciously",
        "Actor Threat",
        List.of(SPOOFING, REPUDIATION),
        Severity.HIGH, "Medium", "High",
        List.of(
            "Implement authentication mechanisms",
            "Use digital signatures for verification",
            "Monitor for anomalous behavior",
            "Implement audit logging"),
        "A07:2021 – Identification and Authentication Failures"),

    UNAUTHORIZED_DATA_ACCESS(
        "ROLE-DS",
        "Unauthorized Data Access",
        "Sensitive data in datastore may be accessed without authorization",
        "Information Disclosure",
        List.of(INFORMATION_DISCLOSURE, TAMPERING),
        Severity.CRITICAL, "High", "Critical",
        List.of(
            "Implement encryption at rest",
            "Use access control lists",
            "Implement database auditing",
            "Use data masking for sensitive fields",
            "Regular backup and recovery testing"),
        "A01:2021 – Broken Access Control"),

    PRIVILEGE_ESCALATION(
        "ROLE-PROC",
        "Privilege Escalation",
        "Process may be exploited to escalate privileges",
        "Authorization Bypass",
        List.of(ELEVATION_OF_PRIVILEGE),
        Severity.HIGH, "Medium", "Critical",
        List.of(
            "Run with least privilege principle",
            "Input validation and sanitization",
            "Use security frameworks",
            "Implement RBAC",
            "Regular security testing"),
        "A04:2021 – Insecure Design"),

    MAN_IN_THE_MIDDLE(
        "FLOW-HTTP",
        "Man-in-the-Middle Attack",
        "Unencrypted HTTP dataflow is vulnerable to MITM attacks",
        "Network Attack",
        List.of(TAMPERING, INFORMATION_DISCLOSURE),
        Severity.CRITICAL, "High", "Critical",
        List.of(
            "Use HTTPS/TLS encryption",
            "Implement certificate pinning",
            "Use HSTS headers",
            "Implement perfect forward secrecy",
            "Regular security updates"),
        "A02:2021 – Cryptographic Failures"),

    DATA_EXPOSURE_IN_TRANSIT(
        "FLOW-SENSITIVE",
        "Data Exposure During Transit",
        "Sensitive data may be exposed if not properly protected in transit",
        "Data Protection",
        List.of(INFORMATION_DISCLOSURE),
        Severity.CRITICAL, "High", "Critical",
        List.of(
            "Encrypt data in transit (TLS 1.2+)",
            "Use strong encryption algorithms",
            "Implement key management",
            "Data classification policy",
            "Regular encryption audits"),
        "A02:2021 – Cryptographic Failures");

    private final String id;
    private final String title;
    private final String description;
    private final String category;
    private final List<StrideCategory> stride;
    private final Severity severity;
    private final String likelihood;
    private final String impact;
    private final List<String> mitigations;
    private final String owaspCategory;

    BuiltInRule(String id, String title, String description, String category,
                List<StrideCategory> stride, Severity severity, String likelihood, String impact,
                List<String> mitigations, String owaspCategory) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.category = category;
        this.stride = stride;
        this.severity = severity;
        this.likelihood = likelihood;
        this.impact = impact;
        this.mitigations = mitigations;
        this.owaspCategory = owaspCategory;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public List<StrideCategory> getStride() {
        return stride;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getLikelihood() {
        return likelihood;
    }

    public String getImpact() {
        return impact;
    }

    public List<String> getMitigations() {
        return mitigations;
    }

    public String getOwaspCategory() {
        return owaspCategory;
    }
}
