package com.dfdscan.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Конфигурация движка из YAML файла
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScannerConfig {

    public static final String DEFAULT_RESOURCE = "scanner-config.yaml";

    private Library library;
    private Validation validation;
    private Generator generator;
    private Report report;

    private static ScannerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static synchronized ScannerConfig load() {
        if (instance == null) {
            instance = fromResource(DEFAULT_RESOURCE);
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из указанного ресурса classpath
     */
    public static ScannerConfig fromResource(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = ScannerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            ScannerConfig config = mapper.readValue(is, ScannerConfig.class);
            config.ensureDefaults();
            log.debug("Конфигурация загружена из {}", resource);
            return config;
        } catch (IOException e) {
            throw new RuntimeException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация со значениями по умолчанию, без чтения файла
     */
    public static ScannerConfig defaults() {
        ScannerConfig config = new ScannerConfig();
        config.ensureDefaults();
        return config;
    }

    void ensureDefaults() {
        if (library == null) {
            library = new Library();
        }
        library.ensureDefaults();
        if (validation == null) {
            validation = new Validation();
        }
        validation.ensureDefaults();
        if (generator == null) {
            generator = new Generator();
        }
        generator.ensureDefaults();
        if (report == null) {
            report = new Report();
        }
        report.ensureDefaults();
    }

    @Data
    public static class Library {
        private static final String DEFAULT_RESOURCE = "threat-patterns.yaml";

        private String resource;

        void ensureDefaults() {
            if (resource == null || resource.isBlank()) {
                resource = DEFAULT_RESOURCE;
            }
        }
    }

    @Data
    public static class Validation {
        private static final List<String> DEFAULT_INSECURE_PROTOCOLS = List.of("http", "ftp", "telnet", "smtp");

        private List<String> insecureProtocols;

        void ensureDefaults() {
            if (insecureProtocols == null || insecureProtocols.isEmpty()) {
                insecureProtocols = new ArrayList<>(DEFAULT_INSECURE_PROTOCOLS);
            }
        }

        public Set<String> insecureProtocolSet() {
            Set<String> result = new LinkedHashSet<>();
            for (String protocol : insecureProtocols) {
                if (protocol != null) {
                    result.add(protocol.trim().toLowerCase(Locale.ROOT));
                }
            }
            return result;
        }
    }

    @Data
    public static class Generator {
        private String elementLikelihood;
        private String dataflowLikelihood;
        private Integer parallelThreads;

        void ensureDefaults() {
            if (elementLikelihood == null || elementLikelihood.isBlank()) {
                elementLikelihood = "Medium";
            }
            if (dataflowLikelihood == null || dataflowLikelihood.isBlank()) {
                dataflowLikelihood = "High";
            }
            if (parallelThreads == null || parallelThreads <= 0) {
                parallelThreads = 4;
            }
        }
    }

    @Data
    public static class Report {
        private String titlePrefix;

        void ensureDefaults() {
            if (titlePrefix == null) {
                titlePrefix = "Threat Model Report: ";
            }
        }
    }
}
