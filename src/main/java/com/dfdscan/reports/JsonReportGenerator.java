package com.dfdscan.reports;

import com.dfdscan.models.ThreatReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ArtifactExporter exporter;

    public JsonReportGenerator() {
        this(new ArtifactExporter());
    }

    public JsonReportGenerator(ArtifactExporter exporter) {
        this.exporter = exporter;
    }

    @Override
    public void generate(ThreatReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (report == null) {
            throw new IllegalArgumentException("ThreatReport не может быть null");
        }

        exporter.write(report, outputPath);
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
