package com.dfdscan.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Экспорт DFD, модели угроз и отчета в форматированный JSON.
 * Результат передается во внешние системы (например, в репозиторий) как непрозрачный артефакт.
 */
@Slf4j
public class ArtifactExporter {

    private final ObjectMapper mapper;

    public ArtifactExporter() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(Object artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("Артефакт не может быть null");
        }
        try {
            return mapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать " + artifact.getClass().getSimpleName(), e);
        }
    }

    public void write(Object artifact, Path targetFile) throws IOException {
        String json = toJson(artifact);
        Path parent = targetFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(targetFile, json, StandardCharsets.UTF_8);
        log.debug("{} экспортирован в {}", artifact.getClass().getSimpleName(), targetFile.toAbsolutePath());
    }
}
