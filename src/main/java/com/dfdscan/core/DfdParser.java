package com.dfdscan.core;

import com.dfdscan.models.DfdModel;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Чтение DFD из JSON или YAML.
 *
 * Источник диаграммы не важен (файл, распознавание изображения, API):
 * результат в любом случае нужно прогнать через {@link DfdValidator} перед генерацией угроз.
 */
@Slf4j
public class DfdParser {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DfdParser() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Загрузить DFD из файла; формат определяется по расширению (.yaml/.yml, иначе JSON)
     */
    public DfdModel parseFromFile(Path path) {
        log.info("Загрузка DFD из файла: {}", path);
        if (path == null || !Files.isRegularFile(path)) {
            throw new DfdParseException("Файл не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, isYaml(path) ? yamlMapper : jsonMapper, path.toString());
        } catch (IOException e) {
            throw new DfdParseException("Не удалось прочитать " + path + ": " + e.getMessage(), e);
        }
    }

    public DfdModel parseJson(String json) {
        if (json == null) {
            throw new DfdParseException("Пустой документ DFD");
        }
        try {
            return requireDocument(jsonMapper.readValue(json, DfdModel.class), "json");
        } catch (JsonProcessingException e) {
            throw new DfdParseException("Некорректный JSON DFD: " + e.getOriginalMessage(), e);
        }
    }

    public DfdModel parseYaml(String yaml) {
        if (yaml == null) {
            throw new DfdParseException("Пустой документ DFD");
        }
        try {
            return requireDocument(yamlMapper.readValue(yaml, DfdModel.class), "yaml");
        } catch (JsonProcessingException e) {
            throw new DfdParseException("Некорректный YAML DFD: " + e.getOriginalMessage(), e);
        }
    }

    private DfdModel read(InputStream is, ObjectMapper mapper, String source) throws IOException {
        try {
            return requireDocument(mapper.readValue(is, DfdModel.class), source);
        } catch (JacksonException e) {
            throw new DfdParseException("Некорректный документ DFD " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private static DfdModel requireDocument(DfdModel model, String source) {
        if (model == null) {
            throw new DfdParseException("Документ DFD пуст: " + source);
        }
        return model;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
