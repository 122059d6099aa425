package com.dfdscan.core;

import com.dfdscan.models.FindingKey;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Параметры генерации модели угроз
 */
@Data
@Builder
public class GenerationOptions {

    /**
     * Дополнительные меры защиты по id угрозы из предыдущей генерации.
     * Меры добавляются в конец списка без дедупликации.
     */
    @Builder.Default
    private Map<String, List<String>> customRules = new LinkedHashMap<>();

    /**
     * Дополнительные меры защиты по стабильному ключу (id объекта + id правила)
     */
    @Builder.Default
    private Map<FindingKey, List<String>> overlay = new LinkedHashMap<>();

    /**
     * Схлопнуть угрозы с одинаковыми (объект, категория, набор STRIDE). По умолчанию выключено.
     */
    @Builder.Default
    private boolean deduplicate = false;

    /**
     * Анализ объектов в пуле потоков. Результат совпадает с последовательным режимом.
     */
    @Builder.Default
    private boolean parallel = false;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }

    /**
     * Опции с наложением мер защиты по стабильным ключам
     */
    public static GenerationOptions withOverlay(Map<FindingKey, List<String>> overlay) {
        Map<FindingKey, List<String>> copy = new LinkedHashMap<>();
        if (overlay != null) {
            copy.putAll(overlay);
        }
        return GenerationOptions.builder().overlay(copy).build();
    }
}
