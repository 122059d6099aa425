package com.dfdscan.library;

import com.dfdscan.config.ScannerConfig;
import com.dfdscan.models.ElementType;
import com.dfdscan.models.LibraryMetadata;
import com.dfdscan.models.PatternSearchHit;
import com.dfdscan.models.StrideCategory;
import com.dfdscan.models.ThreatPattern;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Библиотека шаблонов угроз OWASP.
 *
 * Шаблоны сгруппированы по типу объекта (actor, process, datastore, dataflow, external_entity).
 * Каталог читается из YAML один раз и после загрузки не изменяется,
 * поэтому экземпляр можно безопасно читать из нескольких потоков без блокировок.
 */
@Slf4j
public final class ThreatPatternLibrary {

    public static final String DATAFLOW_BUCKET = "dataflow";

    private final String version;
    private final String source;
    private final Map<String, List<ThreatPattern>> buckets;

    private ThreatPatternLibrary(String version, String source, Map<String, List<ThreatPattern>> buckets) {
        this.version = version;
        this.source = source;
        this.buckets = buckets;
    }

    private static final class Holder {
        private static final ThreatPatternLibrary INSTANCE =
            fromResource(ScannerConfig.load().getLibrary().getResource());
    }

    /**
     * Общая для процесса библиотека из ресурса, указанного в конфигурации
     */
    public static ThreatPatternLibrary getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Загрузить библиотеку из ресурса classpath
     */
    public static ThreatPatternLibrary fromResource(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = ThreatPatternLibrary.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            PatternCatalog catalog = mapper.readValue(is, PatternCatalog.class);
            ThreatPatternLibrary library = fromCatalog(catalog);
            log.info("Загружена библиотека угроз {} v{}: {} шаблонов, типы {}",
                library.source, library.version, library.size(), library.buckets.keySet());
            return library;
        } catch (IOException e) {
            throw new RuntimeException("Ошибка загрузки библиотеки угроз: " + e.getMessage(), e);
        }
    }

    static ThreatPatternLibrary fromCatalog(PatternCatalog catalog) {
        Map<String, List<ThreatPattern>> frozen = new LinkedHashMap<>();
        if (catalog.getPatterns() != null) {
            catalog.getPatterns().forEach((bucket, patterns) -> {
                List<ThreatPattern> copies = new ArrayList<>();
                if (patterns != null) {
                    for (ThreatPattern pattern : patterns) {
                        copies.add(freeze(pattern));
                    }
                }
                frozen.put(bucket.toLowerCase(Locale.ROOT), List.copyOf(copies));
            });
        }
        return new ThreatPatternLibrary(catalog.getVersion(), catalog.getSource(),
            Collections.unmodifiableMap(frozen));
    }

    private static ThreatPattern freeze(ThreatPattern pattern) {
        if (pattern.getId() == null || pattern.getTitle() == null || pattern.getCategory() == null) {
            throw new IllegalStateException("Шаблон угрозы без id/title/category: " + pattern);
        }
        return pattern.toBuilder()
            .stride(copyOf(pattern.getStride()))
            .targets(copyOf(pattern.getTargets()))
            .protocols(copyOf(pattern.getProtocols()))
            .mitigations(copyOf(pattern.getMitigations()))
            .references(copyOf(pattern.getReferences()))
            .build();
    }

    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Привести тип объекта к ключу корзины: user/actor -> actor, database -> datastore,
     * dataflow остается отдельной корзиной, остальное в нижнем регистре как есть
     */
    public static String normalizeSubjectType(String subjectType) {
        if (subjectType == null) {
            return null;
        }
        String lower = subjectType.trim().toLowerCase(Locale.ROOT);
        if (DATAFLOW_BUCKET.equals(lower)) {
            return DATAFLOW_BUCKET;
        }
        ElementType elementType = ElementType.fromValue(lower);
        return elementType != null ? elementType.getValue() : lower;
    }

    /**
     * Шаблоны для типа объекта; пустой список если тип неизвестен
     */
    public List<ThreatPattern> patternsForType(String subjectType) {
        String bucket = normalizeSubjectType(subjectType);
        if (bucket == null) {
            return List.of();
        }
        return buckets.getOrDefault(bucket, List.of());
    }

    public Optional<ThreatPattern> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return allPatterns().stream()
            .filter(p -> id.equals(p.getId()))
            .findFirst();
    }

    /**
     * Поиск без учета регистра по названию, описанию и категории
     */
    public List<PatternSearchHit> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<PatternSearchHit> hits = new ArrayList<>();
        buckets.forEach((bucket, patterns) -> {
            for (ThreatPattern pattern : patterns) {
                if (contains(pattern.getTitle(), needle)
                    || contains(pattern.getDescription(), needle)
                    || contains(pattern.getCategory(), needle)) {
                    hits.add(new PatternSearchHit(bucket, pattern));
                }
            }
        });
        return hits;
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    public List<ThreatPattern> byCategory(String category) {
        if (category == null) {
            return List.of();
        }
        return allPatterns().stream()
            .filter(p -> p.getCategory().equalsIgnoreCase(category))
            .collect(Collectors.toList());
    }

    public List<ThreatPattern> byStride(StrideCategory strideCategory) {
        return allPatterns().stream()
            .filter(p -> p.hasStride(strideCategory))
            .collect(Collectors.toList());
    }

    public LibraryMetadata metadata() {
        Set<String> categories = new LinkedHashSet<>();
        Set<StrideCategory> strideCoverage = EnumSet.noneOf(StrideCategory.class);
        int total = 0;
        for (List<ThreatPattern> patterns : buckets.values()) {
            for (ThreatPattern pattern : patterns) {
                total++;
                categories.add(pattern.getCategory());
                strideCoverage.addAll(pattern.getStride());
            }
        }
        return LibraryMetadata.builder()
            .version(version)
            .source(source)
            .totalPatterns(total)
            .categories(Collections.unmodifiableSet(categories))
            .strideCoverage(Collections.unmodifiableSet(strideCoverage))
            .supportedSubjectTypes(Collections.unmodifiableSet(new LinkedHashSet<>(buckets.keySet())))
            .build();
    }

    public List<ThreatPattern> allPatterns() {
        return buckets.values().stream()
            .flatMap(List::stream)
            .collect(Collectors.toList());
    }

    public int size() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }

    public String getVersion() {
        return version;
    }

    public String getSource() {
        return source;
    }

    /**
     * Структура YAML файла библиотеки
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PatternCatalog {
        private String version;
        private String source;
        private Map<String, List<ThreatPattern>> patterns;
    }
}
