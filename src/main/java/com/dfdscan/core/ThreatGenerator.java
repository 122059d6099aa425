package com.dfdscan.core;

import com.dfdscan.analysis.FindingDeduplicator;
import com.dfdscan.config.ScannerConfig;
import com.dfdscan.library.ThreatPatternLibrary;
import com.dfdscan.models.Dataflow;
import com.dfdscan.models.DfdElement;
import com.dfdscan.models.DfdModel;
import com.dfdscan.models.ElementType;
import com.dfdscan.models.FindingKey;
import com.dfdscan.models.RiskSummary;
import com.dfdscan.models.Severity;
import com.dfdscan.models.SubjectRef;
import com.dfdscan.models.ThreatFinding;
import com.dfdscan.models.ThreatModel;
import com.dfdscan.models.ThreatPattern;
import com.dfdscan.models.TrustLevel;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Генератор модели угроз по DFD.
 *
 * Для каждого элемента и потока подбирает шаблоны из библиотеки, повышает их критичность
 * с учетом уровня доверия и свойств потока, добавляет встроенные угрозы по ролям
 * и собирает модель, отсортированную по критичности.
 *
 * ПРЕДУСЛОВИЕ: DFD уже прошла {@link DfdValidator#validate(DfdModel)}.
 * Поведение на невалидной DFD не определено; грубые нарушения формы
 * (нет элементов, нет списка потоков, неизвестный тип) приводят к
 * {@link ThreatModelPreconditionException}.
 */
@Slf4j
public class ThreatGenerator {

    private static final Comparator<ThreatFinding> BY_SEVERITY =
        Comparator.comparingInt(f -> f.getSeverity().getRank());

    private final ThreatPatternLibrary library;
    private final ScannerConfig config;

    public ThreatGenerator() {
        this(ThreatPatternLibrary.getInstance(), ScannerConfig.load());
    }

    public ThreatGenerator(ThreatPatternLibrary library, ScannerConfig config) {
        this.library = library;
        this.config = config;
    }

    public ThreatModel generateThreatModel(DfdModel dfd) {
        return generateThreatModel(dfd, GenerationOptions.defaults());
    }

    /**
     * Сгенерировать модель угроз.
     *
     * Наложение мер защиты по id угрозы работает только в два прохода: id генерируются
     * заново при каждом вызове, поэтому для повторной генерации удобнее стабильные ключи
     * (см. {@link #regenerate(DfdModel, Map)}).
     */
    public ThreatModel generateThreatModel(DfdModel dfd, GenerationOptions options) {
        checkPreconditions(dfd);
        GenerationOptions effective = options != null ? options : GenerationOptions.defaults();

        log.info("Генерация модели угроз для DFD '{}': {} элементов, {} потоков",
            dfd.getName(), dfd.elementCount(), dfd.dataflowCount());

        List<Callable<List<ThreatFinding>>> tasks = new ArrayList<>();
        for (DfdElement element : dfd.getElements()) {
            tasks.add(() -> analyzeElement(element));
        }
        for (Dataflow dataflow : dfd.getDataflows()) {
            tasks.add(() -> analyzeDataflow(dataflow));
        }

        // Все объекты должны быть проанализированы до сортировки
        List<ThreatFinding> findings = effective.isParallel()
            ? runParallel(tasks)
            : runSequential(tasks);

        applyCustomRules(findings, effective.getCustomRules(), effective.getOverlay());

        if (effective.isDeduplicate()) {
            int before = findings.size();
            findings = FindingDeduplicator.deduplicate(findings);
            log.info("Дедупликация: {} -> {} угроз", before, findings.size());
        }

        // List.sort стабильна: при равной критичности сохраняется порядок обнаружения
        findings.sort(BY_SEVERITY);

        RiskSummary riskSummary = RiskSummary.tally(findings);
        log.info("Найдено угроз: {} (Critical: {}, High: {}, Medium: {}, Low: {})",
            findings.size(), riskSummary.getCritical(), riskSummary.getHigh(),
            riskSummary.getMedium(), riskSummary.getLow());

        return ThreatModel.builder()
            .id(UUID.randomUUID().toString())
            .dfdId(dfd.getId())
            .dfdName(dfd.getName())
            .findings(findings)
            .totalThreats(findings.size())
            .riskSummary(riskSummary)
            .createdAt(Instant.now())
            .build();
    }

    /**
     * Повторная генерация с дополнительными мерами защиты по стабильным ключам
     * (id объекта + id правила), полученным из предыдущей модели через {@link ThreatFinding#getKey()}
     */
    public ThreatModel regenerate(DfdModel dfd, Map<FindingKey, List<String>> overlay) {
        return generateThreatModel(dfd, GenerationOptions.withOverlay(overlay));
    }

    private void checkPreconditions(DfdModel dfd) {
        if (dfd == null) {
            throw new ThreatModelPreconditionException("DFD не передана");
        }
        if (dfd.getElements() == null || dfd.getElements().isEmpty()) {
            throw new ThreatModelPreconditionException(
                "DFD '" + dfd.getName() + "' не содержит элементов: вызовите DfdValidator.validate перед генерацией");
        }
        if (dfd.getDataflows() == null) {
            throw new ThreatModelPreconditionException(
                "DFD '" + dfd.getName() + "' не содержит списка потоков: вызовите DfdValidator.validate перед генерацией");
        }
        for (DfdElement element : dfd.getElements()) {
            if (element == null || element.getElementType() == null) {
                throw new ThreatModelPreconditionException(
                    "Элемент с неизвестным типом: " + (element != null ? element.getType() : null));
            }
        }
        for (Dataflow dataflow : dfd.getDataflows()) {
            if (dataflow == null) {
                throw new ThreatModelPreconditionException("DFD '" + dfd.getName() + "' содержит пустой поток");
            }
        }
    }

    private List<ThreatFinding> runSequential(List<Callable<List<ThreatFinding>>> tasks) {
        List<ThreatFinding> findings = new ArrayList<>();
        for (Callable<List<ThreatFinding>> task : tasks) {
            try {
                findings.addAll(task.call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Ошибка анализа объекта DFD: " + e.getMessage(), e);
            }
        }
        return findings;
    }

    private List<ThreatFinding> runParallel(List<Callable<List<ThreatFinding>>> tasks) {
        int threads = Math.max(1, Math.min(config.getGenerator().getParallelThreads(), tasks.size()));
        log.debug("Параллельный анализ: {} объектов, {} потоков", tasks.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<ThreatFinding>>> futures = executor.invokeAll(tasks);
            List<ThreatFinding> findings = new ArrayList<>();
            // Результаты собираются в порядке задач, а не завершения
            for (Future<List<ThreatFinding>> future : futures) {
                findings.addAll(future.get());
            }
            return findings;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Генерация угроз прервана", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Ошибка анализа объекта DFD: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Угрозы для элемента: шаблоны библиотеки + встроенные угрозы по роли
     */
    List<ThreatFinding> analyzeElement(DfdElement element) {
        List<ThreatFinding> findings = new ArrayList<>();
        ElementType elementType = element.getElementType();
        SubjectRef subject = SubjectRef.of(element);
        String likelihood = config.getGenerator().getElementLikelihood();

        for (ThreatPattern pattern : library.patternsForType(elementType.getValue())) {
            if (pattern.appliesToElement(element.getType(), elementType)) {
                Severity severity = escalateForElement(pattern.getSeverity(), element.getTrust());
                findings.add(fromPattern(pattern, severity, likelihood, subject));
            }
        }

        if (element.isExternalEntity()) {
            findings.add(fromBuiltIn(BuiltInRule.MALICIOUS_EXTERNAL_ACTOR, subject));
        }
        if (element.isDatastore()) {
            findings.add(fromBuiltIn(BuiltInRule.UNAUTHORIZED_DATA_ACCESS, subject));
        }
        if (element.isProcess()) {
            findings.add(fromBuiltIn(BuiltInRule.PRIVILEGE_ESCALATION, subject));
        }

        log.debug("Элемент '{}' ({}): {} угроз", element.getName(), elementType.getValue(), findings.size());
        return findings;
    }

    /**
     * Угрозы для потока: шаблоны библиотеки + встроенные угрозы по протоколу и чувствительности
     */
    List<ThreatFinding> analyzeDataflow(Dataflow dataflow) {
        List<ThreatFinding> findings = new ArrayList<>();
        SubjectRef subject = SubjectRef.of(dataflow);
        String likelihood = config.getGenerator().getDataflowLikelihood();

        for (ThreatPattern pattern : library.patternsForType(ThreatPatternLibrary.DATAFLOW_BUCKET)) {
            if (pattern.appliesToProtocol(dataflow.getProtocol())) {
                Severity severity = escalateForDataflow(pattern.getSeverity(), dataflow);
                findings.add(fromPattern(pattern, severity, likelihood, subject));
            }
        }

        if ("http".equals(dataflow.normalizedProtocol())) {
            findings.add(fromBuiltIn(BuiltInRule.MAN_IN_THE_MIDDLE, subject));
        }
        if (dataflow.carriesSensitiveData()) {
            findings.add(fromBuiltIn(BuiltInRule.DATA_EXPOSURE_IN_TRANSIT, subject));
        }

        log.debug("Поток '{}' ({} -> {}): {} угроз",
            dataflow.getName(), dataflow.getFrom(), dataflow.getTo(), findings.size());
        return findings;
    }

    /**
     * untrusted -> Critical, partially-trusted -> не ниже Medium, иначе базовая критичность
     */
    static Severity escalateForElement(Severity baseline, TrustLevel trustLevel) {
        Severity base = baseline != null ? baseline : Severity.MEDIUM;
        if (trustLevel == TrustLevel.UNTRUSTED) {
            return Severity.CRITICAL;
        }
        if (trustLevel == TrustLevel.PARTIALLY_TRUSTED) {
            return base.atLeast(Severity.MEDIUM);
        }
        return base;
    }

    /**
     * Чувствительные данные -> Critical; межсетевой поток: Low -> Medium, остальное не ниже High
     */
    static Severity escalateForDataflow(Severity baseline, Dataflow dataflow) {
        Severity base = baseline != null ? baseline : Severity.MEDIUM;
        if (dataflow.carriesSensitiveData()) {
            return Severity.CRITICAL;
        }
        if (dataflow.crossesNetwork()) {
            return base == Severity.LOW ? Severity.MEDIUM : base.atLeast(Severity.HIGH);
        }
        return base;
    }

    private static ThreatFinding fromPattern(ThreatPattern pattern, Severity severity,
                                             String likelihood, SubjectRef subject) {
        return ThreatFinding.builder()
            .id(UUID.randomUUID().toString())
            .ruleId(pattern.getId())
            .title(pattern.getTitle())
            .description(pattern.getDescription())
            .category(pattern.getCategory())
            .stride(new ArrayList<>(pattern.getStride()))
            .severity(severity)
            .likelihood(likelihood)
            .impact(pattern.getImpact() != null ? pattern.getImpact() : "High")
            .mitigations(new ArrayList<>(pattern.getMitigations()))
            .references(new ArrayList<>(pattern.getReferences()))
            .owaspCategory(pattern.getOwaspCategory())
            .subject(subject)
            .build();
    }

    private static ThreatFinding fromBuiltIn(BuiltInRule rule, SubjectRef subject) {
        return ThreatFinding.builder()
            .id(UUID.randomUUID().toString())
            .ruleId(rule.getId())
            .title(rule.getTitle())
            .description(rule.getDescription())
            .category(rule.getCategory())
            .stride(new ArrayList<>(rule.getStride()))
            .severity(rule.getSeverity())
            .likelihood(rule.getLikelihood())
            .impact(rule.getImpact())
            .mitigations(new ArrayList<>(rule.getMitigations()))
            .owaspCategory(rule.getOwaspCategory())
            .subject(subject)
            .build();
    }

    private static void applyCustomRules(List<ThreatFinding> findings, Map<String, List<String>> customRules,
                                         Map<FindingKey, List<String>> overlay) {
        boolean noRules = customRules == null || customRules.isEmpty();
        boolean noOverlay = overlay == null || overlay.isEmpty();
        if (noRules && noOverlay) {
            return;
        }
        int applied = 0;
        for (ThreatFinding finding : findings) {
            List<String> byId = noRules ? null : customRules.get(finding.getId());
            List<String> byKey = noOverlay ? null : overlay.get(finding.getKey());
            if (byId != null) {
                finding.getMitigations().addAll(byId);
                applied++;
            }
            if (byKey != null) {
                finding.getMitigations().addAll(byKey);
                applied++;
            }
        }
        log.debug("Дополнительные меры защиты применены к {} угрозам", applied);
    }
}
