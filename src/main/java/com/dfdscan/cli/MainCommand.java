package com.dfdscan.cli;

import com.dfdscan.core.DfdParseException;
import com.dfdscan.core.DfdParser;
import com.dfdscan.core.DfdValidator;
import com.dfdscan.core.GenerationOptions;
import com.dfdscan.core.ThreatGenerator;
import com.dfdscan.integration.CICDIntegration;
import com.dfdscan.library.ThreatPatternLibrary;
import com.dfdscan.models.DfdModel;
import com.dfdscan.models.DfdSummary;
import com.dfdscan.models.ThreatModel;
import com.dfdscan.models.ThreatReport;
import com.dfdscan.models.ValidationResult;
import com.dfdscan.reports.ArtifactExporter;
import com.dfdscan.reports.JsonReportGenerator;
import com.dfdscan.reports.ThreatReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * CLI команда: валидация DFD, генерация модели угроз и отчета
 */
@Slf4j
@Command(
    name = "dfd-threats",
    mixinStandardHelpOptions = true,
    version = "DFD Threat Scanner 1.0.0",
    description = """

        DFD Threat Scanner

        Анализ угроз по диаграмме потоков данных (DFD)

        Возможности:
          • Структурная валидация DFD и проверки гигиены безопасности
          • Генерация угроз по библиотеке OWASP с классификацией STRIDE
          • Отчет: executive summary, разбивка по STRIDE, рекомендации
          • Интеграция с CI/CD

        """
)
public class MainCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Путь к файлу DFD (JSON или YAML)"
    )
    private String dfdPath;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения артефактов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(
        names = {"--validate-only"},
        description = "Только валидация DFD, без генерации угроз"
    )
    private boolean validateOnly = false;

    @Option(
        names = {"--dedup"},
        description = "Схлопнуть пересекающиеся угрозы одного объекта"
    )
    private boolean deduplicate = false;

    @Option(
        names = {"--parallel"},
        description = "Анализировать объекты DFD параллельно"
    )
    private boolean parallel = false;

    @Option(
        names = {"--fail-on-critical"},
        description = "Прервать с ошибкой при обнаружении CRITICAL угроз (для CI/CD)"
    )
    private boolean failOnCritical = false;

    @Option(
        names = {"--fail-on-high"},
        description = "Прервать с ошибкой при обнаружении HIGH и выше (для CI/CD)"
    )
    private boolean failOnHigh = false;

    @Option(
        names = {"--library-info"},
        description = "Вывести метаданные библиотеки угроз и завершить работу"
    )
    private boolean libraryInfo = false;

    @Option(
        names = {"--patterns"},
        paramLabel = "TYPE",
        description = "Вывести шаблоны угроз для типа объекта (actor, process, datastore, dataflow, external_entity)"
    )
    private String patternsType;

    private final PrintStream out;
    private final ArtifactExporter exporter = new ArtifactExporter();

    public MainCommand() {
        this(System.out);
    }

    MainCommand(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (libraryInfo) {
            out.println(exporter.toJson(ThreatPatternLibrary.getInstance().metadata()));
            return CICDIntegration.EXIT_OK;
        }
        if (patternsType != null) {
            out.println(exporter.toJson(ThreatPatternLibrary.getInstance().patternsForType(patternsType)));
            return CICDIntegration.EXIT_OK;
        }
        if (dfdPath == null) {
            log.error("Не указан путь к файлу DFD");
            return CICDIntegration.EXIT_INVALID_DFD;
        }

        try {
            // 1. Загрузка DFD
            DfdModel dfd = new DfdParser().parseFromFile(Paths.get(dfdPath));

            // 2. Валидация
            DfdValidator validator = new DfdValidator();
            DfdSummary summary = validator.getSummary(dfd);
            ValidationResult validation = summary.getValidation();
            validation.getWarnings().forEach(w -> log.warn("  - {}", w));

            Path outputPath = Paths.get(outputDir);
            Files.createDirectories(outputPath);
            exporter.write(summary, outputPath.resolve("dfd-validation.json"));

            if (!validation.isValid()) {
                log.error("DFD не прошла валидацию, генерация угроз пропущена");
                CICDIntegration.printValidationFailure(validation, out);
                return CICDIntegration.EXIT_INVALID_DFD;
            }
            if (validateOnly) {
                log.info("DFD валидна ({} предупреждений)", validation.getWarnings().size());
                return CICDIntegration.EXIT_OK;
            }

            // 3. Генерация модели угроз
            GenerationOptions options = GenerationOptions.builder()
                .deduplicate(deduplicate)
                .parallel(parallel)
                .build();
            ThreatModel model = new ThreatGenerator().generateThreatModel(dfd, options);

            // 4. Отчет и артефакты
            ThreatReport report = new ThreatReportGenerator().generateReport(model, dfd);
            exporter.write(dfd, outputPath.resolve("dfd.json"));
            exporter.write(model, outputPath.resolve("threat-model.json"));
            JsonReportGenerator jsonGen = new JsonReportGenerator(exporter);
            jsonGen.generate(report, outputPath.resolve("threat-report." + jsonGen.getFileExtension()));

            // 5. Вывод и exit code
            CICDIntegration.printCISummary(model, validation, out);
            return CICDIntegration.getExitCode(model, failOnCritical, failOnHigh);

        } catch (DfdParseException e) {
            log.error("Не удалось прочитать DFD: {}", e.getMessage());
            return CICDIntegration.EXIT_INVALID_DFD;
        } catch (Exception e) {
            log.error("Ошибка при анализе DFD: {}", e.getMessage(), e);
            return CICDIntegration.EXIT_THREATS;
        }
    }
}
