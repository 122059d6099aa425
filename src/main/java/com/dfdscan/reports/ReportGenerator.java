package com.dfdscan.reports;

import com.dfdscan.models.ThreatReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов файлов отчета
 */
public interface ReportGenerator {

    /**
     * Сохранить отчет
     *
     * @param report отчет по модели угроз
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(ThreatReport report, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
