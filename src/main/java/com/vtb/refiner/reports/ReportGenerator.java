package com.vtb.refiner.reports;

import com.vtb.refiner.models.RefinementReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param report результат уточнения угроз
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(RefinementReport report, Path outputPath) throws IOException;

    /**
     * Имя файла отчета в каталоге вывода
     */
    String getFileName();
}
