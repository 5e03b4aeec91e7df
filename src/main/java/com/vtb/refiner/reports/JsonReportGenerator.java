package com.vtb.refiner.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.refiner.models.RefinementReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Полный отчет refined_threats.json: все угрозы с финальными статусами, кластеры,
 * отклонённые записи, статистика и предупреждения
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    public static final String FILE_NAME = "refined_threats.json";

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = createMapper();
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public void generate(RefinementReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);
        Files.writeString(outputPath, toJson(report));
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    /**
     * Сериализация без записи на диск. Одинаковый отчет всегда даёт одинаковую строку.
     */
    public String toJson(RefinementReport report) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("RefinementReport не может быть null");
        }
        return objectMapper.writeValueAsString(report);
    }

    @Override
    public String getFileName() {
        return FILE_NAME;
    }
}
