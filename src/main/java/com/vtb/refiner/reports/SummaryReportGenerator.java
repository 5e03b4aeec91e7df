package com.vtb.refiner.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.refiner.models.RefinementReport;
import com.vtb.refiner.models.RefinementStatistics;
import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Краткая сводка refinement_summary.json: счётчики по стадиям, распределение по уровням риска
 * и топ активных угроз
 */
@Slf4j
public class SummaryReportGenerator implements ReportGenerator {

    public static final String FILE_NAME = "refinement_summary.json";
    static final int TOP_THREATS = 10;

    private final ObjectMapper objectMapper = JsonReportGenerator.createMapper();

    @Override
    public void generate(RefinementReport report, Path outputPath) throws IOException {
        log.info("Генерация сводки: {}", outputPath);
        objectMapper.writeValue(outputPath.toFile(), buildSummary(report));
        log.info("Сводка сохранена: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    Map<String, Object> buildSummary(RefinementReport report) {
        if (report == null) {
            throw new IllegalArgumentException("RefinementReport не может быть null");
        }
        RefinementStatistics stats = report.getStatistics();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("generatedAt", report.getGeneratedAt());
        summary.put("industry", report.getIndustry());

        Map<String, Object> counts = new LinkedHashMap<>();
        if (stats != null) {
            counts.put("original", stats.getOriginalCount());
            counts.put("rejected", stats.getRejectedCount());
            counts.put("unmatchedComponents", stats.getUnmatchedComponents());
            counts.put("suppressedByControl", stats.getSuppressedByControl());
            counts.put("suppressedStaleCve", stats.getSuppressedStaleCve());
            counts.put("merged", stats.getMergedCount());
            counts.put("clusters", stats.getClusterCount());
            counts.put("finalActive", stats.getFinalActiveCount());
            counts.put("unknownCves", stats.getUnknownCves());
            if (stats.getOriginalCount() > 0) {
                double reduction = 100.0 * (stats.getOriginalCount() - stats.getFinalActiveCount())
                    / stats.getOriginalCount();
                counts.put("reductionPercent", Math.round(reduction * 10.0) / 10.0);
            }
            summary.put("riskDistribution", stats.getRiskDistribution());
        }
        summary.put("counts", counts);

        List<Map<String, Object>> top = new ArrayList<>();
        for (Threat threat : report.getActiveThreats()) {
            if (top.size() >= TOP_THREATS) {
                break;
            }
            if (threat.getRisk() == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", threat.getId());
            entry.put("component", threat.getEffectiveComponent());
            entry.put("strideCategory", threat.getStrideCategory());
            entry.put("residualRisk", threat.getRisk().getResidualRisk());
            entry.put("riskLevel", threat.getRisk().getRiskLevel());
            top.add(entry);
        }
        summary.put("topThreats", top);
        summary.put("warnings", report.getWarnings());
        summary.put("processingConfig", report.getProcessingConfig());
        return summary;
    }

    @Override
    public String getFileName() {
        return FILE_NAME;
    }
}
