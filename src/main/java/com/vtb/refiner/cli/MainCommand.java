package com.vtb.refiner.cli;

import com.vtb.refiner.config.RefinementSettings;
import com.vtb.refiner.config.RefinerConfig;
import com.vtb.refiner.core.InputLoader;
import com.vtb.refiner.core.RawComponentRecord;
import com.vtb.refiner.core.RawControlRecord;
import com.vtb.refiner.core.RawThreatRecord;
import com.vtb.refiner.core.RefinementRequest;
import com.vtb.refiner.core.ThreatRefinementEngine;
import com.vtb.refiner.knowledge.CachingVulnerabilityFeed;
import com.vtb.refiner.knowledge.StaticVulnerabilityFeed;
import com.vtb.refiner.knowledge.VulnerabilityFeed;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.RefinementReport;
import com.vtb.refiner.models.RefinementStatistics;
import com.vtb.refiner.models.Severity;
import com.vtb.refiner.models.Threat;
import com.vtb.refiner.reports.JsonReportGenerator;
import com.vtb.refiner.reports.ReportGenerator;
import com.vtb.refiner.reports.SummaryReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI команда уточнения угроз
 */
@Slf4j
@Command(
    name = "refine",
    mixinStandardHelpOptions = true,
    version = "VTB Threat Refinement Engine 1.0.0",
    description = """

        VTB Threat Refinement Engine

        Дедупликация, подавление и ранжирование угроз STRIDE

        Возможности:
          • Сопоставление компонентов с инвентарём
          • Подавление угроз внедрёнными контролями
          • Отсев устаревших CVE (NVD + CISA KEV)
          • Семантическая дедупликация
          • Остаточный риск и отраслевые risk statement

        """
)
public class MainCommand implements Callable<Integer> {

    @Option(
        names = {"-t", "--threats"},
        required = true,
        description = "Файл с сырыми угрозами (JSON/YAML)"
    )
    private Path threatsFile;

    @Option(
        names = {"-c", "--components"},
        description = "Инвентарь компонентов или DFD документ (JSON/YAML)"
    )
    private Path componentsFile;

    @Option(
        names = {"--controls"},
        description = "Внедрённые контроли: список или старый формат флагов"
    )
    private Path controlsFile;

    @Option(
        names = {"-i", "--industry"},
        description = "Отраслевой профиль: FINANCE, HEALTHCARE, GOVERNMENT, ECOMMERCE, GENERIC"
    )
    private String industry;

    @Option(
        names = {"--config"},
        description = "Файл конфигурации (по умолчанию refiner-config.yaml из classpath)"
    )
    private Path configFile;

    @Option(
        names = {"--cve-cache"},
        description = "Файл кэша CVE (по умолчанию <output>/cve_cache.json)"
    )
    private Path cveCacheFile;

    @Option(
        names = {"--offline"},
        description = "Не обращаться к NVD и CISA KEV"
    )
    private boolean offline = false;

    @Option(
        names = {"--cve-data"},
        description = "JSON массив VulnerabilityRecord вместо удалённого фида"
    )
    private Path cveDataFile;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./output)"
    )
    private Path outputDir = Path.of("./output");

    @Option(
        names = {"--fail-on-critical"},
        description = "Завершить с кодом 1, если остались CRITICAL угрозы (для CI/CD)"
    )
    private boolean failOnCritical = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            RefinerConfig config = RefinerConfig.load(configFile);
            RefinementSettings settings = RefinementSettings.from(config);
            Clock clock = Clock.systemUTC();

            InputLoader loader = new InputLoader();
            List<RawThreatRecord> threats = loader.loadThreats(threatsFile);
            List<RawComponentRecord> components = componentsFile != null ? loader.loadComponents(componentsFile) : null;
            List<RawControlRecord> controls = controlsFile != null ? loader.loadControls(controlsFile) : null;

            Files.createDirectories(outputDir);
            RefinementRequest request = RefinementRequest.builder()
                .threats(threats)
                .components(components)
                .controls(controls)
                .industry(industry != null ? IndustryProfile.parseOrGeneric(industry) : null)
                .feed(createFeed(config, clock))
                .settings(settings)
                .clock(clock)
                .build();

            RefinementReport report = new ThreatRefinementEngine().refine(request);

            for (ReportGenerator generator : List.of(new JsonReportGenerator(), new SummaryReportGenerator())) {
                generator.generate(report, outputDir.resolve(generator.getFileName()));
            }
            printResults(report);

            if (failOnCritical && report.hasCriticalThreats()) {
                log.error("Остались CRITICAL угрозы (--fail-on-critical)");
                return 1;
            }
            log.info("Уточнение завершено успешно");
            return 0;

        } catch (IOException | RuntimeException e) {
            log.error("Ошибка при уточнении угроз: {}", e.getMessage(), e);
            return 1;
        }
    }

    private VulnerabilityFeed createFeed(RefinerConfig config, Clock clock) throws IOException {
        if (cveDataFile != null) {
            log.info("Сведения о CVE из файла {}", cveDataFile);
            return StaticVulnerabilityFeed.fromFile(cveDataFile);
        }
        if (offline) {
            log.info("Офлайн режим: сведения о CVE не запрашиваются");
            return null;
        }
        Path cache = cveCacheFile != null ? cveCacheFile : outputDir.resolve("cve_cache.json");
        return CachingVulnerabilityFeed.remote(config.getCve(), cache, clock);
    }

    private void printResults(RefinementReport report) {
        RefinementStatistics stats = report.getStatistics();
        System.out.println("\n" + "=".repeat(80));
        System.out.println("VTB THREAT REFINEMENT REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Отрасль: " + report.getIndustry());
        System.out.println("Дата: " + report.getGeneratedAt());
        System.out.println("Время обработки: " + stats.getDurationMs() + " мс");
        System.out.println();
        System.out.println("СТАТИСТИКА:");
        System.out.println("   Исходных угроз:        " + stats.getOriginalCount());
        System.out.println("   Отклонено:             " + stats.getRejectedCount());
        System.out.println("   Подавлено контролями:  " + stats.getSuppressedByControl());
        System.out.println("   Устаревшие CVE:        " + stats.getSuppressedStaleCve());
        System.out.println("   Слито дубликатов:      " + stats.getMergedCount());
        System.out.println("   Итого активных:        " + stats.getFinalActiveCount());
        System.out.println();
        for (Severity severity : Severity.values()) {
            System.out.printf("%-9s %d%n", severity.name() + ":", stats.getRiskDistribution().getOrDefault(severity, 0));
        }
        System.out.println();

        List<Threat> active = report.getActiveThreats();
        if (!active.isEmpty()) {
            System.out.println("ТОП УГРОЗЫ:");
            active.stream().limit(5).forEach(threat -> System.out.printf("   [%s] %.2f %s (%s): %s%n",
                threat.getRisk().getRiskLevel(), threat.getResidualRisk(), threat.getEffectiveComponent(),
                threat.getStrideCategory().getDisplayName(), threat.getId()));
            System.out.println();
        }
        if (!report.getWarnings().isEmpty()) {
            System.out.println("ПРЕДУПРЕЖДЕНИЯ:");
            report.getWarnings().forEach(warning -> System.out.println("   - " + warning));
            System.out.println();
        }
        System.out.println("Отчеты сохранены в: " + outputDir);
        System.out.println("=".repeat(80));
        System.out.println();
    }
}
