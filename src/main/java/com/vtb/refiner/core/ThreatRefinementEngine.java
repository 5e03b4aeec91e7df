package com.vtb.refiner.core;

import com.vtb.refiner.config.RefinementSettings;
import com.vtb.refiner.knowledge.VulnerabilityFeed;
import com.vtb.refiner.knowledge.VulnerabilitySnapshot;
import com.vtb.refiner.models.Cluster;
import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.RefinementReport;
import com.vtb.refiner.models.RefinementStatistics;
import com.vtb.refiner.models.RejectedRecord;
import com.vtb.refiner.models.Severity;
import com.vtb.refiner.models.Threat;
import com.vtb.refiner.models.ThreatStatus;
import com.vtb.refiner.risk.RiskCalculator;
import com.vtb.refiner.risk.RiskStatementGenerator;
import com.vtb.refiner.risk.RiskStatementTemplates;
import com.vtb.refiner.semantic.ComponentNameStandardizer;
import com.vtb.refiner.semantic.SemanticDeduplicator;
import com.vtb.refiner.semantic.TermVectorEmbedder;
import com.vtb.refiner.semantic.ThreatEmbedder;
import com.vtb.refiner.suppression.ControlSuppressor;
import com.vtb.refiner.suppression.CveRelevanceFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Оркестратор уточнения угроз.
 *
 * Порядок стадий фиксирован: стандартизация компонентов, подавление контролями, фильтр
 * устаревших CVE, семантическая дедупликация, расчёт остаточного риска, risk statement.
 * Стадия без входных данных пропускается, но порядок не меняется. Время берётся только
 * из переданного {@link Clock}, поэтому одинаковый запрос даёт одинаковый отчёт.
 */
@Slf4j
public class ThreatRefinementEngine {

    public static final String STAGE_STANDARDIZE = "standardize";
    public static final String STAGE_CONTROLS = "suppress-controls";
    public static final String STAGE_CVE = "cve-relevance";
    public static final String STAGE_DEDUPLICATE = "deduplicate";
    public static final String STAGE_RISK = "risk";
    public static final String STAGE_STATEMENT = "risk-statement";

    /** residual по убыванию, затем id; угрозы без residual в конце по id */
    static final Comparator<Threat> OUTPUT_ORDER = (left, right) -> {
        Double leftRisk = left.getResidualRisk();
        Double rightRisk = right.getResidualRisk();
        if (leftRisk != null && rightRisk != null) {
            int byRisk = Double.compare(rightRisk, leftRisk);
            return byRisk != 0 ? byRisk : left.getId().compareTo(right.getId());
        }
        if (leftRisk != null) {
            return -1;
        }
        if (rightRisk != null) {
            return 1;
        }
        return left.getId().compareTo(right.getId());
    };

    private final RiskStatementTemplates templates;
    private final ThreatEmbedder embedder;

    public ThreatRefinementEngine() {
        this(RiskStatementTemplates.load(), new TermVectorEmbedder());
    }

    public ThreatRefinementEngine(RiskStatementTemplates templates, ThreatEmbedder embedder) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
    }

    public RefinementReport refine(RefinementRequest request) {
        Objects.requireNonNull(request, "request");
        RefinementSettings settings = request.getSettings() != null ? request.getSettings() : RefinementSettings.defaults();
        Clock clock = request.getClock() != null ? request.getClock() : Clock.systemUTC();
        RefinementProgressListener listener = request.getListener() != null
            ? request.getListener() : RefinementProgressListener.NONE;

        Instant startedAt = clock.instant();
        List<String> warnings = new ArrayList<>();
        List<RejectedRecord> rejected = new ArrayList<>();

        log.info("=== Начало уточнения угроз ===");

        // Ингестия
        ThreatIngestor ingestor = new ThreatIngestor(settings.getMaxRiskScore());
        ThreatIngestor.Ingested<Component> components = ingestor.ingestComponents(request.getComponents());
        ThreatIngestor.Ingested<Control> controls = ingestor.ingestControls(request.getControls());
        int rawCount = request.getThreats() != null ? request.getThreats().size() : 0;
        ThreatIngestor.Ingested<Threat> ingested = ingestor.ingestThreats(request.getThreats());
        rejected.addAll(components.rejected());
        rejected.addAll(controls.rejected());
        rejected.addAll(ingested.rejected());
        List<Threat> threats = ingested.accepted();
        log.info("Угроз: {} (отклонено {}), компонентов: {}, контролей: {}", threats.size(),
            ingested.rejected().size(), components.accepted().size(), controls.accepted().size());
        if (!ingested.rejected().isEmpty()) {
            warnings.add(String.format("Отклонено %d записей угроз при валидации", ingested.rejected().size()));
        }

        IndustryProfile industry = request.getIndustry() != null ? request.getIndustry() : settings.getIndustry();
        if (industry == null) {
            industry = IndustryProfile.GENERIC;
        }
        if (request.getIndustry() == null && industry == IndustryProfile.GENERIC) {
            warnings.add("Отраслевой профиль не задан, используются шаблоны GENERIC");
        }

        // Срез CVE запрашивается один раз до поугрозных стадий
        Set<String> citedCves = new LinkedHashSet<>();
        threats.forEach(threat -> citedCves.addAll(threat.getCitedCves()));
        VulnerabilitySnapshot snapshot = fetchSnapshot(request.getFeed(), citedCves, warnings);
        LocalDate referenceDate = LocalDate.ofInstant(clock.instant(), clock.getZone());

        ComponentNameStandardizer standardizer = new ComponentNameStandardizer(components.accepted(),
            settings.getComponentAcceptanceThreshold());
        ControlSuppressor suppressor = new ControlSuppressor(controls.accepted());
        CveRelevanceFilter relevanceFilter = new CveRelevanceFilter(snapshot, referenceDate,
            settings.getCveStalenessYears());

        List<Cluster> clusters;
        try (StageExecutor executor = new StageExecutor(settings.getParallelism(), listener)) {
            // 1. Стандартизация имён
            if (standardizer.hasInventory()) {
                executor.forEach(STAGE_STANDARDIZE, threats, standardizer::standardize);
            } else {
                skip(STAGE_STANDARDIZE, "инвентарь компонентов не передан", threats, listener, warnings);
                threats.forEach(threat -> threat.setUnmatchedComponent(true));
            }

            // 2. Подавление контролями
            if (suppressor.hasControls()) {
                executor.forEach(STAGE_CONTROLS, active(threats), suppressor::apply);
            } else {
                skip(STAGE_CONTROLS, "список контролей не передан", threats, listener, warnings);
            }

            // 3. Устаревшие CVE
            executor.forEach(STAGE_CVE, active(threats), relevanceFilter::apply);

            // 4. Дедупликация: барьер, весь пакет в одном потоке
            List<Threat> survivors = active(threats);
            listener.stageStarted(STAGE_DEDUPLICATE, survivors.size());
            clusters = new SemanticDeduplicator(embedder, settings.getSimilarityThreshold(),
                settings.isRequireSameComponent()).deduplicate(survivors);

            // 5-6. Риск и risk statement для представителей
            List<Threat> representatives = active(threats);
            RiskCalculator calculator = new RiskCalculator(settings, controls.accepted(), components.accepted(),
                snapshot, relevanceFilter);
            executor.forEach(STAGE_RISK, representatives, calculator::assess);

            RiskStatementGenerator statements = new RiskStatementGenerator(templates, industry, settings,
                components.accepted());
            executor.forEach(STAGE_STATEMENT, representatives, statements::generate);
        }

        List<Threat> ordered = new ArrayList<>(threats);
        ordered.sort(OUTPUT_ORDER);

        RefinementStatistics statistics = buildStatistics(threats, rawCount, clusters, snapshot, citedCves);
        statistics.setDurationMs(Duration.between(startedAt, clock.instant()).toMillis());

        log.info("=== Уточнение завершено ===");
        log.info("Исходно: {}, подавлено: {} (контроли {}, устаревшие CVE {}), слито: {}, итого активных: {}",
            statistics.getOriginalCount(), statistics.getSuppressedCount(), statistics.getSuppressedByControl(),
            statistics.getSuppressedStaleCve(), statistics.getMergedCount(), statistics.getFinalActiveCount());
        log.info("Распределение риска: {}", statistics.getRiskDistribution());

        return RefinementReport.builder()
            .generatedAt(startedAt)
            .industry(industry)
            .processingConfig(settings.describe())
            .threats(ordered)
            .clusters(clusters)
            .rejectedRecords(rejected)
            .warnings(warnings)
            .statistics(statistics)
            .build();
    }

    private VulnerabilitySnapshot fetchSnapshot(VulnerabilityFeed feed, Set<String> cveIds, List<String> warnings) {
        if (cveIds.isEmpty()) {
            return VulnerabilitySnapshot.empty();
        }
        if (feed == null) {
            String warning = String.format("Фид уязвимостей не подключен, релевантность %d CVE неизвестна", cveIds.size());
            log.warn(warning);
            warnings.add(warning);
            return VulnerabilitySnapshot.allUnknown(cveIds, null);
        }

        VulnerabilitySnapshot snapshot;
        try {
            snapshot = feed.fetch(cveIds);
        } catch (RuntimeException e) {
            log.warn("Фид уязвимостей недоступен: {}", e.getMessage(), e);
            warnings.add("Фид уязвимостей недоступен: " + e.getMessage());
            return VulnerabilitySnapshot.allUnknown(cveIds, null);
        }
        if (snapshot == null) {
            snapshot = VulnerabilitySnapshot.allUnknown(cveIds, null);
        }
        for (String cveId : cveIds) {
            if (!snapshot.isKnown(cveId)) {
                snapshot.getUnknown().add(cveId);
            }
        }
        warnings.addAll(snapshot.getNotices());
        log.info("Сведения о CVE: известно {}, неизвестно {}", snapshot.getRecords().size(), snapshot.getUnknown().size());
        return snapshot;
    }

    private static void skip(String stage, String reason, List<Threat> threats,
                             RefinementProgressListener listener, List<String> warnings) {
        log.warn("Стадия {} пропущена: {}", stage, reason);
        listener.stageSkipped(stage, reason);
        if (!threats.isEmpty()) {
            warnings.add(String.format("Стадия %s пропущена: %s", stage, reason));
        }
    }

    private static List<Threat> active(List<Threat> threats) {
        return threats.stream().filter(Threat::isActive).collect(Collectors.toList());
    }

    private static RefinementStatistics buildStatistics(List<Threat> threats, int rawCount, List<Cluster> clusters,
                                                        VulnerabilitySnapshot snapshot, Set<String> citedCves) {
        Map<Severity, Integer> distribution = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            distribution.put(severity, 0);
        }
        int byControl = 0;
        int staleCve = 0;
        int merged = 0;
        int active = 0;
        int unmatched = 0;
        for (Threat threat : threats) {
            if (threat.isUnmatchedComponent()) {
                unmatched++;
            }
            if (threat.getStatus() == ThreatStatus.SUPPRESSED) {
                if (CveRelevanceFilter.STALE_CVE_REASON.equals(threat.getSuppressedReason())) {
                    staleCve++;
                } else {
                    byControl++;
                }
            } else if (threat.getStatus() == ThreatStatus.MERGED) {
                merged++;
            } else {
                active++;
                if (threat.getRisk() != null && threat.getRisk().getRiskLevel() != null) {
                    distribution.merge(threat.getRisk().getRiskLevel(), 1, Integer::sum);
                }
            }
        }
        int unknownCves = (int) citedCves.stream().filter(cve -> !snapshot.isKnown(cve)).count();

        return RefinementStatistics.builder()
            .originalCount(rawCount)
            .rejectedCount(rawCount - threats.size())
            .unmatchedComponents(unmatched)
            .suppressedByControl(byControl)
            .suppressedStaleCve(staleCve)
            .mergedCount(merged)
            .clusterCount(clusters.size())
            .finalActiveCount(active)
            .unknownCves(unknownCves)
            .riskDistribution(distribution)
            .build();
    }
}
