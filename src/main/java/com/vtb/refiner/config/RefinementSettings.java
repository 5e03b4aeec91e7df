package com.vtb.refiner.config;

import com.vtb.refiner.models.Exploitability;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.MitigationMaturity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Неизменяемый снимок настроек, передаётся в движок при каждом вызове.
 * Глобального изменяемого состояния у движка нет.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class RefinementSettings {

    @Builder.Default
    double componentAcceptanceThreshold = 0.6;
    @Builder.Default
    int cveStalenessYears = 5;
    @Builder.Default
    double similarityThreshold = 0.85;
    @Builder.Default
    boolean requireSameComponent = false;
    @Builder.Default
    double maxRiskScore = 10.0;
    @Builder.Default
    Map<Exploitability, Double> exploitabilityFactors = defaultExploitabilityFactors();
    @Builder.Default
    Map<MitigationMaturity, Double> maturityFactors = defaultMaturityFactors();
    @Builder.Default
    int parallelism = 1;
    @Builder.Default
    IndustryProfile industry = IndustryProfile.GENERIC;

    public static RefinementSettings defaults() {
        return RefinementSettings.builder().build();
    }

    public static RefinementSettings from(RefinerConfig config) {
        RefinerConfig effective = config != null ? config.ensureDefaults() : RefinerConfig.load();
        Map<Exploitability, Double> exploitability = new EnumMap<>(Exploitability.class);
        for (Exploitability level : Exploitability.values()) {
            exploitability.put(level, effective.getRisk().getExploitabilityFactors().getOrDefault(level.name(), 1.0));
        }
        Map<MitigationMaturity, Double> maturity = new EnumMap<>(MitigationMaturity.class);
        for (MitigationMaturity level : MitigationMaturity.values()) {
            maturity.put(level, effective.getRisk().getMaturityFactors().getOrDefault(level.name(), 1.0));
        }

        return RefinementSettings.builder()
            .componentAcceptanceThreshold(effective.getStandardizer().getAcceptanceThreshold())
            .cveStalenessYears(effective.getCve().getStalenessYears())
            .similarityThreshold(effective.getDeduplication().getSimilarityThreshold())
            .requireSameComponent(effective.getDeduplication().getRequireSameComponent())
            .maxRiskScore(effective.getRisk().getMaxScore())
            .exploitabilityFactors(Collections.unmodifiableMap(exploitability))
            .maturityFactors(Collections.unmodifiableMap(maturity))
            .parallelism(effective.getPipeline().getParallelism())
            .industry(IndustryProfile.parseOrGeneric(effective.getPipeline().getIndustry()))
            .build();
    }

    public double exploitabilityFactor(Exploitability exploitability) {
        return exploitabilityFactors.getOrDefault(exploitability, 1.0);
    }

    public double maturityFactor(MitigationMaturity maturity) {
        return maturityFactors.getOrDefault(maturity, 1.0);
    }

    /**
     * Копия настроек, в которой немонотонные коэффициенты заменены значениями по умолчанию,
     * как при загрузке из YAML. Рост exploitability не может снижать риск, рост зрелости защиты
     * не может его повышать.
     */
    public RefinementSettings withMonotonicFactors() {
        boolean exploitabilityValid = isAscending(exploitabilityFactors,
            Exploitability.LOW, Exploitability.MEDIUM, Exploitability.HIGH);
        boolean maturityValid = isAscending(maturityFactors,
            MitigationMaturity.STRONG, MitigationMaturity.PARTIAL, MitigationMaturity.NONE);
        if (exploitabilityValid && maturityValid) {
            return this;
        }
        RefinementSettingsBuilder corrected = toBuilder();
        if (!exploitabilityValid) {
            log.warn("Коэффициенты exploitability не монотонны {}, используются значения по умолчанию",
                exploitabilityFactors);
            corrected.exploitabilityFactors(defaultExploitabilityFactors());
        }
        if (!maturityValid) {
            log.warn("Коэффициенты зрелости защиты не монотонны {}, используются значения по умолчанию",
                maturityFactors);
            corrected.maturityFactors(defaultMaturityFactors());
        }
        return corrected.build();
    }

    /**
     * Параметры обработки для метаданных отчёта
     */
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("componentAcceptanceThreshold", componentAcceptanceThreshold);
        description.put("similarityThreshold", similarityThreshold);
        description.put("requireSameComponent", requireSameComponent);
        description.put("cveRelevanceYears", cveStalenessYears);
        description.put("maxRiskScore", maxRiskScore);
        return description;
    }

    @SafeVarargs
    private static <K> boolean isAscending(Map<K, Double> factors, K... keys) {
        if (factors == null) {
            return false;
        }
        double previous = -1;
        for (K key : keys) {
            Double value = factors.get(key);
            if (value == null || value.isNaN() || value < 0 || value < previous) {
                return false;
            }
            previous = value;
        }
        return true;
    }

    private static Map<Exploitability, Double> defaultExploitabilityFactors() {
        Map<Exploitability, Double> factors = new EnumMap<>(Exploitability.class);
        factors.put(Exploitability.LOW, 0.8);
        factors.put(Exploitability.MEDIUM, 1.0);
        factors.put(Exploitability.HIGH, 1.25);
        return Collections.unmodifiableMap(factors);
    }

    private static Map<MitigationMaturity, Double> defaultMaturityFactors() {
        Map<MitigationMaturity, Double> factors = new EnumMap<>(MitigationMaturity.class);
        factors.put(MitigationMaturity.NONE, 1.0);
        factors.put(MitigationMaturity.PARTIAL, 0.7);
        factors.put(MitigationMaturity.STRONG, 0.4);
        return Collections.unmodifiableMap(factors);
    }
}
