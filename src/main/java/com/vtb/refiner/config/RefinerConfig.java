package com.vtb.refiner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация движка уточнения угроз из YAML файла.
 * Пороги и веса не зашиты в стадии, а приходят отсюда через {@link RefinementSettings}.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RefinerConfig {

    public static final String DEFAULT_RESOURCE = "refiner-config.yaml";

    private Standardizer standardizer;
    private Cve cve;
    private Deduplication deduplication;
    private Risk risk;
    private Pipeline pipeline;

    /**
     * Загрузить конфигурацию по умолчанию из classpath
     */
    public static RefinerConfig load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = RefinerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            return mapper.readValue(is, RefinerConfig.class).ensureDefaults();
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить конфигурацию из файла (YAML или JSON)
     */
    public static RefinerConfig load(Path path) {
        if (path == null) {
            return load();
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Файл конфигурации не найден: " + path);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = Files.newInputStream(path)) {
            RefinerConfig config = mapper.readValue(is, RefinerConfig.class);
            return config != null ? config.ensureDefaults() : new RefinerConfig().ensureDefaults();
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    public RefinerConfig ensureDefaults() {
        if (standardizer == null) {
            standardizer = new Standardizer();
        }
        standardizer.ensureDefaults();
        if (cve == null) {
            cve = new Cve();
        }
        cve.ensureDefaults();
        if (deduplication == null) {
            deduplication = new Deduplication();
        }
        deduplication.ensureDefaults();
        if (risk == null) {
            risk = new Risk();
        }
        risk.ensureDefaults();
        if (pipeline == null) {
            pipeline = new Pipeline();
        }
        pipeline.ensureDefaults();
        return this;
    }

    @Data
    public static class Standardizer {
        private Double acceptanceThreshold;

        void ensureDefaults() {
            if (acceptanceThreshold == null || acceptanceThreshold <= 0 || acceptanceThreshold > 1) {
                acceptanceThreshold = 0.6;
            }
        }
    }

    @Data
    public static class Cve {
        private static final String DEFAULT_NVD_URL = "https://services.nvd.nist.gov/rest/json/cves/2.0";
        private static final String DEFAULT_KEV_URL =
            "https://www.cisa.gov/sites/default/files/feeds/known_exploited_vulnerabilities.json";

        private Integer stalenessYears;
        private Integer cacheTtlHours;
        private String nvdApiUrl;
        private String nvdApiKey;
        private String kevCatalogUrl;
        private Integer timeoutSec;
        private Retry retry;

        void ensureDefaults() {
            if (stalenessYears == null || stalenessYears <= 0) {
                stalenessYears = 5;
            }
            if (cacheTtlHours == null || cacheTtlHours <= 0) {
                cacheTtlHours = 24;
            }
            if (nvdApiUrl == null || nvdApiUrl.isBlank()) {
                nvdApiUrl = DEFAULT_NVD_URL;
            }
            if (kevCatalogUrl == null || kevCatalogUrl.isBlank()) {
                kevCatalogUrl = DEFAULT_KEV_URL;
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 30;
            }
            if (retry == null) {
                retry = new Retry();
            }
            retry.ensureDefaults();
        }
    }

    @Data
    public static class Retry {
        private Integer maxAttempts;
        private Long initialDelayMs;
        private Double multiplier;

        void ensureDefaults() {
            if (maxAttempts == null || maxAttempts < 1) {
                maxAttempts = 3;
            }
            if (initialDelayMs == null || initialDelayMs < 0) {
                initialDelayMs = 200L;
            }
            if (multiplier == null || multiplier < 1.0) {
                multiplier = 2.0;
            }
        }
    }

    @Data
    public static class Deduplication {
        private Double similarityThreshold;
        private Boolean requireSameComponent;

        void ensureDefaults() {
            if (similarityThreshold == null || similarityThreshold <= 0 || similarityThreshold > 1) {
                similarityThreshold = 0.85;
            }
            if (requireSameComponent == null) {
                requireSameComponent = Boolean.FALSE;
            }
        }
    }

    @Data
    public static class Risk {
        private Double maxScore;
        private Map<String, Double> exploitabilityFactors;
        private Map<String, Double> maturityFactors;

        void ensureDefaults() {
            if (maxScore == null || maxScore <= 0) {
                maxScore = 10.0;
            }
            exploitabilityFactors = upperCaseKeys(exploitabilityFactors);
            exploitabilityFactors.putIfAbsent("LOW", 0.8);
            exploitabilityFactors.putIfAbsent("MEDIUM", 1.0);
            exploitabilityFactors.putIfAbsent("HIGH", 1.25);
            if (!isAscending(exploitabilityFactors, "LOW", "MEDIUM", "HIGH")) {
                log.warn("Коэффициенты exploitability не монотонны {}, используются значения по умолчанию",
                    exploitabilityFactors);
                exploitabilityFactors = new LinkedHashMap<>(Map.of("LOW", 0.8, "MEDIUM", 1.0, "HIGH", 1.25));
            }

            maturityFactors = upperCaseKeys(maturityFactors);
            maturityFactors.putIfAbsent("NONE", 1.0);
            maturityFactors.putIfAbsent("PARTIAL", 0.7);
            maturityFactors.putIfAbsent("STRONG", 0.4);
            // Сильная защита не может давать риск выше частичной, частичная выше отсутствующей
            if (!isAscending(maturityFactors, "STRONG", "PARTIAL", "NONE")) {
                log.warn("Коэффициенты зрелости защиты не монотонны {}, используются значения по умолчанию",
                    maturityFactors);
                maturityFactors = new LinkedHashMap<>(Map.of("NONE", 1.0, "PARTIAL", 0.7, "STRONG", 0.4));
            }
        }

        private static Map<String, Double> upperCaseKeys(Map<String, Double> factors) {
            Map<String, Double> normalized = new LinkedHashMap<>();
            if (factors != null) {
                factors.forEach((key, value) -> {
                    if (key != null && value != null) {
                        normalized.put(key.trim().toUpperCase(Locale.ROOT), value);
                    }
                });
            }
            return normalized;
        }

        private static boolean isAscending(Map<String, Double> factors, String... keys) {
            double previous = -1;
            for (String key : keys) {
                Double value = factors.get(key);
                if (value == null || value < 0 || value < previous) {
                    return false;
                }
                previous = value;
            }
            return true;
        }
    }

    @Data
    public static class Pipeline {
        private Integer parallelism;
        private String industry;

        void ensureDefaults() {
            if (parallelism == null || parallelism < 1) {
                parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
            }
            if (industry == null || industry.isBlank()) {
                industry = "GENERIC";
            }
        }
    }
}
