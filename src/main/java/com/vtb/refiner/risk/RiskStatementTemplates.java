package com.vtb.refiner.risk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.StrideCategory;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Шаблоны risk statement: категория STRIDE -> отраслевой профиль -> текст.
 * Загружаются из risk-statement-templates.yaml в classpath.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskStatementTemplates {

    public static final String DEFAULT_RESOURCE = "risk-statement-templates.yaml";

    static final String FALLBACK_TEMPLATE =
        "{businessImpact} Residual risk for '{component}' is {riskLevel} ({residualRisk}): {description}";

    @JsonProperty("default")
    private String defaultTemplate;
    private Map<String, Map<String, String>> templates = new LinkedHashMap<>();
    private Map<String, String> notes = new LinkedHashMap<>();

    public static RiskStatementTemplates load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = RiskStatementTemplates.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            return mapper.readValue(is, RiskStatementTemplates.class).normalize();
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки шаблонов risk statement: " + e.getMessage(), e);
        }
    }

    /**
     * Шаблон с откатом: (категория, профиль) -> (категория, GENERIC) -> шаблон по умолчанию
     */
    public String resolve(StrideCategory category, IndustryProfile industry) {
        Map<String, String> byIndustry = templates.get(category.name());
        if (byIndustry != null) {
            String exact = byIndustry.get(industry.name());
            if (exact != null) {
                return exact;
            }
            String generic = byIndustry.get(IndustryProfile.GENERIC.name());
            if (generic != null) {
                return generic;
            }
        }
        return defaultTemplate != null ? defaultTemplate : FALLBACK_TEMPLATE;
    }

    public String note(String key) {
        return notes.get(key);
    }

    /**
     * Ключи файла приводятся к именам enum, чтобы в YAML можно было писать information_disclosure или Finance
     */
    RiskStatementTemplates normalize() {
        Map<String, Map<String, String>> normalized = new LinkedHashMap<>();
        if (templates != null) {
            templates.forEach((categoryKey, byIndustry) -> {
                StrideCategory category = StrideCategory.parse(categoryKey);
                if (category == null || byIndustry == null) {
                    return;
                }
                Map<String, String> industries = normalized.computeIfAbsent(category.name(), k -> new LinkedHashMap<>());
                byIndustry.forEach((industryKey, template) ->
                    industries.put(IndustryProfile.parseOrGeneric(industryKey).name(), template));
            });
        }
        templates = normalized;
        Map<String, String> normalizedNotes = new LinkedHashMap<>();
        if (notes != null) {
            notes.forEach((key, value) -> normalizedNotes.put(key.trim().toLowerCase(Locale.ROOT), value));
        }
        notes = normalizedNotes;
        return this;
    }
}
