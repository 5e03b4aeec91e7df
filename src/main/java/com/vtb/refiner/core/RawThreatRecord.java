package com.vtb.refiner.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Угроза в том виде, в каком её прислал генератор: поля слабо типизированы,
 * неизвестные поля собираются в {@link #extra}. Приводится к {@link com.vtb.refiner.models.Threat}
 * в {@link ThreatIngestor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawThreatRecord {

    @JsonAlias({"threat_id", "threatId"})
    private String id;

    @JsonAlias({"component_name", "componentName", "component", "component_ref"})
    private String componentRef;

    @JsonAlias({"stride_category", "stride", "category"})
    private String strideCategory;

    @JsonAlias({"threat_description", "threatDescription"})
    private String description;

    /** Строка или список строк */
    @JsonAlias({"mitigation_suggestion", "mitigationSuggestion", "mitigation_suggestions", "mitigations"})
    private Object mitigationSuggestions;

    /** Число или числовая строка */
    @JsonAlias({"inherent_risk_score", "inherentRisk", "risk_score_numeric"})
    private Object inherentRiskScore;

    private String impact;
    private String likelihood;

    @JsonAlias({"cited_cves", "cves"})
    private Object citedCves;

    /** Смешанный список: CVE, CWE, CAPEC, ATT&CK, стандарты */
    private Object references;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }
}
