package com.vtb.refiner.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Угроза (finding) в ходе уточнения.
 *
 * Создаётся один раз оркестратором из сырого пакета и далее меняется только стадиями
 * конвейера: переходы статуса и заполнение производных полей. Не удаляется, так что
 * подавленные и слитые угрозы остаются в отчёте для аудита.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Threat {
    private String id;
    private String componentRef;
    private String canonicalComponent;
    private ComponentType componentType;
    @Builder.Default
    private boolean unmatchedComponent = false;
    private StrideCategory strideCategory;
    private String description;
    @Builder.Default
    private List<String> mitigationSuggestions = new ArrayList<>();
    @Builder.Default
    private Set<String> citedCves = new LinkedHashSet<>();
    @Builder.Default
    private Set<String> otherReferences = new LinkedHashSet<>();
    private double inherentRiskScore;
    private String impact;
    private String likelihood;

    @Builder.Default
    private ThreatStatus status = ThreatStatus.ACTIVE;
    private String suppressedReason;
    private String clusterId;
    private String mergedInto;
    @Builder.Default
    private Set<String> irrelevantCves = new LinkedHashSet<>();

    private RiskAssessment risk;

    @JsonIgnore
    public boolean isActive() {
        return status == ThreatStatus.ACTIVE;
    }

    /**
     * Компонент для сопоставления: каноническое имя, если стандартизация удалась, иначе как в источнике
     */
    @JsonIgnore
    public String getEffectiveComponent() {
        return canonicalComponent != null ? canonicalComponent : componentRef;
    }

    /**
     * Перевести угрозу в SUPPRESSED. Терминальный статус не меняется.
     */
    public void suppress(String reason) {
        requireActive("suppress");
        this.status = ThreatStatus.SUPPRESSED;
        this.suppressedReason = reason;
    }

    /**
     * Перевести угрозу в MERGED внутри кластера
     */
    public void mergeInto(String representativeId) {
        requireActive("merge");
        this.status = ThreatStatus.MERGED;
        this.mergedInto = representativeId;
    }

    @JsonIgnore
    public Double getResidualRisk() {
        return risk != null ? risk.getResidualRisk() : null;
    }

    private void requireActive(String transition) {
        if (status != ThreatStatus.ACTIVE) {
            throw new IllegalStateException(String.format(
                "Недопустимый переход %s для угрозы %s в статусе %s", transition, id, status));
        }
    }
}
