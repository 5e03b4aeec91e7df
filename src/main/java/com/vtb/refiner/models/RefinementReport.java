package com.vtb.refiner.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Итог прогона: все угрозы с финальными статусами, кластеры, статистика и предупреждения.
 */
@Data
@Builder
public class RefinementReport {
    private Instant generatedAt;
    private IndustryProfile industry;
    private Map<String, Object> processingConfig;

    @Builder.Default
    private List<Threat> threats = new ArrayList<>();
    @Builder.Default
    private List<Cluster> clusters = new ArrayList<>();
    @Builder.Default
    private List<RejectedRecord> rejectedRecords = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private RefinementStatistics statistics;

    @JsonIgnore
    public List<Threat> getActiveThreats() {
        return threats.stream()
            .filter(Threat::isActive)
            .collect(Collectors.toList());
    }

    public Threat findThreat(String id) {
        return threats.stream()
            .filter(t -> t.getId().equals(id))
            .findFirst()
            .orElse(null);
    }

    /**
     * Есть ли активные угрозы уровня CRITICAL
     */
    public boolean hasCriticalThreats() {
        return threats.stream()
            .filter(Threat::isActive)
            .anyMatch(t -> t.getRisk() != null && t.getRisk().getRiskLevel() == Severity.CRITICAL);
    }
}
