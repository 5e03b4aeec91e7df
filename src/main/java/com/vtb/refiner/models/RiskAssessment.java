package com.vtb.refiner.models;

import lombok.Builder;
import lombok.Data;

/**
 * Производные поля риска, заполняются только для активных представителей кластеров
 */
@Data
@Builder
public class RiskAssessment {
    private Exploitability exploitability;
    private MitigationMaturity mitigationMaturity;
    private Double residualRisk;
    private Severity riskLevel;
    private String businessImpactStatement;
    private String justification;
    private String riskStatement;
}
