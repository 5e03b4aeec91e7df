package com.vtb.refiner.risk;

import com.vtb.refiner.config.RefinementSettings;
import com.vtb.refiner.knowledge.VulnerabilitySnapshot;
import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.Exploitability;
import com.vtb.refiner.models.MitigationMaturity;
import com.vtb.refiner.models.RiskAssessment;
import com.vtb.refiner.models.Severity;
import com.vtb.refiner.models.Threat;
import com.vtb.refiner.models.VulnerabilityRecord;
import com.vtb.refiner.suppression.CveRelevanceFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Матрица риска и остаточный риск.
 *
 * residual = clip(inherent * k_exploitability * k_maturity, 0, max), округление до 0.01.
 * Работает только с активными угрозами: всё остальное означает ошибку конвейера.
 */
@Slf4j
public class RiskCalculator {

    private final RefinementSettings settings;
    private final List<Control> controls;
    private final Map<String, Component> inventory;
    private final VulnerabilitySnapshot snapshot;
    private final CveRelevanceFilter relevance;

    public RiskCalculator(RefinementSettings settings, List<Control> controls, List<Component> inventory,
                          VulnerabilitySnapshot snapshot, CveRelevanceFilter relevance) {
        this.settings = settings.withMonotonicFactors();
        this.controls = controls != null ? List.copyOf(controls) : List.of();
        this.inventory = new LinkedHashMap<>();
        if (inventory != null) {
            inventory.forEach(component -> this.inventory.putIfAbsent(component.getCanonicalName(), component));
        }
        this.snapshot = snapshot != null ? snapshot : VulnerabilitySnapshot.empty();
        this.relevance = relevance;
    }

    public RiskAssessment assess(Threat threat) {
        if (!threat.isActive()) {
            throw new IllegalStateException(String.format(
                "Угроза %s в статусе %s не может получать расчёт риска", threat.getId(), threat.getStatus()));
        }

        Exploitability exploitability = assessExploitability(threat);
        Optional<Control> strongControl = findComponentControl(threat);
        Optional<Control> globalControl = strongControl.isPresent() ? Optional.empty() : findGlobalControl(threat);
        MitigationMaturity maturity = strongControl.isPresent() ? MitigationMaturity.STRONG
            : globalControl.isPresent() ? MitigationMaturity.PARTIAL : MitigationMaturity.NONE;

        double residual = residualRisk(threat.getInherentRiskScore(), exploitability, maturity);
        Component component = threat.getCanonicalComponent() != null ? inventory.get(threat.getCanonicalComponent()) : null;

        RiskAssessment assessment = RiskAssessment.builder()
            .exploitability(exploitability)
            .mitigationMaturity(maturity)
            .residualRisk(residual)
            .riskLevel(Severity.fromScore(residual))
            .businessImpactStatement(BusinessImpactCatalog.describe(component, threat.getEffectiveComponent(),
                threat.getStrideCategory()))
            .justification(justify(threat, exploitability, maturity, strongControl.or(() -> globalControl)))
            .build();
        threat.setRisk(assessment);
        log.debug("Угроза {}: inherent={} exploitability={} maturity={} residual={}", threat.getId(),
            threat.getInherentRiskScore(), exploitability, maturity, residual);
        return assessment;
    }

    public Exploitability assessExploitability(Threat threat) {
        boolean relevant = false;
        for (String cveId : threat.getCitedCves()) {
            Optional<VulnerabilityRecord> record = snapshot.lookup(cveId);
            if (record.isEmpty()) {
                relevant = true;
                continue;
            }
            if (record.get().isInKnownExploitedCatalog()) {
                return Exploitability.HIGH;
            }
            if (!relevance.isStale(record.get())) {
                relevant = true;
            }
        }
        return relevant ? Exploitability.MEDIUM : Exploitability.LOW;
    }

    public double residualRisk(double inherent, Exploitability exploitability, MitigationMaturity maturity) {
        double raw = inherent * settings.exploitabilityFactor(exploitability) * settings.maturityFactor(maturity);
        double clipped = Math.max(0.0, Math.min(settings.getMaxRiskScore(), raw));
        return Math.round(clipped * 100.0) / 100.0;
    }

    private Optional<Control> findComponentControl(Threat threat) {
        if (threat.getCanonicalComponent() == null) {
            return Optional.empty();
        }
        return controls.stream()
            .filter(control -> control.covers(threat.getStrideCategory()))
            .filter(control -> control.touchesComponent(threat.getCanonicalComponent()))
            .findFirst();
    }

    private Optional<Control> findGlobalControl(Threat threat) {
        return controls.stream()
            .filter(control -> control.covers(threat.getStrideCategory()))
            .filter(Control::isGlobal)
            .findFirst();
    }

    private String justify(Threat threat, Exploitability exploitability, MitigationMaturity maturity,
                           Optional<Control> control) {
        StringBuilder text = new StringBuilder("Exploitability rated ").append(exploitability.name());
        List<String> exploited = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String cveId : threat.getCitedCves()) {
            Optional<VulnerabilityRecord> record = snapshot.lookup(cveId);
            if (record.isEmpty()) {
                unknown.add(cveId);
            } else if (record.get().isInKnownExploitedCatalog()) {
                exploited.add(cveId);
            }
        }
        if (!exploited.isEmpty()) {
            text.append(" because ").append(String.join(", ", exploited)).append(" is known to be exploited");
        } else if (threat.getCitedCves().isEmpty()) {
            text.append(" as no CVE is cited");
        } else if (exploitability == Exploitability.LOW) {
            text.append(" as all cited CVEs are outside the relevance window");
        } else if (!unknown.isEmpty()) {
            text.append(" as relevance of ").append(String.join(", ", unknown)).append(" is unknown");
        } else {
            text.append(" as cited CVEs are recent");
        }

        text.append("; mitigation maturity ").append(maturity.name());
        if (control.isPresent()) {
            text.append(" via control '").append(control.get().getName()).append('\'')
                .append(maturity == MitigationMaturity.STRONG ? " on the component" : " applied globally");
        } else {
            text.append(" as no implemented control covers ").append(threat.getStrideCategory().getDisplayName());
        }
        return text.append('.').toString();
    }
}
