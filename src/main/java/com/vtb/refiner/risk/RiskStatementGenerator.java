package com.vtb.refiner.risk;

import com.vtb.refiner.config.RefinementSettings;
import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.DataClassification;
import com.vtb.refiner.models.IndustryProfile;
import com.vtb.refiner.models.RiskAssessment;
import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Отраслевой risk statement. Значения риска не меняет, только текст.
 */
@Slf4j
public class RiskStatementGenerator {

    static final String NOTE_PCI = "pci_dss";
    static final String NOTE_HIPAA = "hipaa";
    static final String NOTE_GDPR = "gdpr";
    static final String NOTE_REDUCTION = "residual_reduction";

    private final RiskStatementTemplates templates;
    private final IndustryProfile industry;
    private final RefinementSettings settings;
    private final Map<String, Component> inventory = new HashMap<>();

    public RiskStatementGenerator(RiskStatementTemplates templates, IndustryProfile industry,
                                  RefinementSettings settings, List<Component> inventory) {
        this.templates = templates;
        this.industry = industry != null ? industry : IndustryProfile.GENERIC;
        this.settings = settings;
        if (inventory != null) {
            inventory.forEach(component -> this.inventory.putIfAbsent(component.getCanonicalName(), component));
        }
    }

    public String generate(Threat threat) {
        RiskAssessment risk = threat.getRisk();
        if (risk == null || risk.getResidualRisk() == null) {
            throw new IllegalStateException("Для угрозы " + threat.getId() + " не рассчитан остаточный риск");
        }

        String template = templates.resolve(threat.getStrideCategory(), industry);
        StringBuilder statement = new StringBuilder(render(template, threat, risk));

        Component component = threat.getCanonicalComponent() != null ? inventory.get(threat.getCanonicalComponent()) : null;
        DataClassification classification = component != null ? component.getDataClassification() : null;
        if (industry == IndustryProfile.FINANCE && classification == DataClassification.PCI) {
            appendNote(statement, NOTE_PCI, threat, risk);
        } else if (industry == IndustryProfile.HEALTHCARE && classification == DataClassification.PHI) {
            appendNote(statement, NOTE_HIPAA, threat, risk);
        }
        if (classification == DataClassification.PII) {
            appendNote(statement, NOTE_GDPR, threat, risk);
        }
        if (settings.maturityFactor(risk.getMitigationMaturity()) < 1.0) {
            appendNote(statement, NOTE_REDUCTION, threat, risk);
        }

        String result = statement.toString();
        risk.setRiskStatement(result);
        return result;
    }

    private void appendNote(StringBuilder statement, String key, Threat threat, RiskAssessment risk) {
        String note = templates.note(key);
        if (note == null) {
            log.debug("Примечание '{}' отсутствует в шаблонах", key);
            return;
        }
        statement.append(' ').append(render(note, threat, risk));
    }

    static String render(String template, Threat threat, RiskAssessment risk) {
        return template
            .replace("{component}", String.valueOf(threat.getEffectiveComponent()))
            .replace("{residualRisk}", String.format(Locale.ROOT, "%.2f", risk.getResidualRisk()))
            .replace("{riskLevel}", risk.getRiskLevel() != null ? risk.getRiskLevel().getDisplayName() : "")
            .replace("{businessImpact}", risk.getBusinessImpactStatement() != null ? risk.getBusinessImpactStatement() : "")
            .replace("{description}", threat.getDescription() != null ? threat.getDescription() : "")
            .trim();
    }
}
