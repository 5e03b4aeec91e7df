package com.vtb.refiner.core;

import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.ComponentType;
import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.ControlStrength;
import com.vtb.refiner.models.DataClassification;
import com.vtb.refiner.models.RejectedRecord;
import com.vtb.refiner.models.StrideCategory;
import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Приведение сырых записей к строгой схеме.
 *
 * Запись, которая не проходит валидацию, исключается из прогона и попадает в список отклонённых;
 * остальной пакет обрабатывается дальше.
 */
@Slf4j
public class ThreatIngestor {

    static final Pattern CVE_ID = Pattern.compile("^CVE-\\d{4}-\\d{4,}$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> IMPACT_VALUES = Map.of(
        "CRITICAL", 4, "HIGH", 3, "MEDIUM", 2, "LOW", 1);
    private static final Map<String, Integer> LIKELIHOOD_VALUES = Map.of(
        "HIGH", 3, "MEDIUM", 2, "LOW", 1);
    private static final String DEFAULT_LEVEL = "Medium";

    private final double maxScore;

    public ThreatIngestor(double maxScore) {
        this.maxScore = maxScore;
    }

    public ThreatIngestor() {
        this(10.0);
    }

    /**
     * Результат валидации пакета
     */
    public record Ingested<T>(List<T> accepted, List<RejectedRecord> rejected) {}

    public Ingested<Threat> ingestThreats(List<RawThreatRecord> records) {
        List<Threat> accepted = new ArrayList<>();
        List<RejectedRecord> rejected = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        if (records == null) {
            return new Ingested<>(accepted, rejected);
        }

        for (int position = 0; position < records.size(); position++) {
            RawThreatRecord raw = records.get(position);
            String id = raw != null && raw.getId() != null && !raw.getId().isBlank()
                ? raw.getId().trim()
                : String.format("THREAT-%04d", position + 1);
            try {
                if (raw == null) {
                    throw new IllegalArgumentException("пустая запись");
                }
                if (!seenIds.add(id)) {
                    throw new IllegalArgumentException("повторяющийся id " + id);
                }
                accepted.add(toThreat(id, raw));
            } catch (IllegalArgumentException e) {
                log.warn("Угроза {} (позиция {}) отклонена: {}", id, position + 1, e.getMessage());
                rejected.add(RejectedRecord.builder()
                    .kind(RejectedRecord.Kind.THREAT)
                    .reference(id)
                    .reason(e.getMessage())
                    .build());
            }
        }
        return new Ingested<>(accepted, rejected);
    }

    public Ingested<Component> ingestComponents(List<RawComponentRecord> records) {
        List<Component> accepted = new ArrayList<>();
        List<RejectedRecord> rejected = new ArrayList<>();
        Set<String> names = new HashSet<>();
        if (records == null) {
            return new Ingested<>(accepted, rejected);
        }

        for (int position = 0; position < records.size(); position++) {
            RawComponentRecord raw = records.get(position);
            String reference = raw != null && raw.getCanonicalName() != null && !raw.getCanonicalName().isBlank()
                ? raw.getCanonicalName().trim()
                : "#" + (position + 1);
            try {
                if (raw == null || raw.getCanonicalName() == null || raw.getCanonicalName().isBlank()) {
                    throw new IllegalArgumentException("не указано каноническое имя");
                }
                ComponentType type = ComponentType.parse(raw.getType());
                if (type == null) {
                    throw new IllegalArgumentException("неизвестный тип компонента '" + raw.getType() + "'");
                }
                if (!names.add(reference)) {
                    throw new IllegalArgumentException("повторяющееся имя компонента");
                }
                DataClassification classification = DataClassification.parse(raw.getDataClassification());
                if (classification == null && raw.getDataClassification() != null && !raw.getDataClassification().isBlank()) {
                    log.debug("Компонент {}: неизвестная классификация '{}' проигнорирована", reference,
                        raw.getDataClassification());
                }
                accepted.add(Component.builder()
                    .canonicalName(reference)
                    .type(type)
                    .description(raw.getDescription())
                    .dataClassification(classification)
                    .build());
            } catch (IllegalArgumentException e) {
                log.warn("Компонент {} отклонён: {}", reference, e.getMessage());
                rejected.add(RejectedRecord.builder()
                    .kind(RejectedRecord.Kind.COMPONENT)
                    .reference(reference)
                    .reason(e.getMessage())
                    .build());
            }
        }
        return new Ingested<>(accepted, rejected);
    }

    public Ingested<Control> ingestControls(List<RawControlRecord> records) {
        List<Control> accepted = new ArrayList<>();
        List<RejectedRecord> rejected = new ArrayList<>();
        if (records == null) {
            return new Ingested<>(accepted, rejected);
        }

        for (int position = 0; position < records.size(); position++) {
            RawControlRecord raw = records.get(position);
            String reference = raw != null && raw.getName() != null && !raw.getName().isBlank()
                ? raw.getName().trim()
                : "#" + (position + 1);
            try {
                if (raw == null || raw.getName() == null || raw.getName().isBlank()) {
                    throw new IllegalArgumentException("не указано имя контроля");
                }
                Control.ControlBuilder builder = Control.builder()
                    .name(reference)
                    .category(raw.getCategory())
                    .strength(parseStrength(raw.getStrength()));
                List<String> coverage = asStrings(raw.getCoverage());
                if (coverage.isEmpty()) {
                    throw new IllegalArgumentException("пустое покрытие STRIDE");
                }
                for (String value : coverage) {
                    StrideCategory category = StrideCategory.parse(value);
                    if (category == null) {
                        throw new IllegalArgumentException("неизвестная категория STRIDE '" + value + "'");
                    }
                    builder.coveredCategory(category);
                }
                List<String> scopes = asStrings(raw.getAppliesTo());
                if (scopes.isEmpty()) {
                    throw new IllegalArgumentException("не указано appliesTo");
                }
                for (String scope : scopes) {
                    builder.scope(Control.GLOBAL_SCOPE.equalsIgnoreCase(scope) ? Control.GLOBAL_SCOPE : scope);
                }
                accepted.add(builder.build());
            } catch (IllegalArgumentException e) {
                log.warn("Контроль {} отклонён: {}", reference, e.getMessage());
                rejected.add(RejectedRecord.builder()
                    .kind(RejectedRecord.Kind.CONTROL)
                    .reference(reference)
                    .reason(e.getMessage())
                    .build());
            }
        }
        return new Ingested<>(accepted, rejected);
    }

    private Threat toThreat(String id, RawThreatRecord raw) {
        if (raw.getComponentRef() == null || raw.getComponentRef().isBlank()) {
            throw new IllegalArgumentException("не указан компонент");
        }
        StrideCategory category = StrideCategory.parse(raw.getStrideCategory());
        if (category == null) {
            throw new IllegalArgumentException("неизвестная категория STRIDE '" + raw.getStrideCategory() + "'");
        }
        if (raw.getDescription() == null || raw.getDescription().isBlank()) {
            throw new IllegalArgumentException("пустое описание");
        }

        Set<String> cves = new LinkedHashSet<>();
        Set<String> otherReferences = new LinkedHashSet<>();
        for (String reference : asStrings(raw.getCitedCves())) {
            if (!addCve(reference, cves)) {
                log.debug("Угроза {}: '{}' в cited_cves не является CVE", id, reference);
                otherReferences.add(reference);
            }
        }
        for (String reference : asStrings(raw.getReferences())) {
            if (!addCve(reference, cves)) {
                otherReferences.add(reference);
            }
        }

        return Threat.builder()
            .id(id)
            .componentRef(raw.getComponentRef().trim())
            .strideCategory(category)
            .description(raw.getDescription().trim())
            .mitigationSuggestions(new ArrayList<>(new LinkedHashSet<>(asStrings(raw.getMitigationSuggestions()))))
            .citedCves(cves)
            .otherReferences(otherReferences)
            .inherentRiskScore(resolveScore(raw))
            .impact(raw.getImpact())
            .likelihood(raw.getLikelihood())
            .build();
    }

    private static boolean addCve(String reference, Set<String> cves) {
        String normalized = reference.trim().toUpperCase(Locale.ROOT);
        if (CVE_ID.matcher(normalized).matches()) {
            cves.add(normalized);
            return true;
        }
        return false;
    }

    /**
     * Явная оценка, иначе матрица impact x likelihood (по умолчанию Medium/Medium)
     */
    double resolveScore(RawThreatRecord raw) {
        Object value = raw.getInherentRiskScore();
        if (value == null || (value instanceof String s && s.isBlank())) {
            return deriveScore(raw.getImpact(), raw.getLikelihood());
        }
        double score;
        if (value instanceof Number number) {
            score = number.doubleValue();
        } else {
            try {
                score = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("нечисловая оценка риска '" + value + "'");
            }
        }
        if (Double.isNaN(score) || Double.isInfinite(score) || score < 0) {
            throw new IllegalArgumentException("недопустимая оценка риска " + value);
        }
        if (score > maxScore) {
            log.debug("Оценка риска {} обрезана до {}", score, maxScore);
            return maxScore;
        }
        return score;
    }

    /**
     * impact (Critical 4, High 3, Medium 2, Low 1) x likelihood (High 3, Medium 2, Low 1),
     * произведение 1..12 переводится в шкалу 0-10
     */
    double deriveScore(String impact, String likelihood) {
        int impactValue = IMPACT_VALUES.getOrDefault(level(impact), IMPACT_VALUES.get("MEDIUM"));
        int likelihoodValue = LIKELIHOOD_VALUES.getOrDefault(level(likelihood), LIKELIHOOD_VALUES.get("MEDIUM"));
        double score = impactValue * likelihoodValue * maxScore / 12.0;
        return Math.round(score * 100.0) / 100.0;
    }

    private static String level(String raw) {
        return (raw == null || raw.isBlank() ? DEFAULT_LEVEL : raw).trim().toUpperCase(Locale.ROOT);
    }

    static List<String> asStrings(Object value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (!value.toString().isBlank()) {
            result.add(value.toString().trim());
        }
        return result;
    }

    private static ControlStrength parseStrength(String raw) {
        if (raw == null || raw.isBlank()) {
            return ControlStrength.FULL;
        }
        try {
            return ControlStrength.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("неизвестная сила контроля '" + raw + "'");
        }
    }
}
