package com.vtb.refiner.semantic;

import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Сопоставляет свободное имя компонента из угрозы с каноническим именем из инвентаря.
 *
 * Метрика: {@link TextSimilarity#componentSimilarity}. Ниже порога угроза помечается
 * unmatchedComponent и сохраняет исходное имя. При равенстве оценок побеждает компонент,
 * стоящий раньше в инвентаре.
 */
@Slf4j
public class ComponentNameStandardizer {

    private static final Pattern FLOW_PREFIX = Pattern.compile("^data\\s+flow\\s+from\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern FLOW_SUFFIX = Pattern.compile("\\s+data\\s+flow$", Pattern.CASE_INSENSITIVE);

    private final List<Component> inventory;
    private final double acceptanceThreshold;

    public ComponentNameStandardizer(List<Component> inventory, double acceptanceThreshold) {
        this.inventory = inventory != null ? List.copyOf(inventory) : List.of();
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public boolean hasInventory() {
        return !inventory.isEmpty();
    }

    /**
     * Стандартизировать имя компонента угрозы на месте.
     *
     * @return true, если найдено соответствие не ниже порога
     */
    public boolean standardize(Threat threat) {
        Match best = findBestMatch(threat.getComponentRef());
        if (best == null || best.score() < acceptanceThreshold) {
            threat.setUnmatchedComponent(true);
            log.debug("Угроза {}: компонент '{}' не сопоставлен (лучший результат {})",
                threat.getId(), threat.getComponentRef(),
                best != null ? String.format("%s=%.2f", best.component().getCanonicalName(), best.score()) : "нет");
            return false;
        }
        threat.setCanonicalComponent(best.component().getCanonicalName());
        threat.setComponentType(best.component().getType());
        threat.setUnmatchedComponent(false);
        log.debug("Угроза {}: '{}' -> '{}' ({})", threat.getId(), threat.getComponentRef(),
            best.component().getCanonicalName(), String.format("%.2f", best.score()));
        return true;
    }

    /**
     * Лучший кандидат из инвентаря без учёта порога
     */
    public Match findBestMatch(String componentRef) {
        if (componentRef == null || componentRef.isBlank() || inventory.isEmpty()) {
            return null;
        }
        List<String> variants = new ArrayList<>(referenceVariants(componentRef));
        Match best = null;
        for (Component component : inventory) {
            double score = 0.0;
            for (String variant : variants) {
                score = Math.max(score, TextSimilarity.componentSimilarity(variant, component.getCanonicalName()));
            }
            // строгое сравнение: при равенстве остаётся более ранний компонент инвентаря
            if (best == null || score > best.score()) {
                best = new Match(component, score);
            }
        }
        return best;
    }

    /**
     * Исходное имя плюс вариант без обёрток "Data Flow from ..." и "... data flow"
     */
    static Set<String> referenceVariants(String componentRef) {
        Set<String> variants = new LinkedHashSet<>();
        String normalized = TextSimilarity.normalize(componentRef);
        variants.add(normalized);
        String stripped = FLOW_SUFFIX.matcher(FLOW_PREFIX.matcher(normalized).replaceFirst("")).replaceFirst("");
        if (!stripped.isBlank()) {
            variants.add(stripped.trim());
        }
        return variants;
    }

    public record Match(Component component, double score) {}
}
