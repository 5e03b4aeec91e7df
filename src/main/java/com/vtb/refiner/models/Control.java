package com.vtb.refiner.models;

import com.vtb.refiner.semantic.TextSimilarity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

/**
 * Внедрённый контроль безопасности
 */
@Value
@Builder
public class Control {

    public static final String GLOBAL_SCOPE = "global";

    String name;
    String category;
    @Singular("coveredCategory")
    Set<StrideCategory> coverage;
    @Singular("scope")
    Set<String> appliesTo;
    @Builder.Default
    ControlStrength strength = ControlStrength.FULL;

    public boolean covers(StrideCategory category) {
        return category != null && coverage.contains(category);
    }

    public boolean isGlobal() {
        return appliesTo.stream().anyMatch(scope -> GLOBAL_SCOPE.equals(scope.toLowerCase(Locale.ROOT)));
    }

    /**
     * Привязан ли контроль к конкретному компоненту (без учёта "global").
     * Имена сравниваются без учёта регистра и лишних пробелов, как в стандартизаторе.
     */
    public boolean touchesComponent(String canonicalName) {
        if (canonicalName == null) {
            return false;
        }
        String normalized = TextSimilarity.normalize(canonicalName);
        return appliesTo.stream().anyMatch(scope -> TextSimilarity.normalize(scope).equals(normalized));
    }

    public boolean canSuppress() {
        return strength == ControlStrength.FULL;
    }
}
