package com.vtb.refiner.suppression;

import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.ControlStrength;
import com.vtb.refiner.models.StrideCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Старый формат файла контролей: набор булевых флагов вида {"mtls_enabled": true, ...}.
 * Каждый включённый флаг превращается в глобальный контроль.
 */
@Slf4j
public final class LegacyControlFlags {

    private static final Map<String, Control> FLAG_CONTROLS = new LinkedHashMap<>();

    static {
        register("mtls_enabled", "Mutual TLS", "Authentication", StrideCategory.SPOOFING, ControlStrength.FULL);
        register("waf_enabled", "Web Application Firewall", "Network", StrideCategory.TAMPERING, ControlStrength.PARTIAL);
        register("secrets_manager", "Secrets Manager", "Secrets", StrideCategory.INFORMATION_DISCLOSURE,
            ControlStrength.PARTIAL);
        register("rate_limiting", "Rate Limiting", "Availability", StrideCategory.DENIAL_OF_SERVICE,
            ControlStrength.PARTIAL);
        register("centralized_logging", "Centralized Logging", "Audit", StrideCategory.REPUDIATION,
            ControlStrength.PARTIAL);
        register("https_enabled", "HTTPS", "Transport", StrideCategory.INFORMATION_DISCLOSURE, ControlStrength.PARTIAL);
    }

    private LegacyControlFlags() {
    }

    private static void register(String flag, String name, String category, StrideCategory coverage,
                                 ControlStrength strength) {
        FLAG_CONTROLS.put(flag, Control.builder()
            .name(name)
            .category(category)
            .coveredCategory(coverage)
            .scope(Control.GLOBAL_SCOPE)
            .strength(strength)
            .build());
    }

    /**
     * Похож ли объект на старый формат: есть хотя бы один известный флаг
     */
    public static boolean isLegacyFormat(Map<String, ?> document) {
        return document != null && document.keySet().stream()
            .anyMatch(key -> key != null && FLAG_CONTROLS.containsKey(key.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Включённые флаги в глобальные контроли (в порядке известных флагов)
     */
    public static List<Control> toControls(Map<String, ?> flags) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        flags.forEach((key, value) -> {
            if (key != null) {
                normalized.put(key.trim().toLowerCase(Locale.ROOT), value);
            }
        });
        for (String key : normalized.keySet()) {
            if (!FLAG_CONTROLS.containsKey(key)) {
                log.warn("Неизвестный флаг контроля '{}' пропущен", key);
            }
        }

        List<Control> controls = new ArrayList<>();
        FLAG_CONTROLS.forEach((flag, control) -> {
            if (isEnabled(normalized.get(flag))) {
                controls.add(control);
            }
        });
        return controls;
    }

    private static boolean isEnabled(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }
}
