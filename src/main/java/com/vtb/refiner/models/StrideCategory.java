package com.vtb.refiner.models;

import java.util.Locale;

/**
 * Категории угроз STRIDE
 */
public enum StrideCategory {
    SPOOFING("S", "Spoofing"),
    TAMPERING("T", "Tampering"),
    REPUDIATION("R", "Repudiation"),
    INFORMATION_DISCLOSURE("I", "Information Disclosure"),
    DENIAL_OF_SERVICE("D", "Denial of Service"),
    ELEVATION_OF_PRIVILEGE("E", "Elevation of Privilege");

    private final String code;
    private final String displayName;

    StrideCategory(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Разбор категории из свободной формы LLM: "S", "Spoofing", "information-disclosure",
     * "Information Disclosure", "DENIAL_OF_SERVICE".
     *
     * @return категория или null, если строка не распознана
     */
    public static StrideCategory parse(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String key = trimmed.toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        for (StrideCategory category : values()) {
            if (category.code.equals(key) || category.name().equals(key)
                || category.displayName.toUpperCase(Locale.ROOT).replace(' ', '_').equals(key)) {
                return category;
            }
        }
        return null;
    }
}
