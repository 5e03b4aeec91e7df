package com.vtb.refiner.models;

import java.util.Locale;

/**
 * Отраслевой профиль заказчика, влияет только на текст risk statement
 */
public enum IndustryProfile {
    FINANCE,
    HEALTHCARE,
    GOVERNMENT,
    ECOMMERCE,
    GENERIC;

    /**
     * Разбор профиля; неизвестное значение даёт GENERIC.
     */
    public static IndustryProfile parseOrGeneric(String raw) {
        if (raw == null || raw.isBlank()) {
            return GENERIC;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        return switch (key) {
            case "FINANCE", "BANKING", "FINANCIAL" -> FINANCE;
            case "HEALTHCARE", "HEALTH", "MEDICAL" -> HEALTHCARE;
            case "GOVERNMENT", "PUBLIC_SECTOR" -> GOVERNMENT;
            case "ECOMMERCE", "E_COMMERCE", "RETAIL", "MARKETPLACE" -> ECOMMERCE;
            default -> GENERIC;
        };
    }
}
