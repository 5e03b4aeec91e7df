package com.vtb.refiner.models;

import java.util.Locale;

/**
 * Классификация данных компонента (если указана в инвентаре)
 */
public enum DataClassification {
    PII(true),
    PHI(true),
    PCI(true),
    CONFIDENTIAL(true),
    INTERNAL(false),
    PUBLIC(false);

    private final boolean regulated;

    DataClassification(boolean regulated) {
        this.regulated = regulated;
    }

    public boolean isRegulated() {
        return regulated;
    }

    public static DataClassification parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
