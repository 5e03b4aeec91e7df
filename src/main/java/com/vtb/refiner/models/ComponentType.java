package com.vtb.refiner.models;

import java.util.Locale;

/**
 * Типы элементов DFD
 */
public enum ComponentType {
    EXTERNAL_ENTITY("interactions with"),
    PROCESS("operations of"),
    DATA_STORE("data held in"),
    DATA_FLOW("data in transit over");

    private final String assetPhrase;

    ComponentType(String assetPhrase) {
        this.assetPhrase = assetPhrase;
    }

    public String getAssetPhrase() {
        return assetPhrase;
    }

    public static ComponentType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        return switch (key) {
            case "EXTERNAL_ENTITY", "EXTERNAL", "ENTITY", "ACTOR", "USER" -> EXTERNAL_ENTITY;
            case "PROCESS", "SERVICE", "APPLICATION" -> PROCESS;
            case "DATA_STORE", "DATASTORE", "STORE", "DATABASE" -> DATA_STORE;
            case "DATA_FLOW", "DATAFLOW", "FLOW" -> DATA_FLOW;
            default -> null;
        };
    }
}
