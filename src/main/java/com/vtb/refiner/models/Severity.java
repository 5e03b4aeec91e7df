package com.vtb.refiner.models;

/**
 * Уровни остаточного риска (полосы шкалы 0-10)
 */
public enum Severity {
    CRITICAL("Critical", 9.0),
    HIGH("High", 7.0),
    MEDIUM("Medium", 4.0),
    LOW("Low", 0.0),
    INFO("Informational", 0.0);

    private final String displayName;
    private final double lowerBound;

    Severity(String displayName, double lowerBound) {
        this.displayName = displayName;
        this.lowerBound = lowerBound;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Полоса для значения риска. Ноль означает INFO, любое положительное значение ниже 4 - LOW.
     */
    public static Severity fromScore(double score) {
        if (score >= CRITICAL.lowerBound) {
            return CRITICAL;
        }
        if (score >= HIGH.lowerBound) {
            return HIGH;
        }
        if (score >= MEDIUM.lowerBound) {
            return MEDIUM;
        }
        return score > 0 ? LOW : INFO;
    }
}
