package com.vtb.refiner.models;

/**
 * Состояние угрозы в конвейере. SUPPRESSED и MERGED терминальны.
 */
public enum ThreatStatus {
    ACTIVE,
    SUPPRESSED,
    MERGED
}
