package com.vtb.refiner.models;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Статистика прогона уточнения угроз
 */
@Data
@Builder
public class RefinementStatistics {
    private int originalCount;
    private int rejectedCount;
    private int unmatchedComponents;
    private int suppressedByControl;
    private int suppressedStaleCve;
    private int mergedCount;
    private int clusterCount;
    private int finalActiveCount;
    private int unknownCves;
    private long durationMs;

    @Builder.Default
    private Map<Severity, Integer> riskDistribution = new LinkedHashMap<>();

    public int getSuppressedCount() {
        return suppressedByControl + suppressedStaleCve;
    }
}
