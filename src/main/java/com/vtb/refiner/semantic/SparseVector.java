package com.vtb.refiner.semantic;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Разреженный вектор признак -> вес, нормированный по L2
 */
public final class SparseVector {

    private final Map<String, Double> weights;

    private SparseVector(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    /**
     * Создать вектор с L2-нормировкой. Пустой вход даёт нулевой вектор.
     */
    public static SparseVector normalized(Map<String, Double> raw) {
        double norm = 0.0;
        for (double value : raw.values()) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        Map<String, Double> result = new TreeMap<>();
        if (norm > 0) {
            for (Map.Entry<String, Double> entry : raw.entrySet()) {
                result.put(entry.getKey(), entry.getValue() / norm);
            }
        }
        return new SparseVector(result);
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public boolean isZero() {
        return weights.isEmpty();
    }

    /**
     * Косинусное сходство; у нормированных векторов это скалярное произведение
     */
    public double cosine(SparseVector other) {
        if (isZero() || other.isZero()) {
            return 0.0;
        }
        Map<String, Double> smaller = weights.size() <= other.weights.size() ? weights : other.weights;
        Map<String, Double> larger = smaller == weights ? other.weights : weights;
        double dot = 0.0;
        for (Map.Entry<String, Double> entry : smaller.entrySet()) {
            Double value = larger.get(entry.getKey());
            if (value != null) {
                dot += entry.getValue() * value;
            }
        }
        return Math.max(0.0, Math.min(1.0, dot));
    }
}
