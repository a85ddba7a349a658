package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.SourceId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-source weights summing to 1.0. Sources absent from a computation are dropped and the
 * remaining weights renormalized, so the achievable range stays 0–100.
 */
public final class WeightTable {

    private static final double TOLERANCE = 1e-6;

    private final Map<SourceId, Double> weights;

    public WeightTable(Map<SourceId, Double> weights) {
        if (weights == null || weights.isEmpty()) throw new IllegalArgumentException("weights are required");
        double sum = 0;
        for (Map.Entry<SourceId, Double> e : weights.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Weight for " + e.getKey() + " must be >= 0");
            }
            sum += e.getValue();
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0 but sum to " + sum);
        }
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    public static WeightTable defaults() {
        Map<SourceId, Double> w = new EnumMap<>(SourceId.class);
        w.put(SourceId.DIGITAL_FOOTPRINT, 0.25);
        w.put(SourceId.DEVICE_PROFILE, 0.30);
        w.put(SourceId.LOCATION, 0.20);
        w.put(SourceId.UTILITY, 0.25);
        return new WeightTable(w);
    }

    public double weightOf(SourceId id) {
        return weights.getOrDefault(id, 0.0);
    }

    /** Weighted mean over the present components, rounded half-up and clamped to [0,100]. */
    public int combine(Map<SourceId, Integer> componentScores) {
        double weighted = 0;
        double used = 0;
        for (Map.Entry<SourceId, Integer> e : componentScores.entrySet()) {
            double w = weightOf(e.getKey());
            weighted += w * e.getValue();
            used += w;
        }
        if (used <= 0) throw new IllegalArgumentException("No weighted component present");
        return RiskBand.clamp((int) Math.round(weighted / used));
    }
}
