package com.keystone.core.gate;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.model.GateVerdict;

import java.util.EnumMap;
import java.util.Map;

/**
 * Weighted quality rubric producing a 0-10 score and a verdict.
 *
 * @param weights       weight per criterion; normalized by their sum
 * @param passThreshold scores at or above this pass
 * @param warnThreshold scores at or above this (and below the pass threshold) pass with warnings
 */
public record QualityRubric(Map<Criterion, Double> weights, double passThreshold, double warnThreshold) {

    public QualityRubric {
        var copy = new EnumMap<Criterion, Double>(Criterion.class);
        for (Criterion c : Criterion.values()) {
            copy.put(c, weights != null && weights.containsKey(c) ? weights.get(c) : c.defaultWeight());
        }
        weights = copy;
        if (warnThreshold > passThreshold) {
            throw new IllegalArgumentException("warnThreshold must not exceed passThreshold");
        }
    }

    public static QualityRubric standard() {
        return new QualityRubric(Map.of(), 7.0, 4.0);
    }

    public static QualityRubric from(KeystoneProperties.Gate gate) {
        var weights = new EnumMap<Criterion, Double>(Criterion.class);
        for (Criterion c : Criterion.values()) {
            Double configured = gate.getWeights().get(c.key());
            if (configured != null) {
                weights.put(c, configured);
            }
        }
        return new QualityRubric(weights, gate.getPassThreshold(), gate.getWarnThreshold());
    }

    /**
     * Weighted average of the criterion scores (each clamped to [0, 10]); a missing criterion scores 0.
     */
    public double score(Map<Criterion, Double> criterionScores) {
        double total = 0;
        double weightSum = 0;
        for (var entry : weights.entrySet()) {
            double value = criterionScores.getOrDefault(entry.getKey(), 0.0);
            total += clamp(value) * entry.getValue();
            weightSum += entry.getValue();
        }
        if (weightSum <= 0) {
            return 0;
        }
        return Math.round(total / weightSum * 100.0) / 100.0;
    }

    public GateVerdict verdictFor(double score) {
        if (score >= passThreshold) return GateVerdict.PASS;
        if (score >= warnThreshold) return GateVerdict.PASS_WITH_WARNINGS;
        return GateVerdict.FAIL;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(10.0, value));
    }
}
