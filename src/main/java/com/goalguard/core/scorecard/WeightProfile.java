package com.goalguard.core.scorecard;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Versioned component weights. Weights cover every component and sum to 1.
 */
public record WeightProfile(String version, Map<ScoreComponent, Double> weights) implements Serializable {

    public static final WeightProfile DROPS_V1 = new WeightProfile("drops-v1", Map.of(
            ScoreComponent.D, 0.25,
            ScoreComponent.R, 0.25,
            ScoreComponent.O, 0.15,
            ScoreComponent.P, 0.20,
            ScoreComponent.U, 0.15));

    public WeightProfile {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("weight profile version must not be blank");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights must not be null");
        }
        EnumMap<ScoreComponent, Double> copy = new EnumMap<>(ScoreComponent.class);
        double sum = 0.0;
        for (ScoreComponent component : ScoreComponent.values()) {
            Double weight = weights.get(component);
            if (weight == null || weight < 0.0) {
                throw new IllegalArgumentException("weight for %s must be present and non-negative, got: %s"
                        .formatted(component, weight));
            }
            copy.put(component, weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > 1e-6) {
            throw new IllegalArgumentException("weights of profile %s must sum to 1, got: %s".formatted(version, sum));
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public double weight(ScoreComponent component) {
        return weights.get(component);
    }
}
