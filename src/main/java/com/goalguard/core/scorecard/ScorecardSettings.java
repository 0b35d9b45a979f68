package com.goalguard.core.scorecard;

public record ScorecardSettings(double greenThreshold, double amberThreshold) {

    public ScorecardSettings {
        if (amberThreshold < 0 || greenThreshold > 100 || amberThreshold > greenThreshold) {
            throw new IllegalArgumentException("thresholds must satisfy 0 <= amber <= green <= 100, got amber=%s green=%s"
                    .formatted(amberThreshold, greenThreshold));
        }
    }

    public static ScorecardSettings defaults() {
        return new ScorecardSettings(85, 70);
    }
}
