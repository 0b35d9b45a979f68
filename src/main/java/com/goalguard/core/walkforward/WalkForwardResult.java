package com.goalguard.core.walkforward;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Train-versus-test comparison for a single window.
 */
public record WalkForwardResult(
    int windowId,
    Map<String, Double> trainStats,
    Map<String, Double> testStats,
    double degradation,
    boolean overfitting
) implements Serializable {

    public WalkForwardResult {
        trainStats = trainStats == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(trainStats));
        testStats = testStats == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(testStats));
    }

    public double trainSharpe() {
        return WalkForwardValidator.sharpeOf(trainStats);
    }

    public double testSharpe() {
        return WalkForwardValidator.sharpeOf(testStats);
    }
}
