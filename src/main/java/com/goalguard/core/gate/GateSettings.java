package com.goalguard.core.gate;

/**
 * Immutable gate thresholds and switches.
 *
 * @param maxDrawdownLimit  largest acceptable backtest max drawdown (fraction)
 * @param enableWalkForward whether the product gate runs walk-forward validation
 * @param enableStressTest  whether the product gate runs the stress suite
 * @param determinismRuns   how many reruns the determinism check compares against the baseline
 */
public record GateSettings(
    double maxDrawdownLimit,
    boolean enableWalkForward,
    boolean enableStressTest,
    int determinismRuns
) {

    public GateSettings {
        if (maxDrawdownLimit <= 0.0) {
            throw new IllegalArgumentException("maxDrawdownLimit must be positive, got: " + maxDrawdownLimit);
        }
        if (determinismRuns < 1) {
            throw new IllegalArgumentException("determinismRuns must be >= 1, got: " + determinismRuns);
        }
    }

    public static GateSettings defaults() {
        return new GateSettings(0.25, false, true, 3);
    }
}
