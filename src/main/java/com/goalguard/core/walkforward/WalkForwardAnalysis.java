package com.goalguard.core.walkforward;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregated outcome of one walk-forward validation. Immutable.
 *
 * @param results        per-window results in window order
 * @param avgTrainSharpe arithmetic mean of training Sharpe ratios
 * @param avgTestSharpe  arithmetic mean of test Sharpe ratios
 * @param avgDegradation arithmetic mean of window degradations
 * @param stabilityScore {@code 1 - avgDegradation} clamped to [0, 1]
 * @param passed         whether every pass criterion held
 * @param failureReasons one entry per violated criterion, naming offending windows
 */
public record WalkForwardAnalysis(
    List<WalkForwardResult> results,
    double avgTrainSharpe,
    double avgTestSharpe,
    double avgDegradation,
    double stabilityScore,
    boolean passed,
    List<String> failureReasons
) implements Serializable {

    public WalkForwardAnalysis {
        results = results == null ? List.of() : List.copyOf(results);
        failureReasons = failureReasons == null ? List.of() : List.copyOf(failureReasons);
    }

    public int overfittingWindows() {
        return (int) results.stream().filter(WalkForwardResult::overfitting).count();
    }
}
