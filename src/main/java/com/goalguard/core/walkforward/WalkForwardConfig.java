package com.goalguard.core.walkforward;

/**
 * Immutable walk-forward settings, built once at startup and shared by every run.
 *
 * @param trainRatio       fraction of each window span used for training
 * @param testRatio        fraction of each window span used for testing
 * @param numWindows       number of sequential windows to create
 * @param maxDegradation   largest acceptable train-to-test Sharpe degradation
 * @param minTestSharpe    smallest acceptable out-of-sample Sharpe ratio
 * @param minRowsPerWindow minimum dataset rows per window
 * @param gapRows          unused rows between each training and test range
 * @param mode             rolling or anchored training ranges
 */
public record WalkForwardConfig(
    double trainRatio,
    double testRatio,
    int numWindows,
    double maxDegradation,
    double minTestSharpe,
    int minRowsPerWindow,
    int gapRows,
    WindowMode mode
) {

    public static final double DEFAULT_TRAIN_RATIO = 0.7;
    public static final double DEFAULT_TEST_RATIO = 0.3;
    public static final int DEFAULT_NUM_WINDOWS = 3;
    public static final double DEFAULT_MAX_DEGRADATION = 0.3;
    public static final double DEFAULT_MIN_TEST_SHARPE = 0.5;
    public static final int DEFAULT_MIN_ROWS_PER_WINDOW = 10;

    public WalkForwardConfig {
        if (!(trainRatio > 0.0 && trainRatio < 1.0)) {
            throw new IllegalArgumentException("trainRatio must be in (0, 1), got: " + trainRatio);
        }
        if (!(testRatio > 0.0 && testRatio < 1.0)) {
            throw new IllegalArgumentException("testRatio must be in (0, 1), got: " + testRatio);
        }
        if (trainRatio + testRatio > 1.0 + 1e-9) {
            throw new IllegalArgumentException("trainRatio + testRatio must not exceed 1, got: %s + %s"
                    .formatted(trainRatio, testRatio));
        }
        if (numWindows < 1) {
            throw new IllegalArgumentException("numWindows must be >= 1, got: " + numWindows);
        }
        if (maxDegradation < 0.0) {
            throw new IllegalArgumentException("maxDegradation must be >= 0, got: " + maxDegradation);
        }
        if (minRowsPerWindow < 2) {
            throw new IllegalArgumentException("minRowsPerWindow must be >= 2, got: " + minRowsPerWindow);
        }
        if (gapRows < 0) {
            throw new IllegalArgumentException("gapRows must be >= 0, got: " + gapRows);
        }
        if (mode == null) {
            mode = WindowMode.ROLLING;
        }
    }

    public static WalkForwardConfig defaults() {
        return new WalkForwardConfig(
            DEFAULT_TRAIN_RATIO,
            DEFAULT_TEST_RATIO,
            DEFAULT_NUM_WINDOWS,
            DEFAULT_MAX_DEGRADATION,
            DEFAULT_MIN_TEST_SHARPE,
            DEFAULT_MIN_ROWS_PER_WINDOW,
            0,
            WindowMode.ROLLING
        );
    }

    public WalkForwardConfig withNumWindows(int windows) {
        return new WalkForwardConfig(trainRatio, testRatio, windows, maxDegradation, minTestSharpe,
                minRowsPerWindow, gapRows, mode);
    }

    public WalkForwardConfig withGapRows(int gap) {
        return new WalkForwardConfig(trainRatio, testRatio, numWindows, maxDegradation, minTestSharpe,
                minRowsPerWindow, gap, mode);
    }

    public WalkForwardConfig withMode(WindowMode windowMode) {
        return new WalkForwardConfig(trainRatio, testRatio, numWindows, maxDegradation, minTestSharpe,
                minRowsPerWindow, gapRows, windowMode);
    }
}
