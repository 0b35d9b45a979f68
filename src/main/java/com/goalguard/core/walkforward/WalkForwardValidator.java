package com.goalguard.core.walkforward;

import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.TimeSeriesDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Walk-forward validation used to detect overfitting.
 * <p>
 * The dataset's rows are split into {@code numWindows} sequential spans of equal size. Within
 * each span the first {@code trainRatio} share is training data, followed by {@code gapRows}
 * unused rows and then the {@code testRatio} share as held-out test data:
 * <pre>
 * ┌────────────┬──────┬────────────┬──────┬────────────┬──────┐
 * │  Train 0   │Test 0│  Train 1   │Test 1│  Train 2   │Test 2│
 * └────────────┴──────┴────────────┴──────┴────────────┴──────┘
 * </pre>
 * Every method is a pure function of its arguments and the immutable config; identical
 * inputs always produce identical output.
 */
public class WalkForwardValidator {

    private static final Logger log = LoggerFactory.getLogger(WalkForwardValidator.class);

    /** Absorbs binary rounding of ratio products such as {@code 10 * 0.7}. */
    private static final double FLOOR_EPSILON = 1e-9;

    private static final int MAX_SEARCH_SPAN = 1_000_000;

    private final WalkForwardConfig config;

    public WalkForwardValidator(WalkForwardConfig config) {
        this.config = config != null ? config : WalkForwardConfig.defaults();
    }

    public WalkForwardConfig config() {
        return config;
    }

    public List<WalkForwardWindow> createWindows(TimeSeriesDataset dataset) {
        return createWindows(dataset, config);
    }

    /**
     * Splits the dataset into exactly {@code config.numWindows()} windows.
     *
     * @throws InsufficientDataException if the rows cannot support that many non-degenerate windows
     */
    public List<WalkForwardWindow> createWindows(TimeSeriesDataset dataset, WalkForwardConfig config) {
        int available = dataset.rowCount();
        int minimum = config.numWindows() * config.minRowsPerWindow();
        if (available < minimum) {
            throw new InsufficientDataException(minimum, available,
                    "%d windows x %d rows per window".formatted(config.numWindows(), config.minRowsPerWindow()));
        }

        int span = available / config.numWindows();
        if (!spanSupportsWindow(span, config)) {
            int requiredSpan = smallestValidSpan(span, config);
            throw new InsufficientDataException(requiredSpan * config.numWindows(), available,
                    "span of %d rows leaves an empty train or test range with gap %d"
                            .formatted(span, config.gapRows()));
        }

        int trainRows = trainRows(span, config);
        int testRows = testRows(span, config);
        List<WalkForwardWindow> windows = new ArrayList<>(config.numWindows());
        for (int i = 0; i < config.numWindows(); i++) {
            int spanStart = i * span;
            int trainStart = config.mode() == WindowMode.ANCHORED ? 0 : spanStart;
            int trainEnd = spanStart + trainRows;
            int testStart = trainEnd + config.gapRows();
            int testEnd = testStart + testRows;
            windows.add(new WalkForwardWindow(i, trainStart, trainEnd, testStart, testEnd));
        }

        log.debug("Created {} {} windows over {} rows (span {}, train {}, gap {}, test {})",
                windows.size(), config.mode(), available, span, trainRows, config.gapRows(), testRows);
        return List.copyOf(windows);
    }

    /**
     * Compares training and test statistics for one window.
     * Degradation is {@code (train - test) / train} on the Sharpe ratio, or 1.0 when the
     * training Sharpe is not positive.
     */
    public WalkForwardResult analyzeWindowResults(WalkForwardWindow window,
                                                  Map<String, Double> trainStats,
                                                  Map<String, Double> testStats) {
        double trainSharpe = sharpeOf(trainStats);
        double testSharpe = sharpeOf(testStats);

        double degradation = trainSharpe > 0.0
                ? (trainSharpe - testSharpe) / trainSharpe
                : 1.0;
        boolean overfitting = testSharpe < config.minTestSharpe() || degradation > config.maxDegradation();

        return new WalkForwardResult(window.windowId(), trainStats, testStats, degradation, overfitting);
    }

    /**
     * Aggregates per-window results into a single pass/fail analysis.
     */
    public WalkForwardAnalysis validate(List<WalkForwardWindow> windows, List<WalkForwardResult> results) {
        List<String> reasons = new ArrayList<>();
        if (results == null || results.isEmpty()) {
            reasons.add("no window results to validate");
            return new WalkForwardAnalysis(List.of(), 0.0, 0.0, 1.0, 0.0, false, reasons);
        }
        if (windows != null && windows.size() != results.size()) {
            reasons.add("expected %d window results, got %d".formatted(windows.size(), results.size()));
        }

        double sumTrain = 0.0;
        double sumTest = 0.0;
        double sumDegradation = 0.0;
        for (WalkForwardResult result : results) {
            sumTrain += result.trainSharpe();
            sumTest += result.testSharpe();
            sumDegradation += result.degradation();
            if (result.overfitting()) {
                reasons.add(describeOverfitting(result));
            }
        }

        int n = results.size();
        double avgTrain = sumTrain / n;
        double avgTest = sumTest / n;
        double avgDegradation = sumDegradation / n;
        double stability = Math.max(0.0, Math.min(1.0, 1.0 - avgDegradation));

        if (avgTest < config.minTestSharpe()) {
            reasons.add(String.format(Locale.ROOT, "average test sharpe %.4f below minimum %.4f",
                    avgTest, config.minTestSharpe()));
        }
        if (avgDegradation > config.maxDegradation()) {
            reasons.add(String.format(Locale.ROOT, "average degradation %.4f above maximum %.4f",
                    avgDegradation, config.maxDegradation()));
        }

        boolean passed = reasons.isEmpty();
        return new WalkForwardAnalysis(results, avgTrain, avgTest, avgDegradation, stability, passed, reasons);
    }

    static double sharpeOf(Map<String, Double> stats) {
        if (stats == null) {
            return 0.0;
        }
        Double value = stats.get(BacktestStatsRef.SHARPE_RATIO);
        return value == null || value.isNaN() ? 0.0 : value;
    }

    private String describeOverfitting(WalkForwardResult result) {
        List<String> causes = new ArrayList<>(2);
        if (result.testSharpe() < config.minTestSharpe()) {
            causes.add(String.format(Locale.ROOT, "test sharpe %.4f below minimum %.4f",
                    result.testSharpe(), config.minTestSharpe()));
        }
        if (result.degradation() > config.maxDegradation()) {
            causes.add(String.format(Locale.ROOT, "degradation %.4f above maximum %.4f",
                    result.degradation(), config.maxDegradation()));
        }
        return "window %d overfitting: %s".formatted(result.windowId(), String.join("; ", causes));
    }

    private static int trainRows(int span, WalkForwardConfig config) {
        return (int) Math.floor(span * config.trainRatio() + FLOOR_EPSILON);
    }

    private static int testRows(int span, WalkForwardConfig config) {
        return (int) Math.floor(span * config.testRatio() + FLOOR_EPSILON);
    }

    private static boolean spanSupportsWindow(int span, WalkForwardConfig config) {
        int train = trainRows(span, config);
        int test = testRows(span, config);
        return train >= 1 && test >= 1 && train + config.gapRows() + test <= span;
    }

    /** Smallest span at or above {@code from} that fits a window, capped at {@link #MAX_SEARCH_SPAN}. */
    private static int smallestValidSpan(int from, WalkForwardConfig config) {
        for (int span = Math.max(from, 1); span < MAX_SEARCH_SPAN; span++) {
            if (spanSupportsWindow(span, config)) {
                return span;
            }
        }
        return MAX_SEARCH_SPAN;
    }
}
