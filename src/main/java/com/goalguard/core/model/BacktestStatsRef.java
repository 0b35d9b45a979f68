package com.goalguard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reference to the statistics produced by one backtest run.
 * <p>
 * The {@code digest} is a content hash over the engine's raw output; two runs with
 * identical inputs must produce the same digest and the same metric values.
 */
public record BacktestStatsRef(
    String id,
    String digest,
    Map<String, Double> metrics
) implements Serializable {

    public static final String SHARPE_RATIO = "sharpe_ratio";
    public static final String MAX_DRAWDOWN = "max_drawdown";
    public static final String WIN_RATE = "win_rate";
    public static final String TOTAL_RETURN = "total_return";

    public BacktestStatsRef {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    public double metric(String name, double fallback) {
        Double value = metrics.get(name);
        return value != null ? value : fallback;
    }

    public boolean hasMetric(String name) {
        return metrics.containsKey(name);
    }
}
