package com.goalguard.core.reflexion;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of what reflexion saw when it diagnosed a failure.
 *
 * @param gateName        gate (or synthetic source) that failed
 * @param failedChecks    names of the failed checks, in evaluation order
 * @param errors          diagnostics from the failing result
 * @param metrics         latest backtest metrics, empty if none
 * @param parameters      strategy parameters in effect
 * @param toolCallCount   tool calls issued by the run so far
 * @param failedToolCalls {@code kind: error} for every failed or timed-out call
 * @param feedback        optional free-text feedback
 */
public record FailureContext(
    String gateName,
    List<String> failedChecks,
    List<String> errors,
    Map<String, Double> metrics,
    Map<String, Double> parameters,
    int toolCallCount,
    List<String> failedToolCalls,
    String feedback
) implements Serializable {

    public FailureContext {
        failedChecks = failedChecks == null ? List.of() : List.copyOf(failedChecks);
        errors = errors == null ? List.of() : List.copyOf(errors);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metrics));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(parameters));
        failedToolCalls = failedToolCalls == null ? List.of() : List.copyOf(failedToolCalls);
    }
}
