package com.goalguard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of running a strategy through the external stress suite.
 *
 * @param passed          whether every scenario stayed within limits
 * @param scenarioReturns return per named scenario
 * @param failedScenarios scenarios that breached their limits
 */
public record StressReport(
    boolean passed,
    Map<String, Double> scenarioReturns,
    List<String> failedScenarios
) implements Serializable {

    public StressReport {
        scenarioReturns = scenarioReturns == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(scenarioReturns));
        failedScenarios = failedScenarios == null ? List.of() : List.copyOf(failedScenarios);
    }
}
