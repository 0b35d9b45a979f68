package com.goalguard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for goal run execution.
 */
@Service
public class GoalGuardMetrics {

    private final MeterRegistry registry;

    public GoalGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordToolCall(String toolKind, String status, long ms) {
        Timer.builder("goalguard.tool.duration")
                .tag("tool", toolKind)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateEvaluation(String gateName, boolean passed) {
        Counter.builder("goalguard.gate.evaluations")
                .tag("gate", gateName)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * Records one reflexion cycle and the retry depth it was planned at.
     *
     * @param failureType classified failure type key
     * @param iteration   1-based reflexion iteration for the run
     */
    public void recordReflexion(String failureType, int iteration) {
        Counter.builder("goalguard.reflexion.total")
                .tag("failure_type", failureType)
                .register(registry)
                .increment();

        DistributionSummary.builder("goalguard.reflexion.depth")
                .register(registry)
                .record(iteration);
    }

    public void recordRunResult(String status) {
        Counter.builder("goalguard.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWalkForwardStability(double stabilityScore) {
        DistributionSummary.builder("goalguard.walkforward.stability")
                .description("Stability score of walk-forward analyses")
                .register(registry)
                .record(stabilityScore);
    }

    public void recordScorecard(String decision, double score) {
        Counter.builder("goalguard.scorecard.decisions")
                .tag("decision", decision)
                .register(registry)
                .increment();

        DistributionSummary.builder("goalguard.scorecard.score")
                .register(registry)
                .record(score);
    }
}
