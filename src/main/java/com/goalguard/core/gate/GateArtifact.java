package com.goalguard.core.gate;

import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.TestReport;
import com.goalguard.core.model.ToolOutcome;
import com.goalguard.core.model.VerificationReport;

/**
 * The artifacts under evaluation. Tool outcomes may carry failures from the transition that
 * produced them; the gate records those as failed checks.
 */
public record GateArtifact(
    StrategyArtifactRef strategy,
    BacktestStatsRef backtestStats,
    ToolOutcome<TestReport> testOutcome,
    ToolOutcome<VerificationReport> verificationOutcome
) {

    public static GateArtifact of(GoalRun run) {
        return new GateArtifact(
            run.strategy().orElse(null),
            run.backtestStats().orElse(null),
            run.testOutcome().orElse(null),
            run.verificationOutcome().orElse(null)
        );
    }
}
