package com.goalguard.core.tools;

import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.CommittedId;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.LintReport;
import com.goalguard.core.model.RiskPreference;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.StressReport;
import com.goalguard.core.model.TestReport;
import com.goalguard.core.model.VerificationReport;

import java.util.Map;

/**
 * Boundary to the external tools the orchestrator drives. Implementations are blocking;
 * timeouts are applied by {@link TimeBoundToolInvoker}.
 */
public interface ToolInvoker {

    StrategyArtifactRef generateStrategy(String goal, RiskPreference riskPreference,
                                         Map<String, Double> parameters) throws ToolInvocationException;

    BacktestStatsRef backtest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException;

    TestReport runTests(StrategyArtifactRef strategy) throws ToolInvocationException;

    VerificationReport crvVerify(BacktestStatsRef backtestStats, double maxDrawdownLimit) throws ToolInvocationException;

    CommittedId commit(StrategyArtifactRef strategy) throws ToolInvocationException;

    LintReport lint(StrategyArtifactRef strategy) throws ToolInvocationException;

    StressReport stressTest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException;
}
