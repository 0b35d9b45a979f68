package com.goalguard.core.tools;

import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.CommittedId;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.LintReport;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.StressReport;
import com.goalguard.core.model.TestReport;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.model.ToolOutcome;
import com.goalguard.core.model.VerificationReport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool access bound to one run; every call is recorded on that run.
 */
public class RunTools {

    private final GoalRun run;
    private final ToolInvoker invoker;
    private final ToolCallRecorder recorder;

    public RunTools(GoalRun run, ToolInvoker invoker, ToolCallRecorder recorder) {
        this.run = run;
        this.invoker = invoker;
        this.recorder = recorder;
    }

    public GoalRun run() {
        return run;
    }

    public StrategyArtifactRef generateStrategy(Map<String, Double> parameters) throws ToolInvocationException {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("goal", run.goal());
        inputs.put("riskPreference", run.riskPreference().name());
        inputs.put("parameters", parameters);
        return recorder.invoke(run, ToolKind.GENERATE_STRATEGY, inputs,
                () -> invoker.generateStrategy(run.goal(), run.riskPreference(), parameters));
    }

    public BacktestStatsRef backtest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException {
        return recorder.invoke(run, ToolKind.BACKTEST, inputs(strategy, dataRef),
                () -> invoker.backtest(strategy, dataRef));
    }

    public ToolOutcome<TestReport> runTests(StrategyArtifactRef strategy) {
        return recorder.capture(run, ToolKind.RUN_TESTS, inputs(strategy, null),
                () -> invoker.runTests(strategy));
    }

    public ToolOutcome<VerificationReport> crvVerify(BacktestStatsRef stats, double maxDrawdownLimit) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("backtestId", stats.id());
        inputs.put("maxDrawdownLimit", maxDrawdownLimit);
        return recorder.capture(run, ToolKind.CRV_VERIFY, inputs,
                () -> invoker.crvVerify(stats, maxDrawdownLimit));
    }

    public CommittedId commit(StrategyArtifactRef strategy) throws ToolInvocationException {
        return recorder.invoke(run, ToolKind.COMMIT, inputs(strategy, null), () -> invoker.commit(strategy));
    }

    public LintReport lint(StrategyArtifactRef strategy) throws ToolInvocationException {
        return recorder.invoke(run, ToolKind.LINT, inputs(strategy, null), () -> invoker.lint(strategy));
    }

    public StressReport stressTest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException {
        return recorder.invoke(run, ToolKind.STRESS_TEST, inputs(strategy, dataRef),
                () -> invoker.stressTest(strategy, dataRef));
    }

    private static Map<String, Object> inputs(StrategyArtifactRef strategy, DataRef dataRef) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("strategyId", strategy != null ? strategy.id() : null);
        if (dataRef != null) {
            inputs.put("dataRef", dataRef);
        }
        return inputs;
    }
}
