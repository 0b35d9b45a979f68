package com.goalguard.core.gate;

import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.LintReport;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.TestReport;
import com.goalguard.core.model.ToolOutcome;
import com.goalguard.core.tools.ToolInvocationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Development gate: unit tests, determinism and lint, in that order.
 */
public class DevGate extends AbstractGate {

    public static final String NAME = "dev_gate";
    public static final String UNIT_TESTS = "unit_tests";
    public static final String DETERMINISM = "determinism";
    public static final String LINT = "lint";

    private final GateSettings settings;

    public DevGate(GateSettings settings) {
        super(NAME);
        this.settings = settings;
        addCheck(UNIT_TESTS, (artifact, context) -> checkUnitTests(artifact));
        addCheck(DETERMINISM, this::checkDeterminism);
        addCheck(LINT, this::checkLint);
    }

    private CheckOutcome checkUnitTests(GateArtifact artifact) throws GateCheckException {
        ToolOutcome<TestReport> outcome = artifact.testOutcome();
        if (outcome == null) {
            throw new GateCheckException("no test report available");
        }
        if (!outcome.succeeded()) {
            String prefix = outcome.timedOut() ? "run_tests timed out: " : "run_tests failed: ";
            throw new GateCheckException(prefix + outcome.error());
        }
        TestReport report = outcome.value();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("totalTests", report.totalTests());
        detail.put("failedTests", report.failedTests());
        if (!report.passed()) {
            throw new GateCheckException("%d of %d tests failed".formatted(report.failedTests(), report.totalTests()),
                    detail);
        }
        return CheckOutcome.pass(detail);
    }

    /**
     * Re-runs the backtest and requires every rerun to reproduce the baseline digest and
     * metrics bit for bit.
     */
    private CheckOutcome checkDeterminism(GateArtifact artifact, GateContext context)
            throws GateCheckException, ToolInvocationException {
        StrategyArtifactRef strategy = requireStrategy(artifact);
        BacktestStatsRef baseline = requireBacktest(artifact);

        for (int run = 1; run <= settings.determinismRuns(); run++) {
            BacktestStatsRef rerun = context.tools().backtest(strategy, context.dataRef());
            String divergence = divergence(baseline, rerun);
            if (divergence != null) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("rerun", run);
                detail.put("baselineDigest", baseline.digest());
                detail.put("rerunDigest", rerun.digest());
                throw new GateCheckException("rerun %d diverged from baseline: %s".formatted(run, divergence), detail);
            }
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("runs", settings.determinismRuns());
        detail.put("digest", baseline.digest());
        return CheckOutcome.pass(detail);
    }

    static String divergence(BacktestStatsRef baseline, BacktestStatsRef rerun) {
        if (!Objects.equals(baseline.digest(), rerun.digest())) {
            return "digest %s != %s".formatted(baseline.digest(), rerun.digest());
        }
        if (!baseline.metrics().keySet().equals(rerun.metrics().keySet())) {
            return "metric keys %s != %s".formatted(baseline.metrics().keySet(), rerun.metrics().keySet());
        }
        for (Map.Entry<String, Double> entry : baseline.metrics().entrySet()) {
            Double other = rerun.metrics().get(entry.getKey());
            if (!sameBits(entry.getValue(), other)) {
                return "metric %s %s != %s".formatted(entry.getKey(), entry.getValue(), other);
            }
        }
        return null;
    }

    private static boolean sameBits(Double a, Double b) {
        if (a == null || b == null) {
            return a == b;
        }
        return Double.doubleToRawLongBits(a) == Double.doubleToRawLongBits(b);
    }

    private CheckOutcome checkLint(GateArtifact artifact, GateContext context)
            throws GateCheckException, ToolInvocationException {
        StrategyArtifactRef strategy = requireStrategy(artifact);
        LintReport report = context.tools().lint(strategy);
        if (!report.passed()) {
            throw new GateCheckException("%d lint issue(s): %s".formatted(report.issues().size(),
                    String.join("; ", report.issues())), report);
        }
        return CheckOutcome.pass(report);
    }
}
