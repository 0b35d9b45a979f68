package com.goalguard.core.gate;

import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.StressReport;
import com.goalguard.core.model.ToolOutcome;
import com.goalguard.core.model.VerificationReport;
import com.goalguard.core.model.Violation;
import com.goalguard.core.tools.ToolInvocationException;
import com.goalguard.core.walkforward.InsufficientDataException;
import com.goalguard.core.walkforward.WalkForwardAnalysis;
import com.goalguard.core.walkforward.WalkForwardResult;
import com.goalguard.core.walkforward.WalkForwardValidator;
import com.goalguard.core.walkforward.WalkForwardWindow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Production gate: cross-run verification, walk-forward validation and the stress suite.
 * A disabled check passes with a {@code "disabled"} detail so it is never silently omitted.
 */
public class ProductGate extends AbstractGate {

    public static final String NAME = "product_gate";
    public static final String CRV = "crv";
    public static final String WALK_FORWARD = "walk_forward";
    public static final String STRESS_TEST = "stress_test";

    private final GateSettings settings;
    private final WalkForwardValidator validator;

    public ProductGate(GateSettings settings, WalkForwardValidator validator) {
        super(NAME);
        this.settings = settings;
        this.validator = validator;
        addCheck(CRV, (artifact, context) -> checkCrv(artifact));
        addCheck(WALK_FORWARD, this::checkWalkForward);
        addCheck(STRESS_TEST, this::checkStress);
    }

    private CheckOutcome checkCrv(GateArtifact artifact) throws GateCheckException {
        ToolOutcome<VerificationReport> outcome = artifact.verificationOutcome();
        if (outcome == null) {
            throw new GateCheckException("no verification report available");
        }
        if (!outcome.succeeded()) {
            String prefix = outcome.timedOut() ? "crv_verify timed out: " : "crv_verify failed: ";
            throw new GateCheckException(prefix + outcome.error());
        }
        VerificationReport report = outcome.value();
        BacktestStatsRef stats = requireBacktest(artifact);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("violations", report.violations());
        detail.put("maxDrawdownLimit", settings.maxDrawdownLimit());

        if (!report.passed() || !report.violations().isEmpty()) {
            String listed = report.violations().stream()
                    .map(ProductGate::describe)
                    .collect(Collectors.joining("; "));
            throw new GateCheckException("verification failed with %d violation(s)%s"
                    .formatted(report.violations().size(), listed.isEmpty() ? "" : ": " + listed), detail);
        }
        if (!stats.hasMetric(BacktestStatsRef.MAX_DRAWDOWN)) {
            throw new GateCheckException("backtest reported no " + BacktestStatsRef.MAX_DRAWDOWN, detail);
        }
        double drawdown = Math.abs(stats.metric(BacktestStatsRef.MAX_DRAWDOWN, 0.0));
        detail.put("maxDrawdown", drawdown);
        if (drawdown > settings.maxDrawdownLimit()) {
            throw new GateCheckException(String.format(Locale.ROOT, "max drawdown %.4f exceeds limit %.4f",
                    drawdown, settings.maxDrawdownLimit()), detail);
        }
        return CheckOutcome.pass(detail);
    }

    private static String describe(Violation violation) {
        return "%s[%s]: %s".formatted(violation.ruleId(), violation.severity(), violation.message());
    }

    /**
     * Backtests every window's train and test slice through the tool boundary and validates
     * the combined results.
     */
    private CheckOutcome checkWalkForward(GateArtifact artifact, GateContext context)
            throws GateCheckException, ToolInvocationException {
        if (!settings.enableWalkForward()) {
            return CheckOutcome.disabled();
        }
        StrategyArtifactRef strategy = requireStrategy(artifact);
        if (context.dataset() == null) {
            throw new GateCheckException("no time-series dataset available for walk-forward windows");
        }

        List<WalkForwardWindow> windows;
        try {
            windows = validator.createWindows(context.dataset());
        } catch (InsufficientDataException e) {
            throw new GateCheckException(e.getMessage());
        }

        DataRef dataRef = context.dataRef();
        List<WalkForwardResult> results = new ArrayList<>(windows.size());
        for (WalkForwardWindow window : windows) {
            BacktestStatsRef train = context.tools().backtest(strategy, dataRef.slice(window.trainStart(), window.trainEnd()));
            BacktestStatsRef test = context.tools().backtest(strategy, dataRef.slice(window.testStart(), window.testEnd()));
            results.add(validator.analyzeWindowResults(window, train.metrics(), test.metrics()));
        }

        WalkForwardAnalysis analysis = validator.validate(windows, results);
        if (!analysis.passed()) {
            throw new GateCheckException(String.join("; ", analysis.failureReasons()), analysis);
        }
        return CheckOutcome.pass(analysis);
    }

    private CheckOutcome checkStress(GateArtifact artifact, GateContext context)
            throws GateCheckException, ToolInvocationException {
        if (!settings.enableStressTest()) {
            return CheckOutcome.disabled();
        }
        StrategyArtifactRef strategy = requireStrategy(artifact);
        StressReport report = context.tools().stressTest(strategy, context.dataRef());
        if (!report.passed()) {
            throw new GateCheckException("stress scenarios failed: " + String.join(", ", report.failedScenarios()),
                    report);
        }
        return CheckOutcome.pass(report);
    }
}
