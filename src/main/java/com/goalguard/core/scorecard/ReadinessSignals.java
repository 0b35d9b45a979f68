package com.goalguard.core.scorecard;

import com.goalguard.core.gate.CheckOutcome;
import com.goalguard.core.gate.DevGate;
import com.goalguard.core.gate.GateResult;
import com.goalguard.core.gate.ProductGate;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.ToolCallStatus;
import com.goalguard.core.model.ToolOutcome;
import com.goalguard.core.model.VerificationReport;
import com.goalguard.core.model.ViolationSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw evidence the promotion scorecard is computed from.
 */
public record ReadinessSignals(
    boolean runIdentityPresent,
    boolean parityChecked,
    boolean parityPassed,
    boolean validationPassed,
    boolean crvAvailable,
    boolean riskMetricsComplete,
    List<String> policyBlockReasons,
    boolean lineageComplete,
    StartupStatus startupStatus,
    List<String> startupReasons,
    boolean evidenceStale,
    String environmentCaveat,
    EvidenceClassification evidenceClassification,
    boolean contractMismatch,
    boolean maturityLabelVisible
) {

    public ReadinessSignals {
        policyBlockReasons = policyBlockReasons == null ? List.of() : List.copyOf(policyBlockReasons);
        startupReasons = startupReasons == null ? List.of() : List.copyOf(startupReasons);
        startupStatus = startupStatus == null ? StartupStatus.HEALTHY : startupStatus;
        evidenceClassification = evidenceClassification == null ? EvidenceClassification.GREEN : evidenceClassification;
    }

    /** All-healthy signals; the starting point for tests and overrides. */
    public static Builder healthy() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .runIdentityPresent(runIdentityPresent)
                .parityChecked(parityChecked)
                .parityPassed(parityPassed)
                .validationPassed(validationPassed)
                .crvAvailable(crvAvailable)
                .riskMetricsComplete(riskMetricsComplete)
                .policyBlockReasons(policyBlockReasons)
                .lineageComplete(lineageComplete)
                .startupStatus(startupStatus)
                .startupReasons(startupReasons)
                .evidenceStale(evidenceStale)
                .environmentCaveat(environmentCaveat)
                .evidenceClassification(evidenceClassification)
                .contractMismatch(contractMismatch)
                .maturityLabelVisible(maturityLabelVisible);
    }

    /**
     * Derives signals from the evidence a run has accumulated in its current cycle.
     */
    public static ReadinessSignals fromRun(GoalRun run) {
        Optional<StrategyArtifactRef> strategy = run.strategy();
        Optional<BacktestStatsRef> stats = run.backtestStats();
        Optional<GateResult> devGate = run.gateResult(DevGate.NAME);
        Optional<GateResult> productGate = run.gateResult(ProductGate.NAME);
        Optional<VerificationReport> verification = run.verificationOutcome()
                .filter(ToolOutcome::succeeded)
                .map(ToolOutcome::value);

        boolean parityChecked = devGate.map(r -> r.checks().containsKey(DevGate.DETERMINISM)).orElse(false);
        boolean parityPassed = devGate.map(r -> Boolean.TRUE.equals(r.checks().get(DevGate.DETERMINISM))).orElse(false);

        List<String> policyReasons = verification
                .map(report -> report.violations().stream()
                        .filter(v -> v.severity() == ViolationSeverity.CRITICAL)
                        .map(v -> "crv:" + v.ruleId())
                        .toList())
                .orElse(List.of());

        long timeouts = run.toolCalls().stream().filter(c -> c.status() == ToolCallStatus.TIMED_OUT).count();
        List<String> startupReasons = timeouts == 0
                ? List.of()
                : List.of("%d tool call(s) timed out".formatted(timeouts));

        List<String> disabledChecks = productGate
                .map(r -> r.details().entrySet().stream()
                        .filter(e -> CheckOutcome.DISABLED.equals(e.getValue()))
                        .map(Map.Entry::getKey)
                        .toList())
                .orElse(List.of());
        String caveat = disabledChecks.isEmpty() ? null : "disabled checks: " + String.join(", ", disabledChecks);

        EvidenceClassification classification;
        if (productGate.map(r -> !r.passed()).orElse(true)) {
            classification = EvidenceClassification.RED;
        } else if (!disabledChecks.isEmpty()) {
            classification = EvidenceClassification.AMBER;
        } else {
            classification = EvidenceClassification.GREEN;
        }

        return new ReadinessSignals(
                strategy.isPresent(),
                parityChecked,
                parityPassed,
                productGate.map(GateResult::passed).orElse(false),
                verification.isPresent(),
                stats.map(s -> s.hasMetric(BacktestStatsRef.SHARPE_RATIO) && s.hasMetric(BacktestStatsRef.MAX_DRAWDOWN))
                        .orElse(false),
                policyReasons,
                strategy.isPresent() && stats.isPresent() && run.testOutcome().isPresent()
                        && run.verificationOutcome().isPresent(),
                timeouts == 0 ? StartupStatus.HEALTHY : StartupStatus.DEGRADED,
                startupReasons,
                false,
                caveat,
                classification,
                strategy.map(s -> parametersDiverge(s, run)).orElse(false),
                true);
    }

    /** True when the strategy reports a value for a run parameter that differs from the one requested. */
    private static boolean parametersDiverge(StrategyArtifactRef strategy, GoalRun run) {
        return run.strategyParameters().entrySet().stream()
                .anyMatch(e -> strategy.parameters().containsKey(e.getKey())
                        && !strategy.parameters().get(e.getKey()).equals(e.getValue()));
    }

    public static final class Builder {
        private boolean runIdentityPresent = true;
        private boolean parityChecked = true;
        private boolean parityPassed = true;
        private boolean validationPassed = true;
        private boolean crvAvailable = true;
        private boolean riskMetricsComplete = true;
        private List<String> policyBlockReasons = new ArrayList<>();
        private boolean lineageComplete = true;
        private StartupStatus startupStatus = StartupStatus.HEALTHY;
        private List<String> startupReasons = new ArrayList<>();
        private boolean evidenceStale;
        private String environmentCaveat;
        private EvidenceClassification evidenceClassification = EvidenceClassification.GREEN;
        private boolean contractMismatch;
        private boolean maturityLabelVisible = true;

        private Builder() {}

        public Builder runIdentityPresent(boolean value) { this.runIdentityPresent = value; return this; }
        public Builder parityChecked(boolean value) { this.parityChecked = value; return this; }
        public Builder parityPassed(boolean value) { this.parityPassed = value; return this; }
        public Builder validationPassed(boolean value) { this.validationPassed = value; return this; }
        public Builder crvAvailable(boolean value) { this.crvAvailable = value; return this; }
        public Builder riskMetricsComplete(boolean value) { this.riskMetricsComplete = value; return this; }
        public Builder policyBlockReasons(List<String> value) { this.policyBlockReasons = new ArrayList<>(value); return this; }
        public Builder lineageComplete(boolean value) { this.lineageComplete = value; return this; }
        public Builder startupStatus(StartupStatus value) { this.startupStatus = value; return this; }
        public Builder startupReasons(List<String> value) { this.startupReasons = new ArrayList<>(value); return this; }
        public Builder evidenceStale(boolean value) { this.evidenceStale = value; return this; }
        public Builder environmentCaveat(String value) { this.environmentCaveat = value; return this; }
        public Builder evidenceClassification(EvidenceClassification value) { this.evidenceClassification = value; return this; }
        public Builder contractMismatch(boolean value) { this.contractMismatch = value; return this; }
        public Builder maturityLabelVisible(boolean value) { this.maturityLabelVisible = value; return this; }

        public ReadinessSignals build() {
            return new ReadinessSignals(runIdentityPresent, parityChecked, parityPassed, validationPassed,
                    crvAvailable, riskMetricsComplete, policyBlockReasons, lineageComplete, startupStatus,
                    startupReasons, evidenceStale, environmentCaveat, evidenceClassification, contractMismatch,
                    maturityLabelVisible);
        }
    }
}
