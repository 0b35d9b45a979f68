package com.goalguard.core.scorecard;

import com.goalguard.core.GoalGuardFixture;
import com.goalguard.core.gate.CheckOutcome;
import com.goalguard.core.gate.DevGate;
import com.goalguard.core.gate.GateResult;
import com.goalguard.core.gate.ProductGate;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.TestReport;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.model.ToolOutcome;
import com.goalguard.core.model.VerificationReport;
import com.goalguard.core.model.Violation;
import com.goalguard.core.model.ViolationSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromotionScorecardTest {

    private final PromotionScorecard scorecard = new PromotionScorecard(ScorecardSettings.defaults());

    @Test
    @DisplayName("healthy evidence scores 100 and recommends promotion")
    void healthy() {
        ReadinessScorecard card = scorecard.score("GGRD-SC-0001", ReadinessSignals.healthy().build());

        assertEquals(100.0, card.score());
        assertEquals(DecisionBand.GREEN, card.decision());
        assertTrue(card.blockers().isEmpty());
        assertEquals(1, card.nextActions().size());
        assertEquals("promotion", card.nextActions().get(0).subject());
        assertEquals("drops-v1", card.profileVersion());
    }

    @Nested
    @DisplayName("non-compensatory blockers")
    class Blockers {

        @Test
        @DisplayName("a lone blocker overrides a green score")
        void lineageIncomplete() {
            ReadinessScorecard card = scorecard.score("GGRD-SC-0002",
                    ReadinessSignals.healthy().lineageComplete(false).build());

            assertEquals(70.0, card.component(ScoreComponent.P));
            assertEquals(94.0, card.score(), 1e-9);
            assertEquals(DecisionBand.GREEN, card.scoreBand());
            assertEquals(DecisionBand.BLOCKED, card.decision());
            assertTrue(card.blocked());
            assertEquals(List.of(PromotionScorecard.LINEAGE_INCOMPLETE), card.blockers());
            assertEquals(PromotionScorecard.LINEAGE_INCOMPLETE, card.nextActions().get(0).subject());
            assertTrue(card.recommendation().startsWith("Promotion blocked by lineage_incomplete"));
        }

        @Test
        @DisplayName("every blocker type is detected in a fixed order")
        void allBlockers() {
            ReadinessSignals signals = ReadinessSignals.healthy()
                    .runIdentityPresent(false)
                    .parityPassed(false)
                    .policyBlockReasons(List.of("crv:lookahead"))
                    .lineageComplete(false)
                    .startupStatus(StartupStatus.UNAVAILABLE)
                    .contractMismatch(true)
                    .build();

            assertEquals(List.of("missing_run_identity", "parity_check_failed", "policy_block_reasons",
                    "lineage_incomplete", "startup_unavailable", "contract_mismatch"),
                    PromotionScorecard.blockers(signals));
        }

        @Test
        @DisplayName("an unchecked parity is penalised but not a blocker")
        void parityUnchecked() {
            ReadinessScorecard card = scorecard.score("GGRD-SC-0003",
                    ReadinessSignals.healthy().parityChecked(false).parityPassed(false).build());

            assertEquals(50.0, card.component(ScoreComponent.D));
            assertTrue(card.blockers().isEmpty());
            assertEquals(87.5, card.score(), 1e-9);
            assertEquals(DecisionBand.GREEN, card.decision());
        }
    }

    @Nested
    @DisplayName("components and bands")
    class Components {

        @Test
        @DisplayName("components are clamped to [0, 100]")
        void clamped() {
            ReadinessScorecard card = scorecard.score("GGRD-SC-0004", ReadinessSignals.healthy()
                    .riskMetricsComplete(false).crvAvailable(false).validationPassed(false)
                    .policyBlockReasons(List.of("a", "b", "c"))
                    .build());

            assertEquals(0.0, card.component(ScoreComponent.R));
            assertEquals(0.0, card.component(ScoreComponent.P));
        }

        @Test
        @DisplayName("band thresholds are inclusive at 85 and 70")
        void bands() {
            assertEquals(DecisionBand.GREEN, scorecard.band(85.0));
            assertEquals(DecisionBand.AMBER, scorecard.band(84.99));
            assertEquals(DecisionBand.AMBER, scorecard.band(70.0));
            assertEquals(DecisionBand.RED, scorecard.band(69.99));
            assertEquals(DecisionBand.RED, scorecard.band(60.0));
        }

        @Test
        @DisplayName("ops penalises degraded startup, stale evidence and caveats")
        void ops() {
            ReadinessScorecard card = scorecard.score("GGRD-SC-0005", ReadinessSignals.healthy()
                    .startupStatus(StartupStatus.DEGRADED)
                    .startupReasons(List.of("1 tool call(s) timed out"))
                    .evidenceStale(true)
                    .environmentCaveat("disabled checks: walk_forward")
                    .build());

            assertEquals(20.0, card.component(ScoreComponent.O));
        }

        @Test
        @DisplayName("next actions list blockers, then weakest components")
        void actionOrder() {
            ReadinessScorecard card = scorecard.score("GGRD-SC-0006", ReadinessSignals.healthy()
                    .parityPassed(false)
                    .evidenceStale(true)
                    .build());

            List<String> subjects = card.nextActions().stream().map(NextAction::subject).toList();
            assertEquals(List.of("parity_check_failed", "D", "O"), subjects);
            assertEquals(List.of(1, 2, 3), card.nextActions().stream().map(NextAction::rank).toList());
            assertTrue(card.nextActions().get(1).action().endsWith("(Determinism at 50)"));
        }
    }

    @Nested
    @DisplayName("weight profiles")
    class Profiles {

        @Test
        @DisplayName("a tenant profile changes S and the recorded version")
        void tenantProfile() {
            Map<ScoreComponent, Double> weights = new LinkedHashMap<>();
            weights.put(ScoreComponent.D, 0.0);
            weights.put(ScoreComponent.R, 0.0);
            weights.put(ScoreComponent.O, 0.0);
            weights.put(ScoreComponent.P, 1.0);
            weights.put(ScoreComponent.U, 0.0);
            PromotionScorecard policyOnly = scorecard.withProfile(new WeightProfile("policy-only", weights));

            ReadinessScorecard card = policyOnly.score("GGRD-SC-0007",
                    ReadinessSignals.healthy().lineageComplete(false).build());

            assertEquals(70.0, card.score(), 1e-9);
            assertEquals(DecisionBand.AMBER, card.scoreBand());
            assertEquals("policy-only", card.profileVersion());
        }

        @Test
        @DisplayName("profiles must cover every component and sum to 1")
        void validation() {
            assertThrows(IllegalArgumentException.class,
                    () -> new WeightProfile("short", Map.of(ScoreComponent.D, 1.0)));
            assertThrows(IllegalArgumentException.class, () -> new WeightProfile("heavy", Map.of(
                    ScoreComponent.D, 0.5, ScoreComponent.R, 0.5, ScoreComponent.O, 0.5,
                    ScoreComponent.P, 0.0, ScoreComponent.U, 0.0)));
        }
    }

    @Nested
    @DisplayName("signals from a run")
    class FromRun {

        @Test
        @DisplayName("a fresh run has no identity and incomplete lineage")
        void freshRun() {
            ReadinessSignals signals = ReadinessSignals.fromRun(GoalGuardFixture.newRun("GGRD-SC-0008"));

            assertFalse(signals.runIdentityPresent());
            assertFalse(signals.lineageComplete());
            assertEquals(EvidenceClassification.RED, signals.evidenceClassification());
        }

        @Test
        @DisplayName("a fully evidenced run derives caveats, policy reasons and mismatches")
        void evidencedRun() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-SC-0009");
            run.setStrategy(new StrategyArtifactRef("strat-1", "a", Map.of("lookback", 50.0, "position_size", 1.0)));
            run.setBacktestStats(new BacktestStatsRef("bt-1", "b",
                    Map.of(BacktestStatsRef.SHARPE_RATIO, 1.4, BacktestStatsRef.MAX_DRAWDOWN, -0.1)));
            run.setTestOutcome(ToolOutcome.success(ToolKind.RUN_TESTS, new TestReport(5, 0, "ok")));
            run.setVerificationOutcome(ToolOutcome.success(ToolKind.CRV_VERIFY, new VerificationReport(false,
                    List.of(new Violation("leverage", ViolationSeverity.CRITICAL, "over limit")))));
            run.recordGateResult(new GateResult(DevGate.NAME,
                    Map.of(DevGate.UNIT_TESTS, true, DevGate.DETERMINISM, true, DevGate.LINT, true),
                    Map.of(), List.of(), true));
            Map<String, Boolean> productChecks = new LinkedHashMap<>();
            productChecks.put(ProductGate.CRV, true);
            productChecks.put(ProductGate.WALK_FORWARD, true);
            productChecks.put(ProductGate.STRESS_TEST, true);
            run.recordGateResult(new GateResult(ProductGate.NAME, productChecks,
                    Map.of(ProductGate.WALK_FORWARD, CheckOutcome.DISABLED), List.of(), true));

            ReadinessSignals signals = ReadinessSignals.fromRun(run);

            assertTrue(signals.parityChecked());
            assertTrue(signals.parityPassed());
            assertTrue(signals.lineageComplete());
            assertEquals(List.of("crv:leverage"), signals.policyBlockReasons());
            assertEquals("disabled checks: walk_forward", signals.environmentCaveat());
            assertEquals(EvidenceClassification.AMBER, signals.evidenceClassification());
            assertTrue(signals.contractMismatch());
        }
    }
}
