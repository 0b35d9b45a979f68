package com.goalguard.core.fsm;

import com.goalguard.core.GoalGuardFixture;
import com.goalguard.core.audit.AuditSink;
import com.goalguard.core.events.GoalGuardEvent;
import com.goalguard.core.gate.DevGate;
import com.goalguard.core.gate.GateSettings;
import com.goalguard.core.logging.MdcContext;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.GoalEvent;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.ToolCallRecord;
import com.goalguard.core.model.ToolCallStatus;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.model.TransitionRecord;
import com.goalguard.core.model.Violation;
import com.goalguard.core.model.ViolationSeverity;
import com.goalguard.core.reflexion.FailureType;
import com.goalguard.core.reflexion.ReflexionSettings;
import com.goalguard.core.reflexion.RetryBudgetExhaustedException;
import com.goalguard.core.scorecard.DecisionBand;
import com.goalguard.core.tools.FakeToolInvoker;
import com.goalguard.core.tools.TimeBoundToolInvoker;
import com.goalguard.core.tools.ToolInvocationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GoalGuardStateMachineTest {

    private GoalGuardFixture fixture;
    private GoalGuardStateMachine fsm;

    @BeforeEach
    void setUp() {
        fixture = new GoalGuardFixture();
        fsm = fixture.stateMachine;
    }

    private void driveToDevGate(GoalRun run) {
        assertEquals(GoalState.STRATEGY_DESIGN, fsm.generateStrategy(run));
        assertEquals(GoalState.BACKTEST_COMPLETE, fsm.backtest(run));
        assertEquals(GoalState.DEV_GATE, fsm.runTests(run));
    }

    private void driveToProductGate(GoalRun run) {
        driveToDevGate(run);
        assertEquals(GoalState.DEV_GATE_PASSED, fsm.evaluateDevGate(run));
        assertEquals(GoalState.PRODUCT_GATE, fsm.crvVerify(run));
    }

    @Nested
    @DisplayName("happy path")
    class HappyPath {

        @Test
        @DisplayName("walks every state in order and commits")
        void commitsAfterBothGates() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0001");

            driveToProductGate(run);
            assertEquals(GoalState.PRODUCT_GATE_PASSED, fsm.evaluateProductGate(run));
            assertEquals(GoalState.COMMITTED, fsm.commit(run));

            List<GoalState> visited = run.transitions().stream().map(TransitionRecord::to).toList();
            assertEquals(List.of(GoalState.STRATEGY_DESIGN, GoalState.BACKTEST_COMPLETE, GoalState.DEV_GATE,
                    GoalState.DEV_GATE_PASSED, GoalState.PRODUCT_GATE, GoalState.PRODUCT_GATE_PASSED,
                    GoalState.COMMITTED), visited);
            assertTrue(run.committedId().isPresent());
            assertTrue(run.isTerminal());
        }

        @Test
        @DisplayName("numbers transitions contiguously and chains from/to")
        void historyIsContiguous() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0002");
            driveToProductGate(run);

            List<TransitionRecord> history = run.transitions();
            assertEquals(GoalState.INIT, history.get(0).from());
            for (int i = 0; i < history.size(); i++) {
                assertEquals(i + 1, history.get(i).sequence());
                if (i > 0) {
                    assertEquals(history.get(i - 1).to(), history.get(i).from());
                }
            }
        }

        @Test
        @DisplayName("reruns the backtest for the determinism check")
        void rerunsBacktest() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0003");
            driveToDevGate(run);
            fsm.evaluateDevGate(run);

            assertEquals(1 + GateSettings.defaults().determinismRuns(), fixture.tools.calls(ToolKind.BACKTEST));
            assertEquals(1, fixture.tools.calls(ToolKind.LINT));
        }

        @Test
        @DisplayName("scores readiness and audits gate results and the scorecard")
        void scoresAndAudits() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0004");
            driveToProductGate(run);
            fsm.evaluateProductGate(run);
            fsm.commit(run);

            var card = run.scorecard().orElseThrow();
            assertNotEquals(DecisionBand.BLOCKED, card.decision());
            assertFalse(card.nextActions().isEmpty());
            assertEquals(List.of(AuditSink.GATE_RESULT, AuditSink.GATE_RESULT, AuditSink.READINESS_SCORECARD),
                    fixture.auditTypes);
            assertEquals(1.0, fixture.counter("goalguard.runs.total", "status", "committed"));
            assertEquals(1, fixture.eventCount(GoalGuardEvent.RUN_TERMINAL));
        }

        @Test
        @DisplayName("replaying the history reproduces the state")
        void replayReproducesState() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0005");
            driveToProductGate(run);
            fsm.evaluateProductGate(run);
            fsm.commit(run);

            assertEquals(GoalState.COMMITTED, fsm.replay(run));
        }
    }

    @Nested
    @DisplayName("sequencing")
    class Sequencing {

        @Test
        @DisplayName("out-of-order operation throws without side effects")
        void outOfOrderHasNoSideEffects() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0010");

            var e = assertThrows(InvalidSequenceException.class, () -> fsm.backtest(run));
            assertEquals(GoalState.INIT, e.getState());
            assertEquals(GoalEvent.BACKTEST, e.getEvent());
            assertEquals(GoalState.INIT, run.state());
            assertTrue(run.transitions().isEmpty());
            assertTrue(run.toolCalls().isEmpty());
            assertEquals(0, fixture.tools.totalCalls());
        }

        @Test
        @DisplayName("commit straight from the dev gate is refused")
        void cannotSkipProductGate() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0011");
            driveToDevGate(run);
            fsm.evaluateDevGate(run);

            assertThrows(InvalidSequenceException.class, () -> fsm.commit(run));
            assertEquals(GoalState.DEV_GATE_PASSED, run.state());
            assertEquals(0, fixture.tools.calls(ToolKind.COMMIT));
        }

        @Test
        @DisplayName("reflect outside REFLEXION is refused")
        void reflectRequiresReflexion() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0012");
            assertThrows(InvalidSequenceException.class, () -> fsm.reflect(run));
        }
    }

    @Nested
    @DisplayName("dev gate failures")
    class DevGateFailures {

        @Test
        @DisplayName("failing tests send the run to reflexion and never reach verification")
        void failingTestsBlockVerification() {
            fixture.tools.failedTests = 2;
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0020");
            driveToDevGate(run);

            assertEquals(GoalState.REFLEXION, fsm.evaluateDevGate(run));
            assertThrows(InvalidSequenceException.class, () -> fsm.crvVerify(run));
            assertEquals(0, fixture.tools.calls(ToolKind.CRV_VERIFY));
            assertTrue(run.toolCalls().stream().noneMatch(c -> c.kind() == ToolKind.CRV_VERIFY));
            assertTrue(run.lastGateResult().orElseThrow().failed(DevGate.UNIT_TESTS));
        }

        @Test
        @DisplayName("non-deterministic backtests fail the determinism check")
        void nonDeterministicBacktestFails() {
            fixture.tools.deterministic = false;
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0021");
            driveToDevGate(run);

            assertEquals(GoalState.REFLEXION, fsm.evaluateDevGate(run));
            var result = run.lastGateResult().orElseThrow();
            assertTrue(result.failed(DevGate.DETERMINISM));
            assertFalse(result.failed(DevGate.UNIT_TESTS));
            assertFalse(result.failed(DevGate.LINT));
        }

        @Test
        @DisplayName("a verification-locus retry resumes from BACKTEST_COMPLETE")
        void verificationRetryKeepsStrategy() {
            fixture.tools.lintPassed = false;
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0022");
            driveToDevGate(run);
            fsm.evaluateDevGate(run);

            fixture.tools.lintPassed = true;
            assertEquals(GoalState.BACKTEST_COMPLETE, fsm.reflect(run));
            assertEquals(1, run.reflexionCount());
            assertEquals(FailureType.LINT_FAILURE, run.lastReflexion().orElseThrow().failureType());
            assertEquals(1, fixture.tools.calls(ToolKind.GENERATE_STRATEGY));

            assertEquals(GoalState.DEV_GATE, fsm.runTests(run));
            assertEquals(GoalState.DEV_GATE_PASSED, fsm.evaluateDevGate(run));
        }

        @Test
        @DisplayName("a failing test with a deep drawdown still commits after its verification retry")
        void verificationRetryWithDeepDrawdownCommits() {
            fixture.tools.metrics.put(BacktestStatsRef.MAX_DRAWDOWN, -0.22);
            fixture.tools.failedTests = 1;
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0023");
            driveToDevGate(run);
            assertEquals(GoalState.REFLEXION, fsm.evaluateDevGate(run));

            fixture.tools.failedTests = 0;
            assertEquals(GoalState.BACKTEST_COMPLETE, fsm.reflect(run));
            assertEquals(run.strategy().orElseThrow().parameters(), run.strategyParameters());

            assertEquals(GoalState.DEV_GATE, fsm.runTests(run));
            assertEquals(GoalState.DEV_GATE_PASSED, fsm.evaluateDevGate(run));
            assertEquals(GoalState.PRODUCT_GATE, fsm.crvVerify(run));
            assertEquals(GoalState.PRODUCT_GATE_PASSED, fsm.evaluateProductGate(run));
            assertEquals(GoalState.COMMITTED, fsm.commit(run));
            assertFalse(run.scorecard().orElseThrow().blockers().contains("contract_mismatch"));
        }
    }

    @Nested
    @DisplayName("retry budget")
    class RetryBudget {

        @Test
        @DisplayName("budget of 3 allows four dev gate evaluations, then ERROR with no further tool calls")
        void exhaustsAfterBudget() {
            fixture.tools.failedTests = 1;
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0030");
            driveToDevGate(run);
            fsm.evaluateDevGate(run);

            for (int retry = 1; retry <= 3; retry++) {
                assertEquals(GoalState.BACKTEST_COMPLETE, fsm.reflect(run));
                assertEquals(retry, run.reflexionCount());
                fsm.runTests(run);
                assertEquals(GoalState.REFLEXION, fsm.evaluateDevGate(run));
            }

            var e = assertThrows(RetryBudgetExhaustedException.class, () -> fsm.reflect(run));
            assertEquals(run.runId(), e.getRunId());
            assertEquals(GoalState.ERROR, run.state());
            assertEquals(3, run.reflexionCount());
            assertEquals(4.0, fixture.counter("goalguard.gate.evaluations", "gate", DevGate.NAME));

            int callsAtError = fixture.tools.totalCalls();
            assertThrows(InvalidSequenceException.class, () -> fsm.runTests(run));
            assertThrows(InvalidSequenceException.class, () -> fsm.generateStrategy(run));
            assertEquals(callsAtError, fixture.tools.totalCalls());
            assertTrue(run.terminalReason().orElseThrow().contains("retry budget of 3 exhausted"));
        }

        @Test
        @DisplayName("budget of zero ends the run at the first failure")
        void zeroBudget() {
            fixture = new GoalGuardFixture(GateSettings.defaults(), new ReflexionSettings(0, 5));
            fsm = fixture.stateMachine;
            fixture.tools.failedTests = 1;
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0031");
            driveToDevGate(run);
            fsm.evaluateDevGate(run);

            assertThrows(RetryBudgetExhaustedException.class, () -> fsm.reflect(run));
            assertEquals(GoalState.ERROR, run.state());
            assertEquals(0, run.reflexionCount());
        }
    }

    @Nested
    @DisplayName("product gate and commit")
    class ProductGateAndCommit {

        @Test
        @DisplayName("CRV violations trigger a design retry that regenerates the strategy")
        void crvFailureRegenerates() {
            fixture.tools.violations = List.of(new Violation("max_leverage", ViolationSeverity.HIGH, "leverage 3x"));
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0040");
            driveToProductGate(run);

            assertEquals(GoalState.REFLEXION, fsm.evaluateProductGate(run));
            assertEquals(GoalState.STRATEGY_DESIGN, fsm.reflect(run));
            assertEquals(FailureType.CRV_FAILURE, run.lastReflexion().orElseThrow().failureType());
            assertEquals(2, fixture.tools.calls(ToolKind.GENERATE_STRATEGY));
            assertEquals(0.8, run.strategyParameters().get("position_size"), 1e-12);
            assertTrue(run.backtestStats().isEmpty());
        }

        @Test
        @DisplayName("blocked scorecard refuses the commit without calling the commit tool")
        void blockedScorecardRefusesCommit() {
            fixture.tools.generatedParameters = Map.of("lookback", 50.0, "position_size", 1.0);
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0041");
            driveToProductGate(run);
            fsm.evaluateProductGate(run);

            assertEquals(GoalState.REFLEXION, fsm.commit(run));
            assertEquals(0, fixture.tools.calls(ToolKind.COMMIT));
            assertEquals(DecisionBand.BLOCKED, run.scorecard().orElseThrow().decision());
            assertEquals(GoalState.BACKTEST_COMPLETE, fsm.reflect(run));
            assertEquals(FailureType.SCORECARD_BLOCKED, run.lastReflexion().orElseThrow().failureType());
        }

        @Test
        @DisplayName("commit tool failure goes to reflexion")
        void commitToolFailure() {
            fixture.tools.failures.put(ToolKind.COMMIT, new ToolInvocationException(ToolKind.COMMIT, "store offline"));
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0042");
            driveToProductGate(run);
            fsm.evaluateProductGate(run);

            assertEquals(GoalState.REFLEXION, fsm.commit(run));
            assertEquals(GoalEvent.TOOL_FAILURE, run.transitions().get(run.transitions().size() - 1).event());
            assertEquals(FailureType.COMMIT_FAILURE, FailureType.classify(run.lastGateResult().orElseThrow()));
        }

        @Test
        @DisplayName("generation failure goes to reflexion from INIT")
        void generationFailure() {
            fixture.tools.failures.put(ToolKind.GENERATE_STRATEGY,
                    new ToolInvocationException(ToolKind.GENERATE_STRATEGY, "model unavailable"));
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0043");

            assertEquals(GoalState.REFLEXION, fsm.generateStrategy(run));
            ToolCallRecord call = run.toolCalls().get(0);
            assertEquals(ToolCallStatus.FAILED, call.status());
            assertTrue(call.error().contains("model unavailable"));
        }
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        @Test
        @DisplayName("a timed-out test run is recorded and flows into reflexion")
        void timeoutFlowsIntoReflexion() throws Exception {
            FakeToolInvoker slow = new FakeToolInvoker();
            slow.delaysMs.put(ToolKind.RUN_TESTS, 2_000L);
            try (TimeBoundToolInvoker invoker = new TimeBoundToolInvoker(slow, Duration.ofMillis(100))) {
                GoalGuardFixture timed = new GoalGuardFixture(GateSettings.defaults(), ReflexionSettings.defaults(), invoker);
                GoalGuardStateMachine machine = timed.stateMachine;
                GoalRun run = GoalGuardFixture.newRun("GGRD-T-0050");

                machine.generateStrategy(run);
                machine.backtest(run);
                assertEquals(GoalState.DEV_GATE, machine.runTests(run));
                assertEquals(GoalState.REFLEXION, machine.evaluateDevGate(run));

                ToolCallRecord testCall = run.toolCalls().stream()
                        .filter(c -> c.kind() == ToolKind.RUN_TESTS)
                        .findFirst().orElseThrow();
                assertEquals(ToolCallStatus.TIMED_OUT, testCall.status());
                assertTrue(run.lastGateResult().orElseThrow().errors().get(0).contains("timed out"));
                assertEquals(GoalState.BACKTEST_COMPLETE, machine.reflect(run));
            }
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("pending cancellation cancels the next operation without a tool call")
        void pendingCancellation() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0060");
            run.requestCancellation();

            assertEquals(GoalState.CANCELLED, fsm.generateStrategy(run));
            assertEquals(0, fixture.tools.totalCalls());
            assertEquals(GoalEvent.CANCEL, run.transitions().get(0).event());
        }

        @Test
        @DisplayName("cancelling an idle run applies immediately and is idempotent")
        void idleCancellation() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0061");
            fsm.generateStrategy(run);

            assertEquals(GoalState.CANCELLED, fsm.cancel(run));
            assertEquals(GoalState.CANCELLED, fsm.cancel(run));
            assertEquals(2, run.transitions().size());
            assertThrows(InvalidSequenceException.class, () -> fsm.backtest(run));
        }

        @Test
        @DisplayName("cancelling a committed run is refused")
        void cannotCancelCommitted() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0062");
            driveToProductGate(run);
            fsm.evaluateProductGate(run);
            fsm.commit(run);

            assertThrows(InvalidSequenceException.class, () -> fsm.cancel(run));
            assertEquals(GoalState.COMMITTED, run.state());
        }

        @Test
        @DisplayName("cancellation during an in-flight operation lands after its transition")
        void inFlightCancellation() throws Exception {
            CountDownLatch backtestStarted = new CountDownLatch(1);
            fixture.tools.delaysMs.put(ToolKind.BACKTEST, 300L);
            fixture.tools.onEnter = kind -> {
                if (kind == ToolKind.BACKTEST) {
                    backtestStarted.countDown();
                }
            };
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0063");
            fsm.generateStrategy(run);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<GoalState> inFlight = executor.submit(() -> fsm.backtest(run));
                assertTrue(backtestStarted.await(5, TimeUnit.SECONDS));

                assertEquals(GoalState.CANCELLED, fsm.cancel(run));
                assertEquals(GoalState.CANCELLED, inFlight.get(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            List<GoalEvent> events = run.transitions().stream().map(TransitionRecord::event).toList();
            assertEquals(List.of(GoalEvent.GENERATE_STRATEGY, GoalEvent.BACKTEST, GoalEvent.CANCEL), events);
        }
    }

    @Nested
    @DisplayName("isolation")
    class Isolation {

        @Test
        @DisplayName("concurrent runs keep separate histories and counters")
        void runsAreIsolated() throws Exception {
            GoalRun first = GoalGuardFixture.newRun("GGRD-T-0070");
            GoalRun second = GoalGuardFixture.newRun("GGRD-T-0071");

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> a = executor.submit(() -> driveToProductGate(first));
                Future<?> b = executor.submit(() -> driveToProductGate(second));
                a.get(10, TimeUnit.SECONDS);
                b.get(10, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            assertEquals(5, first.transitions().size());
            assertEquals(5, second.transitions().size());
            assertTrue(first.toolCalls().stream().allMatch(c -> c.sequence() <= first.toolCalls().size()));
            assertEquals(0, first.reflexionCount());
            assertEquals(0, second.reflexionCount());
        }

        @Test
        @DisplayName("operations leave the caller's MDC run id as they found it")
        void mdcRestored() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-T-0072");

            fsm.generateStrategy(run);
            assertNull(MDC.get(MdcContext.RUN_ID));

            MDC.put(MdcContext.RUN_ID, "GGRD-T-0099");
            try {
                fsm.backtest(run);
                assertEquals("GGRD-T-0099", MDC.get(MdcContext.RUN_ID));
            } finally {
                MDC.clear();
            }
        }
    }
}
