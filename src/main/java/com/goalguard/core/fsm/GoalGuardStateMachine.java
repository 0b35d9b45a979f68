package com.goalguard.core.fsm;

import com.goalguard.core.audit.AuditSink;
import com.goalguard.core.events.EventBus;
import com.goalguard.core.events.GoalGuardEvent;
import com.goalguard.core.gate.DevGate;
import com.goalguard.core.gate.Gate;
import com.goalguard.core.gate.GateArtifact;
import com.goalguard.core.gate.GateContext;
import com.goalguard.core.gate.GateResult;
import com.goalguard.core.gate.GateSettings;
import com.goalguard.core.gate.ProductGate;
import com.goalguard.core.logging.MdcContext;
import com.goalguard.core.metrics.GoalGuardMetrics;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.CommittedId;
import com.goalguard.core.model.GoalEvent;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.TransitionRecord;
import com.goalguard.core.reflexion.FailureChecks;
import com.goalguard.core.reflexion.ReflexionEngine;
import com.goalguard.core.reflexion.ReflexionRecord;
import com.goalguard.core.reflexion.RetryBudgetExhaustedException;
import com.goalguard.core.scorecard.PromotionScorecard;
import com.goalguard.core.scorecard.ReadinessScorecard;
import com.goalguard.core.scorecard.ReadinessSignals;
import com.goalguard.core.tools.RunTools;
import com.goalguard.core.tools.ToolCallRecorder;
import com.goalguard.core.tools.ToolInvocationException;
import com.goalguard.core.tools.ToolInvoker;
import com.goalguard.core.walkforward.WalkForwardAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives a {@link GoalRun} through the goal-guard lifecycle.
 * <pre>
 * INIT → STRATEGY_DESIGN → BACKTEST_COMPLETE → DEV_GATE → DEV_GATE_PASSED
 *      → PRODUCT_GATE → PRODUCT_GATE_PASSED → COMMITTED
 *                 any failure → REFLEXION → retry | ERROR
 * </pre>
 * Every operation takes the run explicitly and holds its monitor for its whole duration, so
 * a run advances strictly sequentially while independent runs proceed in parallel. An
 * operation whose event has no edge from the current state throws
 * {@link InvalidSequenceException} before any tool call or history entry is made.
 * <p>
 * Cancellation requested while an operation is in flight is applied once that operation's
 * transition has been recorded; a request pending before an operation starts cancels the run
 * instead of running it.
 */
public class GoalGuardStateMachine {

    private static final Logger log = LoggerFactory.getLogger(GoalGuardStateMachine.class);

    private final TransitionTable table;
    private final ToolInvoker toolInvoker;
    private final ToolCallRecorder recorder;
    private final DevGate devGate;
    private final ProductGate productGate;
    private final ReflexionEngine reflexionEngine;
    private final PromotionScorecard scorecard;
    private final GateSettings gateSettings;
    private final AuditSink auditSink;
    private final EventBus eventBus;
    private final GoalGuardMetrics metrics;

    public GoalGuardStateMachine(TransitionTable table,
                                 ToolInvoker toolInvoker,
                                 ToolCallRecorder recorder,
                                 DevGate devGate,
                                 ProductGate productGate,
                                 ReflexionEngine reflexionEngine,
                                 PromotionScorecard scorecard,
                                 GateSettings gateSettings,
                                 AuditSink auditSink,
                                 EventBus eventBus,
                                 GoalGuardMetrics metrics) {
        this.table = table;
        this.toolInvoker = toolInvoker;
        this.recorder = recorder;
        this.devGate = devGate;
        this.productGate = productGate;
        this.reflexionEngine = reflexionEngine;
        this.scorecard = scorecard;
        this.gateSettings = gateSettings;
        this.auditSink = auditSink;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public TransitionTable table() {
        return table;
    }

    // ── Operations ───────────────────────────────────────────────────

    public GoalState generateStrategy(GoalRun run) {
        return operate(run, () -> {
            require(run, GoalEvent.GENERATE_STRATEGY);
            try {
                StrategyArtifactRef strategy = tools(run).generateStrategy(run.strategyParameters());
                run.setStrategy(strategy);
                apply(run, GoalEvent.GENERATE_STRATEGY, "strategy " + strategy.id());
            } catch (ToolInvocationException e) {
                toolFailure(run, FailureChecks.GENERATE_STRATEGY_INVOCATION, e);
            }
        });
    }

    public GoalState backtest(GoalRun run) {
        return operate(run, () -> {
            require(run, GoalEvent.BACKTEST);
            StrategyArtifactRef strategy = run.strategy()
                    .orElseThrow(() -> new InvalidSequenceException(run.state(), GoalEvent.BACKTEST, "no strategy"));
            try {
                BacktestStatsRef stats = tools(run).backtest(strategy, run.dataRef());
                run.setBacktestStats(stats);
                apply(run, GoalEvent.BACKTEST, "backtest " + stats.id());
            } catch (ToolInvocationException e) {
                toolFailure(run, FailureChecks.BACKTEST_INVOCATION, e);
            }
        });
    }

    /**
     * Runs the strategy's tests and enters DEV_GATE. A failing or timed-out test tool does not
     * stop the transition; the dev gate records it as a failed check.
     */
    public GoalState runTests(GoalRun run) {
        return operate(run, () -> {
            require(run, GoalEvent.RUN_TESTS);
            StrategyArtifactRef strategy = run.strategy()
                    .orElseThrow(() -> new InvalidSequenceException(run.state(), GoalEvent.RUN_TESTS, "no strategy"));
            run.setTestOutcome(tools(run).runTests(strategy));
            apply(run, GoalEvent.RUN_TESTS, "tests " + (run.testOutcome().get().succeeded() ? "ran" : "tool failed"));
        });
    }

    public GoalState evaluateDevGate(GoalRun run) {
        return operate(run, () -> {
            requireState(run, GoalState.DEV_GATE, GoalEvent.PASS);
            evaluateGate(run, devGate);
        });
    }

    /**
     * Runs cross-run verification and enters PRODUCT_GATE. Only reachable from
     * DEV_GATE_PASSED, so verification never runs against an artifact that failed the dev gate.
     */
    public GoalState crvVerify(GoalRun run) {
        return operate(run, () -> {
            require(run, GoalEvent.CRV_VERIFY);
            BacktestStatsRef stats = run.backtestStats()
                    .orElseThrow(() -> new InvalidSequenceException(run.state(), GoalEvent.CRV_VERIFY, "no backtest"));
            run.setVerificationOutcome(tools(run).crvVerify(stats, gateSettings.maxDrawdownLimit()));
            apply(run, GoalEvent.CRV_VERIFY,
                    "verification " + (run.verificationOutcome().get().succeeded() ? "ran" : "tool failed"));
        });
    }

    public GoalState evaluateProductGate(GoalRun run) {
        return operate(run, () -> {
            requireState(run, GoalState.PRODUCT_GATE, GoalEvent.PASS);
            GateResult result = evaluateGate(run, productGate);
            result.detail(ProductGate.WALK_FORWARD, WalkForwardAnalysis.class).ifPresent(analysis -> {
                run.setWalkForwardAnalysis(analysis);
                metrics.recordWalkForwardStability(analysis.stabilityScore());
                auditSink.record(run.runId(), AuditSink.WALK_FORWARD_ANALYSIS, analysis);
            });
        });
    }

    /**
     * Scores promotion readiness and commits the strategy. A blocked scorecard refuses the
     * commit and sends the run to reflexion without calling the commit tool.
     */
    public GoalState commit(GoalRun run) {
        return operate(run, () -> {
            require(run, GoalEvent.COMMIT);
            ReadinessScorecard card = scorecard.score(run.runId(), ReadinessSignals.fromRun(run));
            run.setScorecard(card);
            metrics.recordScorecard(card.decision().name(), card.score());
            auditSink.record(run.runId(), AuditSink.READINESS_SCORECARD, card);

            if (card.blocked()) {
                recordGate(run, GateResult.synthetic(FailureChecks.PROMOTION_GATE, FailureChecks.PROMOTION_BLOCKERS,
                        card.recommendation(), card));
                apply(run, GoalEvent.FAIL, card.recommendation());
                return;
            }
            StrategyArtifactRef strategy = run.strategy()
                    .orElseThrow(() -> new InvalidSequenceException(run.state(), GoalEvent.COMMIT, "no strategy"));
            try {
                CommittedId committed = tools(run).commit(strategy);
                run.setCommittedId(committed);
                run.setTerminalReason("committed as " + committed.value());
                apply(run, GoalEvent.COMMIT, "committed " + committed.value());
            } catch (ToolInvocationException e) {
                toolFailure(run, FailureChecks.COMMIT_INVOCATION, e);
            }
        });
    }

    /**
     * Diagnoses the last failure and either re-enters the pipeline or ends the run.
     * A design-locus retry regenerates the strategy with the repaired parameters; a
     * verification-locus retry re-uses the existing artifacts from BACKTEST_COMPLETE.
     *
     * @throws RetryBudgetExhaustedException after moving the run to ERROR when no retries remain
     */
    public GoalState reflect(GoalRun run) {
        return operate(run, () -> {
            requireState(run, GoalState.REFLEXION, GoalEvent.RETRY_AVAILABLE);
            GateResult failure = run.lastGateResult().orElse(null);
            ReflexionRecord record = reflexionEngine.reflect(run, failure);
            run.setLastReflexion(record);
            metrics.recordReflexion(record.failureType().key(), record.iteration());
            eventBus.publish(GoalGuardEvent.of(GoalGuardEvent.REFLEXION_PLANNED, run.runId(),
                    record.failureType().key(), reflexionPayload(record)));

            if (record.exhausted()) {
                String reason = "retry budget of %d exhausted; last failure %s"
                        .formatted(reflexionEngine.settings().maxRetries(), record.failureType().key());
                run.setTerminalReason(reason);
                apply(run, GoalEvent.RETRIES_EXHAUSTED, reason);
                throw new RetryBudgetExhaustedException(run.runId(), run.reflexionCount(),
                        failure != null ? String.join("; ", failure.errors()) : record.failureType().key());
            }

            run.incrementReflexionCount();
            run.setStrategyParameters(record.repairPlan().adjustedParameters());
            apply(run, GoalEvent.RETRY_AVAILABLE,
                    "retry %d: %s".formatted(run.reflexionCount(), record.repairPlan().description()));

            if (run.state() == GoalState.STRATEGY_DESIGN) {
                try {
                    run.setStrategy(tools(run).generateStrategy(run.strategyParameters()));
                } catch (ToolInvocationException e) {
                    toolFailure(run, FailureChecks.GENERATE_STRATEGY_INVOCATION, e);
                }
            }
        });
    }

    /**
     * Requests cancellation. Applied immediately when no operation is in flight, otherwise as
     * soon as the in-flight operation has recorded its transition.
     *
     * @throws InvalidSequenceException if the run already ended in COMMITTED or ERROR
     */
    public GoalState cancel(GoalRun run) {
        run.requestCancellation();
        synchronized (run) {
            if (run.state() == GoalState.CANCELLED) {
                return run.state();
            }
            if (run.isTerminal()) {
                throw new InvalidSequenceException(run.state(), GoalEvent.CANCEL, "run already terminal");
            }
            cancelIfRequested(run);
            return run.state();
        }
    }

    /** Replays the run's history and returns the state it reproduces. */
    public GoalState replay(GoalRun run) {
        return table.replay(run.transitions());
    }

    // ── Internals ────────────────────────────────────────────────────

    private GoalState operate(GoalRun run, Runnable body) {
        synchronized (run) {
            String previousRunId = MDC.get(MdcContext.RUN_ID);
            MdcContext.setRun(run.runId());
            try {
                if (cancelIfRequested(run)) {
                    return run.state();
                }
                try {
                    body.run();
                } finally {
                    cancelIfRequested(run);
                }
                return run.state();
            } finally {
                MdcContext.restoreRun(previousRunId);
            }
        }
    }

    private boolean cancelIfRequested(GoalRun run) {
        if (!run.isCancellationRequested() || run.isTerminal()) {
            return false;
        }
        run.setTerminalReason("cancelled in " + run.state());
        apply(run, GoalEvent.CANCEL, "cancellation requested");
        return true;
    }

    private void require(GoalRun run, GoalEvent event) {
        if (table.resolve(run, event).isEmpty()) {
            throw new InvalidSequenceException(run.state(), event);
        }
    }

    private void requireState(GoalRun run, GoalState expected, GoalEvent event) {
        if (run.state() != expected) {
            throw new InvalidSequenceException(run.state(), event, "operation requires " + expected);
        }
    }

    private GateResult evaluateGate(GoalRun run, Gate gate) {
        GateContext context = new GateContext(run.runId(), tools(run), run.dataRef(), run.dataset().orElse(null));
        GateResult result = gate.evaluate(GateArtifact.of(run), context);
        metrics.recordGateEvaluation(gate.name(), result.passed());
        recordGate(run, result);
        apply(run, result.passed() ? GoalEvent.PASS : GoalEvent.FAIL,
                gate.name() + (result.passed() ? " passed" : " failed: " + String.join("; ", result.failedChecks())));
        return result;
    }

    private void recordGate(GoalRun run, GateResult result) {
        run.recordGateResult(result);
        auditSink.record(run.runId(), AuditSink.GATE_RESULT, result);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("passed", result.passed());
        payload.put("checks", result.checks());
        payload.put("errors", result.errors());
        eventBus.publish(GoalGuardEvent.of(GoalGuardEvent.GATE_EVALUATED, run.runId(), result.gateName(), payload));
    }

    private void toolFailure(GoalRun run, String checkName, ToolInvocationException e) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("tool", e.getKind().key());
        detail.put("timedOut", e.isTimedOut());
        recordGate(run, GateResult.synthetic(FailureChecks.TOOL_FAILURE_GATE, checkName, e.getMessage(), detail));
        apply(run, GoalEvent.TOOL_FAILURE, e.getMessage());
    }

    private void apply(GoalRun run, GoalEvent event, String note) {
        Transition transition = table.resolve(run, event)
                .orElseThrow(() -> new InvalidSequenceException(run.state(), event));
        TransitionRecord record = new TransitionRecord(run.nextTransitionSequence(), run.state(), event,
                transition.to(), Instant.now(), note);
        run.recordTransition(record);
        log.info("Run {}: {} --{}--> {} ({})", run.runId(), record.from(), event, record.to(), note);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequence", record.sequence());
        payload.put("from", record.from().name());
        payload.put("event", event.name());
        payload.put("to", record.to().name());
        payload.put("note", note);
        eventBus.publish(GoalGuardEvent.of(GoalGuardEvent.RUN_TRANSITION, run.runId(), event.name(), payload));

        if (record.to().isTerminal()) {
            metrics.recordRunResult(record.to().name().toLowerCase());
            eventBus.publish(GoalGuardEvent.of(GoalGuardEvent.RUN_TERMINAL, run.runId(), record.to().name(),
                    Map.of("reason", run.terminalReason().orElse(note))));
        }
    }

    private RunTools tools(GoalRun run) {
        return new RunTools(run, toolInvoker, recorder);
    }

    private static Map<String, Object> reflexionPayload(ReflexionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("iteration", record.iteration());
        payload.put("decision", record.decision().name());
        payload.put("locus", record.repairPlan().locus().name());
        payload.put("improvementScore", record.improvementScore());
        payload.put("summary", record.summary());
        return payload;
    }
}
