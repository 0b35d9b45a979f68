package com.goalguard.core.model;

import com.goalguard.core.gate.GateResult;
import com.goalguard.core.reflexion.ReflexionRecord;
import com.goalguard.core.scorecard.ReadinessScorecard;
import com.goalguard.core.walkforward.WalkForwardAnalysis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-goal mutable run state.
 * <p>
 * A run is created in {@link GoalState#INIT} when a goal is submitted and is mutated only by
 * the state machine, which holds the run's monitor for the duration of every operation.
 * Each run owns its own history, tool calls and retry counter; nothing here is shared
 * between runs.
 */
public class GoalRun {

    private final String runId;
    private final String goal;
    private final RiskPreference riskPreference;
    private final DataRef dataRef;
    private final TimeSeriesDataset dataset;
    private final Instant createdAt;

    private volatile GoalState state = GoalState.INIT;
    private final List<TransitionRecord> transitions = new ArrayList<>();
    private final List<ToolCallRecord> toolCalls = new ArrayList<>();
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    private int reflexionCount;
    private Map<String, Double> strategyParameters;
    private String feedback;

    private StrategyArtifactRef strategy;
    private BacktestStatsRef backtestStats;
    private ToolOutcome<TestReport> testOutcome;
    private ToolOutcome<VerificationReport> verificationOutcome;
    private CommittedId committedId;

    private GateResult lastGateResult;
    private final Map<String, GateResult> gateResults = new LinkedHashMap<>();
    private ReflexionRecord lastReflexion;
    private WalkForwardAnalysis walkForwardAnalysis;
    private ReadinessScorecard scorecard;
    private String terminalReason;

    public GoalRun(String runId, String goal, RiskPreference riskPreference, DataRef dataRef,
                   TimeSeriesDataset dataset, Map<String, Double> initialParameters, Instant createdAt) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal must not be blank");
        }
        this.runId = runId;
        this.goal = goal;
        this.riskPreference = riskPreference != null ? riskPreference : RiskPreference.MODERATE;
        this.dataRef = dataRef;
        this.dataset = dataset;
        this.createdAt = createdAt;
        this.strategyParameters = copyParameters(initialParameters);
    }

    // ── Identity ─────────────────────────────────────────────────────

    public String runId() { return runId; }
    public String goal() { return goal; }
    public RiskPreference riskPreference() { return riskPreference; }
    public DataRef dataRef() { return dataRef; }
    public Optional<TimeSeriesDataset> dataset() { return Optional.ofNullable(dataset); }
    public Instant createdAt() { return createdAt; }

    // ── State and history ────────────────────────────────────────────

    public GoalState state() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized List<TransitionRecord> transitions() {
        return List.copyOf(transitions);
    }

    public synchronized void recordTransition(TransitionRecord record) {
        if (record.from() != state) {
            throw new IllegalStateException("Transition " + record + " does not start from current state " + state);
        }
        transitions.add(record);
        state = record.to();
    }

    public synchronized int nextTransitionSequence() {
        return transitions.size() + 1;
    }

    public synchronized List<ToolCallRecord> toolCalls() {
        return List.copyOf(toolCalls);
    }

    public synchronized void appendToolCall(ToolCallRecord record) {
        toolCalls.add(record);
    }

    public synchronized int nextToolCallSequence() {
        return toolCalls.size() + 1;
    }

    /** Returns how many calls of the given kind this run has issued. */
    public synchronized long toolCallCount(ToolKind kind) {
        return toolCalls.stream().filter(c -> c.kind() == kind).count();
    }

    // ── Cancellation ─────────────────────────────────────────────────

    public void requestCancellation() {
        cancellationRequested.set(true);
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    // ── Reflexion ────────────────────────────────────────────────────

    public int reflexionCount() { return reflexionCount; }

    public void incrementReflexionCount() {
        reflexionCount++;
    }

    public Map<String, Double> strategyParameters() {
        return Collections.unmodifiableMap(strategyParameters);
    }

    public void setStrategyParameters(Map<String, Double> parameters) {
        this.strategyParameters = copyParameters(parameters);
    }

    public Optional<String> feedback() { return Optional.ofNullable(feedback); }
    public void setFeedback(String feedback) { this.feedback = feedback; }

    public Optional<ReflexionRecord> lastReflexion() { return Optional.ofNullable(lastReflexion); }
    public void setLastReflexion(ReflexionRecord lastReflexion) { this.lastReflexion = lastReflexion; }

    // ── Artifacts ────────────────────────────────────────────────────

    public Optional<StrategyArtifactRef> strategy() { return Optional.ofNullable(strategy); }
    public Optional<BacktestStatsRef> backtestStats() { return Optional.ofNullable(backtestStats); }
    public Optional<ToolOutcome<TestReport>> testOutcome() { return Optional.ofNullable(testOutcome); }
    public Optional<ToolOutcome<VerificationReport>> verificationOutcome() { return Optional.ofNullable(verificationOutcome); }
    public Optional<CommittedId> committedId() { return Optional.ofNullable(committedId); }

    /** Installs a freshly generated strategy and drops every artifact derived from the previous one. */
    public void setStrategy(StrategyArtifactRef strategy) {
        this.strategy = strategy;
        this.backtestStats = null;
        this.testOutcome = null;
        this.verificationOutcome = null;
    }

    public void setBacktestStats(BacktestStatsRef backtestStats) { this.backtestStats = backtestStats; }
    public void setTestOutcome(ToolOutcome<TestReport> testOutcome) { this.testOutcome = testOutcome; }
    public void setVerificationOutcome(ToolOutcome<VerificationReport> verificationOutcome) { this.verificationOutcome = verificationOutcome; }
    public void setCommittedId(CommittedId committedId) { this.committedId = committedId; }

    public Optional<GateResult> lastGateResult() { return Optional.ofNullable(lastGateResult); }

    /** Records a gate (or synthetic) result as the latest one and as the latest for its gate name. */
    public synchronized void recordGateResult(GateResult result) {
        this.lastGateResult = result;
        gateResults.put(result.gateName(), result);
    }

    public synchronized Optional<GateResult> gateResult(String gateName) {
        return Optional.ofNullable(gateResults.get(gateName));
    }

    public Optional<WalkForwardAnalysis> walkForwardAnalysis() { return Optional.ofNullable(walkForwardAnalysis); }
    public void setWalkForwardAnalysis(WalkForwardAnalysis analysis) { this.walkForwardAnalysis = analysis; }

    public Optional<ReadinessScorecard> scorecard() { return Optional.ofNullable(scorecard); }
    public void setScorecard(ReadinessScorecard scorecard) { this.scorecard = scorecard; }

    public Optional<String> terminalReason() { return Optional.ofNullable(terminalReason); }
    public void setTerminalReason(String terminalReason) { this.terminalReason = terminalReason; }

    @Override
    public String toString() {
        return "GoalRun[" + runId + ", state=" + state + ", reflexions=" + reflexionCount + "]";
    }

    private static Map<String, Double> copyParameters(Map<String, Double> parameters) {
        return parameters == null ? new TreeMap<>() : new TreeMap<>(parameters);
    }
}
