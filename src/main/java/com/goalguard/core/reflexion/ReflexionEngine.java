package com.goalguard.core.reflexion;

import com.goalguard.core.gate.GateResult;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.FailureLocus;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.ToolCallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Diagnoses a failed attempt and plans the next one.
 * <p>
 * The engine is a pure function of the run's failure evidence: the improvement score is
 * derived from a SHA-256 hash of the run id and its normalized metrics, and suggestions come
 * from fixed threshold and keyword rules. It never mutates the run; the state machine applies
 * the returned plan.
 */
public class ReflexionEngine {

    private static final Logger log = LoggerFactory.getLogger(ReflexionEngine.class);

    static final double SHARPE_HIGH_THRESHOLD = 0.5;
    static final double SHARPE_MEDIUM_THRESHOLD = 1.0;
    static final double DRAWDOWN_THRESHOLD = 0.20;
    static final double WIN_RATE_THRESHOLD = 0.45;

    static final String LOOKBACK = "lookback";
    static final String POSITION_SIZE = "position_size";
    static final String RISK_PER_TRADE = "risk_per_trade";
    static final String STOP_LOSS = "stop_loss";

    private final ReflexionSettings settings;

    public ReflexionEngine(ReflexionSettings settings) {
        this.settings = settings != null ? settings : ReflexionSettings.defaults();
    }

    public ReflexionSettings settings() {
        return settings;
    }

    public ReflexionRecord reflect(GoalRun run, GateResult failure) {
        FailureType failureType = FailureType.classify(failure);
        Map<String, Double> metrics = run.backtestStats()
                .map(BacktestStatsRef::metrics)
                .orElse(Map.of());
        String feedback = run.feedback().orElse(null);

        FailureContext context = snapshot(run, failure, metrics, feedback);
        double score = improvementScore(run.runId(), metrics);
        List<Suggestion> suggestions = suggest(failureType, metrics, feedback);
        String summary = summarize(score, suggestions);
        RepairPlan plan = plan(failureType, failure, metrics, run.strategyParameters());

        int iteration = run.reflexionCount() + 1;
        ReflexionDecision decision = run.reflexionCount() >= settings.maxRetries()
                ? ReflexionDecision.EXHAUSTED
                : ReflexionDecision.RETRY;

        log.info("Reflexion {} for run {}: {} (locus {}, score {}, decision {})",
                iteration, run.runId(), failureType.key(), plan.locus(), score, decision);
        return new ReflexionRecord(run.runId(), iteration, failureType, context, score,
                suggestions, summary, plan, decision);
    }

    // ── Scoring ──────────────────────────────────────────────────────

    /**
     * Maps {@code sha256(runId | sorted normalized metrics)} onto [-2, 2] in steps of 0.01.
     */
    static double improvementScore(String runId, Map<String, Double> metrics) {
        String normalized = new TreeMap<>(metrics).entrySet().stream()
                .map(e -> e.getKey() + "=" + String.format(Locale.ROOT, "%.6f", e.getValue()))
                .collect(Collectors.joining(","));
        byte[] hash = sha256(runId + "|" + normalized);
        long u32 = ((hash[0] & 0xFFL) << 24) | ((hash[1] & 0xFFL) << 16) | ((hash[2] & 0xFFL) << 8) | (hash[3] & 0xFFL);
        return ((u32 % 401) - 200) / 100.0;
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ── Suggestions ──────────────────────────────────────────────────

    List<Suggestion> suggest(FailureType failureType, Map<String, Double> metrics, String feedback) {
        List<Suggestion> suggestions = new ArrayList<>();
        suggestions.add(forFailure(failureType));

        Double sharpe = metrics.get(BacktestStatsRef.SHARPE_RATIO);
        if (sharpe != null && sharpe < SHARPE_MEDIUM_THRESHOLD) {
            Priority priority = sharpe < SHARPE_HIGH_THRESHOLD ? Priority.HIGH : Priority.MEDIUM;
            suggestions.add(new Suggestion(SuggestionCategory.RISK_MANAGEMENT, priority,
                    "Improve risk-adjusted returns through volatility targeting",
                    String.format(Locale.ROOT, "Sharpe ratio %.2f is below %.2f", sharpe, SHARPE_MEDIUM_THRESHOLD)));
        }
        Double drawdown = metrics.get(BacktestStatsRef.MAX_DRAWDOWN);
        if (drawdown != null && Math.abs(drawdown) > DRAWDOWN_THRESHOLD) {
            suggestions.add(new Suggestion(SuggestionCategory.RISK_MANAGEMENT, Priority.HIGH,
                    "Implement stricter drawdown control",
                    String.format(Locale.ROOT, "Max drawdown %.1f%% exceeds %.0f%%",
                            Math.abs(drawdown) * 100, DRAWDOWN_THRESHOLD * 100)));
        }
        Double winRate = metrics.get(BacktestStatsRef.WIN_RATE);
        if (winRate != null && winRate < WIN_RATE_THRESHOLD) {
            suggestions.add(new Suggestion(SuggestionCategory.LOGIC, Priority.MEDIUM,
                    "Refine entry signal quality to improve win rate",
                    String.format(Locale.ROOT, "Win rate %.1f%% suggests signal quality issues", winRate * 100)));
        }

        if (feedback != null && !feedback.isBlank()) {
            String text = feedback.toLowerCase(Locale.ROOT);
            if (text.contains("volatility") || text.contains("vol")) {
                suggestions.add(new Suggestion(SuggestionCategory.PARAMETER, Priority.HIGH,
                        "Update volatility targeting to reduce regime sensitivity",
                        "Feedback reports volatility-related performance issues"));
            }
            if (text.contains("drawdown") || text.contains("loss")) {
                suggestions.add(new Suggestion(SuggestionCategory.RISK_MANAGEMENT, Priority.HIGH,
                        "Tighten parameter guardrails for drawdown control",
                        "Feedback highlights drawdown concerns"));
            }
            if (text.contains("timing") || text.contains("entry") || text.contains("exit")) {
                suggestions.add(new Suggestion(SuggestionCategory.TIMING, Priority.MEDIUM,
                        "Optimize entry and exit timing with adaptive filters",
                        "Feedback reports timing inefficiencies"));
            }
        }

        suggestions.add(new Suggestion(SuggestionCategory.PARAMETER, Priority.MEDIUM,
                "Revisit lookback period bias",
                "Lookback windows may be fitted to the most recent market regime"));
        suggestions.add(new Suggestion(SuggestionCategory.LOGIC, Priority.LOW,
                "Consider combining multiple signal sources",
                "Diversified signal generation improves robustness"));

        // List.sort is stable, so equal priorities keep rule order
        suggestions.sort(Comparator.comparing(Suggestion::priority));
        return List.copyOf(suggestions.subList(0, Math.min(settings.maxSuggestions(), suggestions.size())));
    }

    private static Suggestion forFailure(FailureType type) {
        return switch (type) {
            case TEST_FAILURE -> new Suggestion(SuggestionCategory.LOGIC, Priority.HIGH,
                    "Fix the failing strategy tests", "Unit tests must pass before any evidence is gathered");
            case DETERMINISM_FAILURE -> new Suggestion(SuggestionCategory.LOGIC, Priority.HIGH,
                    "Remove non-deterministic behaviour from the strategy",
                    "Repeated backtests with identical inputs produced different outputs");
            case LINT_FAILURE -> new Suggestion(SuggestionCategory.LOGIC, Priority.MEDIUM,
                    "Resolve static analysis findings", "Lint issues block the development gate");
            case CRV_FAILURE -> new Suggestion(SuggestionCategory.RISK_MANAGEMENT, Priority.HIGH,
                    "Adjust parameters to satisfy verification constraints", "Cross-run verification reported violations");
            case WALK_FORWARD_FAILURE -> new Suggestion(SuggestionCategory.PARAMETER, Priority.HIGH,
                    "Reduce overfitting by lengthening lookback and simplifying rules",
                    "Out-of-sample performance degraded beyond tolerance");
            case STRESS_FAILURE -> new Suggestion(SuggestionCategory.RISK_MANAGEMENT, Priority.HIGH,
                    "Reduce exposure under stress scenarios", "Stress scenarios breached their limits");
            case GENERATION_FAILURE -> new Suggestion(SuggestionCategory.PARAMETER, Priority.HIGH,
                    "Regenerate the strategy with revised parameters", "Strategy generation failed");
            case BACKTEST_FAILURE -> new Suggestion(SuggestionCategory.LOGIC, Priority.HIGH,
                    "Check the strategy and data reference used for backtesting", "Backtest execution failed");
            case COMMIT_FAILURE -> new Suggestion(SuggestionCategory.LOGIC, Priority.MEDIUM,
                    "Retry the commit after re-verifying the artifact", "The artifact store rejected the commit");
            case SCORECARD_BLOCKED -> new Suggestion(SuggestionCategory.RISK_MANAGEMENT, Priority.HIGH,
                    "Resolve promotion blockers", "The readiness scorecard blocked promotion");
            case UNKNOWN -> new Suggestion(SuggestionCategory.LOGIC, Priority.MEDIUM,
                    "Review error messages and logs", "The failure could not be classified");
        };
    }

    static String summarize(double score, List<Suggestion> suggestions) {
        long high = suggestions.stream().filter(s -> s.priority() == Priority.HIGH).count();
        if (score > 1.0) {
            return String.format(Locale.ROOT, "Strong improvement detected (+%.2f). Continue current approach with %d refinements.",
                    score, suggestions.size());
        } else if (score > 0.5) {
            return String.format(Locale.ROOT, "Moderate improvement (+%.2f). %d high-priority suggestions for further gains.",
                    score, high);
        } else if (score > -0.5) {
            return String.format(Locale.ROOT, "Minimal change (%+.2f). %d suggestions to break through plateau.",
                    score, suggestions.size());
        } else if (score > -1.0) {
            return String.format(Locale.ROOT, "Slight degradation (%.2f). %d high-priority fixes recommended.",
                    score, high);
        }
        return String.format(Locale.ROOT, "Significant degradation (%.2f). Urgent attention to %d critical issues.",
                score, high);
    }

    // ── Repair plan ──────────────────────────────────────────────────

    RepairPlan plan(FailureType type, GateResult failure, Map<String, Double> metrics,
                    Map<String, Double> parameters) {
        FailureLocus locus = type.locus();
        GoalState retryState = locus == FailureLocus.DESIGN ? GoalState.STRATEGY_DESIGN : GoalState.BACKTEST_COMPLETE;

        // A verification retry reuses the existing strategy artifact, so its parameters stay put.
        Map<String, Double> adjusted = new TreeMap<>(parameters);
        if (locus == FailureLocus.DESIGN) {
            Double drawdown = metrics.get(BacktestStatsRef.MAX_DRAWDOWN);
            boolean drawdownIssue = type == FailureType.CRV_FAILURE
                    || (drawdown != null && Math.abs(drawdown) > DRAWDOWN_THRESHOLD);
            if (type == FailureType.WALK_FORWARD_FAILURE) {
                scale(adjusted, LOOKBACK, 1.25);
            }
            if (drawdownIssue || type == FailureType.STRESS_FAILURE) {
                scale(adjusted, POSITION_SIZE, 0.8);
                scale(adjusted, RISK_PER_TRADE, 0.8);
            }
            if (drawdownIssue) {
                scale(adjusted, STOP_LOSS, 0.9);
            }
        }

        List<String> actions = new ArrayList<>();
        if (failure != null) {
            failure.errors().forEach(error -> actions.add("Address " + error));
        }
        actions.addAll(defaultActions(type));

        return new RepairPlan(type, describe(type), actions, retryState, locus, adjusted);
    }

    private static void scale(Map<String, Double> parameters, String key, double factor) {
        parameters.computeIfPresent(key, (k, v) -> v * factor);
    }

    private static String describe(FailureType type) {
        return switch (type) {
            case TEST_FAILURE -> "Tests failed; code quality issues detected";
            case DETERMINISM_FAILURE -> "Determinism check failed; non-deterministic behaviour detected";
            case LINT_FAILURE -> "Lint check failed; static analysis issues detected";
            case CRV_FAILURE -> "Cross-run verification failed; strategy violates constraints";
            case WALK_FORWARD_FAILURE -> "Walk-forward validation failed; strategy appears overfit";
            case STRESS_FAILURE -> "Stress suite failed; strategy is fragile under adverse scenarios";
            case GENERATION_FAILURE -> "Strategy generation failed";
            case BACKTEST_FAILURE -> "Backtest execution failed";
            case COMMIT_FAILURE -> "Commit to the artifact store failed";
            case SCORECARD_BLOCKED -> "Promotion blocked by readiness scorecard";
            case UNKNOWN -> "Unknown failure type";
        };
    }

    private static List<String> defaultActions(FailureType type) {
        return switch (type) {
            case TEST_FAILURE -> List.of("Fix failing tests", "Re-run dev gate");
            case DETERMINISM_FAILURE -> List.of("Check for unseeded random number generators",
                    "Remove system time dependencies", "Re-run determinism check");
            case LINT_FAILURE -> List.of("Fix lint findings", "Re-run dev gate");
            case CRV_FAILURE -> List.of("Adjust strategy parameters to meet constraints", "Re-run backtest",
                    "Re-run product gate");
            case WALK_FORWARD_FAILURE -> List.of("Lengthen lookback", "Re-run backtest", "Re-run walk-forward validation");
            case STRESS_FAILURE -> List.of("Reduce position sizing", "Re-run stress suite");
            case GENERATION_FAILURE, BACKTEST_FAILURE -> List.of("Regenerate strategy", "Re-run backtest");
            case COMMIT_FAILURE, SCORECARD_BLOCKED -> List.of("Re-run dev and product gates", "Retry commit");
            case UNKNOWN -> List.of("Review error messages", "Check logs for details");
        };
    }

    // ── Context ──────────────────────────────────────────────────────

    private static FailureContext snapshot(GoalRun run, GateResult failure, Map<String, Double> metrics,
                                           String feedback) {
        List<ToolCallRecord> calls = run.toolCalls();
        List<String> failedCalls = calls.stream()
                .filter(c -> !c.succeeded())
                .map(c -> c.kind().key() + ": " + c.error())
                .toList();
        return new FailureContext(
                failure != null ? failure.gateName() : "unknown",
                failure != null ? failure.failedChecks() : List.of(),
                failure != null ? failure.errors() : List.of(),
                metrics,
                run.strategyParameters(),
                calls.size(),
                failedCalls,
                feedback);
    }
}
