package com.goalguard.core.reflexion;

/**
 * Check names for failures that happen outside a gate, used to build synthetic gate results.
 */
public final class FailureChecks {

    public static final String GENERATE_STRATEGY_INVOCATION = "generate_strategy_invocation";
    public static final String BACKTEST_INVOCATION = "backtest_invocation";
    public static final String COMMIT_INVOCATION = "commit_invocation";
    public static final String PROMOTION_BLOCKERS = "promotion_blockers";

    public static final String TOOL_FAILURE_GATE = "tool_failure";
    public static final String PROMOTION_GATE = "promotion_scorecard";

    private FailureChecks() {}
}
