package com.goalguard.core.model;

/**
 * Events that drive a {@link GoalRun} from one {@link GoalState} to the next.
 */
public enum GoalEvent {
    GENERATE_STRATEGY,
    BACKTEST,
    RUN_TESTS,
    PASS,
    FAIL,
    CRV_VERIFY,
    COMMIT,
    RETRY_AVAILABLE,
    RETRIES_EXHAUSTED,
    TOOL_FAILURE,
    CANCEL
}
