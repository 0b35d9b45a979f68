package com.goalguard.core.model;

/**
 * Lifecycle state of a {@link GoalRun} inside the goal-guard state machine.
 */
public enum GoalState {
    INIT,
    STRATEGY_DESIGN,
    BACKTEST_COMPLETE,
    DEV_GATE,
    DEV_GATE_PASSED,
    PRODUCT_GATE,
    PRODUCT_GATE_PASSED,
    REFLEXION,
    COMMITTED,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ERROR || this == CANCELLED;
    }
}
