package com.goalguard.core.scorecard;

public enum DecisionBand {
    GREEN,
    AMBER,
    RED,
    /** A hard blocker is present; overrides any score band. */
    BLOCKED
}
