package com.goalguard.core.reflexion;

public enum ReflexionDecision {
    /** Budget remains; re-enter the pipeline with the repair plan. */
    RETRY,
    /** Budget spent; the run must end in ERROR. */
    EXHAUSTED
}
