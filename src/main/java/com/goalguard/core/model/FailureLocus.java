package com.goalguard.core.model;

/**
 * Where a failure originated, which decides how far back a retry re-enters the pipeline.
 */
public enum FailureLocus {
    /** The strategy itself is at fault; regenerate it with repaired parameters. */
    DESIGN,
    /** Only tests or verification failed; re-run from the completed backtest. */
    VERIFICATION
}
