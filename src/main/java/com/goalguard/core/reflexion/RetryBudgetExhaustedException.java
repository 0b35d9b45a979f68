package com.goalguard.core.reflexion;

/**
 * Thrown once a run has used its whole retry budget and has been moved to ERROR.
 */
public class RetryBudgetExhaustedException extends RuntimeException {

    private final String runId;
    private final int retries;

    public RetryBudgetExhaustedException(String runId, int retries, String lastFailure) {
        super("Run %s exhausted its retry budget after %d retries; last failure: %s"
                .formatted(runId, retries, lastFailure));
        this.runId = runId;
        this.retries = retries;
    }

    public String getRunId() {
        return runId;
    }

    public int getRetries() {
        return retries;
    }
}
