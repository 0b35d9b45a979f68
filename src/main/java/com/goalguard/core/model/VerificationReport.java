package com.goalguard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of cross-run verification (CRV) of a backtest.
 */
public record VerificationReport(
    boolean passed,
    List<Violation> violations
) implements Serializable {

    public VerificationReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }
}
