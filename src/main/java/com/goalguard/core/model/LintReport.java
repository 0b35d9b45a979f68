package com.goalguard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the static/lint check on a strategy artifact.
 */
public record LintReport(
    boolean passed,
    List<String> issues
) implements Serializable {

    public LintReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
