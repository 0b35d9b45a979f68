package com.goalguard.core.model;

import java.io.Serializable;

/**
 * Outcome of running the strategy's unit test suite.
 */
public record TestReport(
    int totalTests,
    int failedTests,
    String output
) implements Serializable {

    public boolean passed() {
        return failedTests == 0;
    }
}
