package com.goalguard.core.model;

import java.io.Serializable;

/**
 * A single rule violation reported by the cross-run verifier.
 */
public record Violation(
    String ruleId,
    ViolationSeverity severity,
    String message
) implements Serializable {}
