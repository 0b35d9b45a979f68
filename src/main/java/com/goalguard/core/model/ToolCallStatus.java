package com.goalguard.core.model;

/**
 * Outcome of a single external tool invocation.
 */
public enum ToolCallStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
