package com.goalguard.core.model;

public enum ViolationSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
