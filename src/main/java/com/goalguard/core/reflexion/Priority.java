package com.goalguard.core.reflexion;

/**
 * Suggestion priority; declaration order is ranking order.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
