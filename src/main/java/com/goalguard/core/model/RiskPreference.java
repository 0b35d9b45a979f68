package com.goalguard.core.model;

/**
 * Risk appetite handed to the strategy generator.
 */
public enum RiskPreference {
    CONSERVATIVE,
    MODERATE,
    AGGRESSIVE
}
