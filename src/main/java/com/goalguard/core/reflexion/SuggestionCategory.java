package com.goalguard.core.reflexion;

public enum SuggestionCategory {
    PARAMETER,
    LOGIC,
    RISK_MANAGEMENT,
    TIMING
}
