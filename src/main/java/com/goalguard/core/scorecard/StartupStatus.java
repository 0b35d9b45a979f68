package com.goalguard.core.scorecard;

public enum StartupStatus {
    HEALTHY,
    DEGRADED,
    UNAVAILABLE
}
