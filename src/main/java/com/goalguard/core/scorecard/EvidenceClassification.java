package com.goalguard.core.scorecard;

public enum EvidenceClassification {
    GREEN,
    AMBER,
    RED
}
