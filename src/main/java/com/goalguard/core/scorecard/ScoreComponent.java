package com.goalguard.core.scorecard;

/**
 * The five DROPS readiness dimensions.
 */
public enum ScoreComponent {
    D("Determinism"),
    R("Risk"),
    O("Ops"),
    P("Policy"),
    U("User");

    private final String label;

    ScoreComponent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
