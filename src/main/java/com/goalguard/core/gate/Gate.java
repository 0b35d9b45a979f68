package com.goalguard.core.gate;

/**
 * An evidence checkpoint a run must clear before it advances.
 */
public interface Gate {

    String name();

    /**
     * Runs every check of this gate. Never throws; failures are reported in the result.
     */
    GateResult evaluate(GateArtifact artifact, GateContext context);
}
