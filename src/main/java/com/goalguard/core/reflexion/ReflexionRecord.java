package com.goalguard.core.reflexion;

import java.io.Serializable;
import java.util.List;

/**
 * One reflexion cycle for a run.
 *
 * @param runId            run diagnosed
 * @param iteration        1-based reflexion iteration
 * @param failureType      classified failure
 * @param context          what was diagnosed
 * @param improvementScore deterministic score in [-2, 2]
 * @param suggestions      ranked suggestions, highest priority first
 * @param summary          human-readable summary
 * @param repairPlan       how to re-attempt
 * @param decision         retry or exhausted
 */
public record ReflexionRecord(
    String runId,
    int iteration,
    FailureType failureType,
    FailureContext context,
    double improvementScore,
    List<Suggestion> suggestions,
    String summary,
    RepairPlan repairPlan,
    ReflexionDecision decision
) implements Serializable {

    public ReflexionRecord {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean exhausted() {
        return decision == ReflexionDecision.EXHAUSTED;
    }
}
