package com.goalguard.core.scorecard;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Promotion readiness verdict for one run.
 *
 * @param runId          run scored
 * @param components     DROPS component scores, each in [0, 100]
 * @param profileVersion weight profile used
 * @param score          weighted aggregate S
 * @param decision       final decision; {@link DecisionBand#BLOCKED} whenever blockers is non-empty
 * @param scoreBand      band S alone would earn
 * @param blockers       hard blockers, possibly empty
 * @param nextActions    ranked actions, never empty
 * @param recommendation human-readable verdict
 */
public record ReadinessScorecard(
    String runId,
    Map<ScoreComponent, Double> components,
    String profileVersion,
    double score,
    DecisionBand decision,
    DecisionBand scoreBand,
    List<String> blockers,
    List<NextAction> nextActions,
    String recommendation
) implements Serializable {

    public ReadinessScorecard {
        components = components == null || components.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(components));
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
    }

    public boolean blocked() {
        return decision == DecisionBand.BLOCKED;
    }

    public double component(ScoreComponent component) {
        return components.getOrDefault(component, 0.0);
    }
}
