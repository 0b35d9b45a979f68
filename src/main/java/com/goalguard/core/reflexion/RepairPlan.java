package com.goalguard.core.reflexion;

import com.goalguard.core.model.FailureLocus;
import com.goalguard.core.model.GoalState;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * How a failed run should be re-attempted.
 *
 * @param failureType        classified failure
 * @param description        one-line diagnosis
 * @param actions            concrete steps, in order
 * @param retryState         state the run re-enters on retry
 * @param locus              whether the design or only the verification is at fault
 * @param adjustedParameters strategy parameters to use for the retry
 */
public record RepairPlan(
    FailureType failureType,
    String description,
    List<String> actions,
    GoalState retryState,
    FailureLocus locus,
    Map<String, Double> adjustedParameters
) implements Serializable {

    public RepairPlan {
        actions = actions == null ? List.of() : List.copyOf(actions);
        adjustedParameters = adjustedParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(adjustedParameters));
    }
}
