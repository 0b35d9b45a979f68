package com.goalguard.core.fsm;

import com.goalguard.core.model.GoalEvent;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;

import java.util.function.Predicate;

/**
 * One edge of the transition table.
 *
 * @param from      source state
 * @param event     triggering event
 * @param to        target state
 * @param guardName readable guard description, {@code "always"} when unguarded
 * @param guard     must hold for the edge to fire
 */
public record Transition(
    GoalState from,
    GoalEvent event,
    GoalState to,
    String guardName,
    Predicate<GoalRun> guard
) {

    static final String ALWAYS = "always";

    public static Transition of(GoalState from, GoalEvent event, GoalState to) {
        return new Transition(from, event, to, ALWAYS, run -> true);
    }

    public static Transition guarded(GoalState from, GoalEvent event, GoalState to, String guardName,
                                     Predicate<GoalRun> guard) {
        return new Transition(from, event, to, guardName, guard);
    }

    public boolean guarded() {
        return !ALWAYS.equals(guardName);
    }

    public boolean allows(GoalRun run) {
        return guard.test(run);
    }
}
