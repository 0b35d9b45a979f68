package com.goalguard.core.fsm;

import com.goalguard.core.model.GoalEvent;
import com.goalguard.core.model.GoalState;

/**
 * An operation was invoked whose event is not a legal edge from the run's current state.
 * The run is left untouched.
 */
public class InvalidSequenceException extends RuntimeException {

    private final GoalState state;
    private final GoalEvent event;

    public InvalidSequenceException(GoalState state, GoalEvent event) {
        this(state, event, null);
    }

    public InvalidSequenceException(GoalState state, GoalEvent event, String detail) {
        super("Event %s is not allowed in state %s%s".formatted(event, state, detail == null ? "" : " (" + detail + ")"));
        this.state = state;
        this.event = event;
    }

    public GoalState getState() {
        return state;
    }

    public GoalEvent getEvent() {
        return event;
    }
}
