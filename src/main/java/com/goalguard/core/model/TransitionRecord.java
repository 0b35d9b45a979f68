package com.goalguard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One applied state transition of a goal run. The ordered list of these records
 * replays the run from {@link GoalState#INIT} to its current state.
 *
 * @param sequence  1-based position in the run's history
 * @param from      state before the transition
 * @param event     event that fired
 * @param to        state after the transition
 * @param timestamp when the transition was applied
 * @param note      short human-readable reason
 */
public record TransitionRecord(
    int sequence,
    GoalState from,
    GoalEvent event,
    GoalState to,
    Instant timestamp,
    String note
) implements Serializable {}
