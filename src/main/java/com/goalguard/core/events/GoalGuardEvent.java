package com.goalguard.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a goal run is driven through the state machine.
 *
 * @param eventType event type (e.g. "run.created", "run.transition", "gate.evaluated")
 * @param runId     the run this event belongs to
 * @param detail    short subject of the event, such as the gate or tool name (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record GoalGuardEvent(
    String eventType,
    String runId,
    String detail,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_CREATED = "run.created";
    public static final String RUN_TRANSITION = "run.transition";
    public static final String TOOL_INVOKED = "tool.invoked";
    public static final String GATE_EVALUATED = "gate.evaluated";
    public static final String REFLEXION_PLANNED = "reflexion.planned";
    public static final String RUN_TERMINAL = "run.terminal";

    public GoalGuardEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static GoalGuardEvent of(String eventType, String runId, String detail, Map<String, Object> payload) {
        return new GoalGuardEvent(eventType, runId, detail, payload, Instant.now());
    }
}
