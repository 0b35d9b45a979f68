package com.goalguard.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only record of one external tool invocation made on behalf of a goal run.
 *
 * @param sequence   1-based position among the run's tool calls
 * @param kind       which tool was invoked
 * @param inputs     arguments passed to the tool
 * @param output     the tool's result, null when the call failed
 * @param error      failure diagnostic, null when the call succeeded
 * @param timestamp  when the call started
 * @param durationMs wall-clock duration of the call
 * @param status     success, failure or timeout
 */
public record ToolCallRecord(
    int sequence,
    ToolKind kind,
    Map<String, Object> inputs,
    Object output,
    String error,
    Instant timestamp,
    long durationMs,
    ToolCallStatus status
) {
    public boolean succeeded() {
        return status == ToolCallStatus.SUCCEEDED;
    }
}
