package com.goalguard.core.tools;

import com.goalguard.core.events.EventBus;
import com.goalguard.core.events.GoalGuardEvent;
import com.goalguard.core.logging.MdcContext;
import com.goalguard.core.metrics.GoalGuardMetrics;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.ToolCallRecord;
import com.goalguard.core.model.ToolCallStatus;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.model.ToolOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issues tool calls on behalf of a run and appends a {@link ToolCallRecord} for every one of
 * them, whatever the outcome. Runtime exceptions thrown by an invoker are converted to
 * {@link ToolInvocationException} so callers only ever see the checked failure.
 */
public class ToolCallRecorder {

    private static final Logger log = LoggerFactory.getLogger(ToolCallRecorder.class);

    private final GoalGuardMetrics metrics;
    private final EventBus eventBus;

    public ToolCallRecorder(GoalGuardMetrics metrics, EventBus eventBus) {
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public <T> T invoke(GoalRun run, ToolKind kind, Map<String, Object> inputs, ToolCall<T> call)
            throws ToolInvocationException {
        MdcContext.setTool(run.runId(), kind.key());
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        try {
            T output = call.call();
            record(run, kind, inputs, output, null, startedAt, start, ToolCallStatus.SUCCEEDED);
            return output;
        } catch (ToolInvocationException e) {
            ToolCallStatus status = e.isTimedOut() ? ToolCallStatus.TIMED_OUT : ToolCallStatus.FAILED;
            record(run, kind, inputs, null, e.getMessage(), startedAt, start, status);
            throw e;
        } catch (RuntimeException e) {
            ToolInvocationException wrapped = new ToolInvocationException(kind,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            record(run, kind, inputs, null, wrapped.getMessage(), startedAt, start, ToolCallStatus.FAILED);
            throw wrapped;
        } finally {
            MdcContext.clearTool();
        }
    }

    /**
     * Invokes a tool whose failure is carried forward instead of thrown.
     */
    public <T> ToolOutcome<T> capture(GoalRun run, ToolKind kind, Map<String, Object> inputs, ToolCall<T> call) {
        try {
            return ToolOutcome.success(kind, invoke(run, kind, inputs, call));
        } catch (ToolInvocationException e) {
            return ToolOutcome.failure(kind, e.getMessage(), e.isTimedOut());
        }
    }

    private void record(GoalRun run, ToolKind kind, Map<String, Object> inputs, Object output, String error,
                        Instant startedAt, long startNanos, ToolCallStatus status) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        ToolCallRecord record = new ToolCallRecord(run.nextToolCallSequence(), kind,
                inputs == null ? Map.of() : new LinkedHashMap<>(inputs),
                output, error, startedAt, durationMs, status);
        run.appendToolCall(record);

        if (status == ToolCallStatus.SUCCEEDED) {
            log.info("Tool {} succeeded in {} ms", kind.key(), durationMs);
        } else {
            log.warn("Tool {} {} after {} ms: {}", kind.key(), status, durationMs, error);
        }
        metrics.recordToolCall(kind.key(), status.name().toLowerCase(), durationMs);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequence", record.sequence());
        payload.put("status", status.name());
        payload.put("durationMs", durationMs);
        if (error != null) {
            payload.put("error", error);
        }
        eventBus.publish(GoalGuardEvent.of(GoalGuardEvent.TOOL_INVOKED, run.runId(), kind.key(), payload));
    }
}
