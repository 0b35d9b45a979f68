package com.goalguard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing GoalGuard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String GATE = "gate";
    public static final String TOOL_KIND = "toolKind";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    /** Puts back a run id captured before {@link #setRun}, removing the key when there was none. */
    public static void restoreRun(String previousRunId) {
        if (previousRunId == null) {
            MDC.remove(RUN_ID);
        } else {
            MDC.put(RUN_ID, previousRunId);
        }
    }

    public static void setGate(String runId, String gateName) {
        MDC.put(RUN_ID, runId);
        MDC.put(GATE, gateName);
    }

    public static void setTool(String runId, String toolKind) {
        MDC.put(RUN_ID, runId);
        MDC.put(TOOL_KIND, toolKind);
    }

    public static void clearGate() {
        MDC.remove(GATE);
    }

    public static void clearTool() {
        MDC.remove(TOOL_KIND);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(GATE);
        MDC.remove(TOOL_KIND);
    }
}
