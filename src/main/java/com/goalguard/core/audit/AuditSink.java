package com.goalguard.core.audit;

/**
 * Destination for the structured records a run produces: gate results, walk-forward
 * analyses and readiness scorecards.
 */
public interface AuditSink {

    String GATE_RESULT = "gate_result";
    String WALK_FORWARD_ANALYSIS = "walk_forward_analysis";
    String READINESS_SCORECARD = "readiness_scorecard";

    void record(String runId, String recordType, Object record);
}
