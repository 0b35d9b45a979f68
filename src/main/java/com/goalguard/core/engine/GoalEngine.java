package com.goalguard.core.engine;

import com.goalguard.core.events.EventBus;
import com.goalguard.core.events.GoalGuardEvent;
import com.goalguard.core.fsm.GoalGuardStateMachine;
import com.goalguard.core.graph.GoalGuardGraph;
import com.goalguard.core.logging.MdcContext;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.RiskPreference;
import com.goalguard.core.model.TimeSeriesDataset;
import com.goalguard.core.reflexion.RetryBudgetExhaustedException;
import com.goalguard.core.state.GoalGuardState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs goals end to end.
 * <p>
 * Each graph invocation executes one attempt. When an attempt ends in REFLEXION the engine
 * asks the state machine to reflect, which either re-enters the lifecycle or moves the run to
 * ERROR once the retry budget is spent; the loop stops on the first terminal state.
 */
@Service
public class GoalEngine {

    private static final Logger log = LoggerFactory.getLogger(GoalEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final GoalGuardGraph graph;
    private final GoalGuardStateMachine stateMachine;
    private final GoalRunRegistry registry;
    private final EventBus eventBus;

    public GoalEngine(GoalGuardGraph graph, GoalGuardStateMachine stateMachine,
                      GoalRunRegistry registry, EventBus eventBus) {
        this.graph = graph;
        this.stateMachine = stateMachine;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    public GoalRun runGoal(String goal, RiskPreference riskPreference, DataRef dataRef,
                           TimeSeriesDataset dataset, Map<String, Double> parameters) {
        return runGoal(goal, riskPreference, dataRef, dataset, parameters, null);
    }

    /**
     * Creates and registers a run, then drives it to a terminal state.
     *
     * @param feedback optional free-text feedback folded into reflexion suggestions
     * @return the finished run; exhaustion shows up as {@link GoalState#ERROR}
     */
    public GoalRun runGoal(String goal, RiskPreference riskPreference, DataRef dataRef,
                           TimeSeriesDataset dataset, Map<String, Double> parameters, String feedback) {
        GoalRun run = createRun(goal, riskPreference, dataRef, dataset, parameters, feedback);
        return drive(run);
    }

    public GoalRun createRun(String goal, RiskPreference riskPreference, DataRef dataRef,
                             TimeSeriesDataset dataset, Map<String, Double> parameters, String feedback) {
        GoalRun run = new GoalRun(generateRunId(), goal, riskPreference, dataRef, dataset, parameters, Instant.now());
        if (feedback != null && !feedback.isBlank()) {
            run.setFeedback(feedback);
        }
        registry.register(run);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("goal", goal);
        payload.put("risk", run.riskPreference().name());
        payload.put("data", dataRef != null ? dataRef.uri() : "");
        eventBus.publish(GoalGuardEvent.of(GoalGuardEvent.RUN_CREATED, run.runId(), null, payload));
        return run;
    }

    /**
     * Drives a registered run from wherever it is until it reaches a terminal state.
     *
     * @throws IllegalStateException if an attempt stops short of REFLEXION or a terminal state
     */
    public GoalRun drive(GoalRun run) {
        MdcContext.setRun(run.runId());
        try {
            log.info("Driving run {} from {}: {}", run.runId(), run.state(), run.goal());
            var config = RunnableConfig.builder()
                    .threadId(run.runId())
                    .build();

            while (!run.isTerminal()) {
                GoalGuardState state = graph.getCompiledGraph()
                        .invoke(Map.of("runId", run.runId(), "status", run.state().name()), config)
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for run " + run.runId()));

                if (run.state() == GoalState.REFLEXION) {
                    try {
                        stateMachine.reflect(run);
                    } catch (RetryBudgetExhaustedException e) {
                        log.warn("Run {} gave up: {}", run.runId(), e.getMessage());
                    }
                } else if (!run.isTerminal()) {
                    throw new IllegalStateException("Run %s stalled in %s: %s"
                            .formatted(run.runId(), run.state(), String.join("; ", state.errors())));
                }
            }
            log.info("Run {} finished in {} ({})", run.runId(), run.state(), run.terminalReason().orElse(""));
            return run;
        } finally {
            MdcContext.clear();
        }
    }

    /** Requests cancellation of a run; see {@link GoalGuardStateMachine#cancel(GoalRun)}. */
    public GoalState cancel(String runId) {
        return stateMachine.cancel(registry.require(runId));
    }

    public Optional<GoalRun> findRun(String runId) {
        return registry.find(runId);
    }

    /**
     * Generates a unique run ID in the format GGRD-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("GGRD-%d-%04d", year, count);
    }
}
