package com.goalguard.core.graph;

import com.goalguard.core.engine.GoalRunRegistry;
import com.goalguard.core.fsm.GoalGuardStateMachine;
import com.goalguard.core.fsm.InvalidSequenceException;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.state.GoalGuardState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that runs one attempt of a goal.
 * <p>
 * An attempt starts wherever the run currently is and follows the lifecycle until the run
 * reaches REFLEXION or a terminal state:
 * <pre>
 *   START -> route -> [routeByRunState]
 *      -> generate_strategy -> backtest -> run_tests -> dev_gate
 *      -> crv_verify -> product_gate -> commit -> END
 *   every node -> [routeByRunState] -> END on REFLEXION, COMMITTED, ERROR or CANCELLED
 * </pre>
 * The engine decides what to do with REFLEXION; the graph never retries on its own.
 */
@Component
public class GoalGuardGraph {

    private static final Logger log = LoggerFactory.getLogger(GoalGuardGraph.class);

    static final String ROUTE = "route";
    static final String GENERATE_STRATEGY = "generate_strategy";
    static final String BACKTEST = "backtest";
    static final String RUN_TESTS = "run_tests";
    static final String DEV_GATE = "dev_gate";
    static final String CRV_VERIFY = "crv_verify";
    static final String PRODUCT_GATE = "product_gate";
    static final String COMMIT = "commit";

    private static final Map<String, String> ROUTES = Map.of(
            GENERATE_STRATEGY, GENERATE_STRATEGY,
            BACKTEST, BACKTEST,
            RUN_TESTS, RUN_TESTS,
            DEV_GATE, DEV_GATE,
            CRV_VERIFY, CRV_VERIFY,
            PRODUCT_GATE, PRODUCT_GATE,
            COMMIT, COMMIT,
            END, END);

    private final GoalGuardStateMachine stateMachine;
    private final GoalRunRegistry registry;
    private final CompiledGraph<GoalGuardState> compiledGraph;

    public GoalGuardGraph(GoalGuardStateMachine stateMachine, GoalRunRegistry registry) throws Exception {
        this.stateMachine = stateMachine;
        this.registry = registry;

        var graph = new StateGraph<>(GoalGuardState.SCHEMA, GoalGuardState::new)
                .addNode(ROUTE, node_async(state -> Map.of("status", registry.require(state.runId()).state().name())))
                .addNode(GENERATE_STRATEGY, node_async(state -> step(state, stateMachine::generateStrategy)))
                .addNode(BACKTEST, node_async(state -> step(state, stateMachine::backtest)))
                .addNode(RUN_TESTS, node_async(state -> step(state, stateMachine::runTests)))
                .addNode(DEV_GATE, node_async(state -> step(state, stateMachine::evaluateDevGate)))
                .addNode(CRV_VERIFY, node_async(state -> step(state, stateMachine::crvVerify)))
                .addNode(PRODUCT_GATE, node_async(state -> step(state, stateMachine::evaluateProductGate)))
                .addNode(COMMIT, node_async(state -> step(state, stateMachine::commit)))
                .addEdge(START, ROUTE);
        for (String node : List.of(ROUTE, GENERATE_STRATEGY, BACKTEST, RUN_TESTS, DEV_GATE,
                CRV_VERIFY, PRODUCT_GATE, COMMIT)) {
            graph.addConditionalEdges(node, edge_async(this::routeByRunState), ROUTES);
        }

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Goal graph compiled");
    }

    /**
     * Routes to the node that owns the run's current state. Stops the attempt on REFLEXION,
     * on any terminal state and after a node reported an error.
     */
    String routeByRunState(GoalGuardState state) {
        if (!state.errors().isEmpty()) {
            return END;
        }
        return nextNode(registry.require(state.runId()).state());
    }

    static String nextNode(GoalState state) {
        return switch (state) {
            case INIT -> GENERATE_STRATEGY;
            case STRATEGY_DESIGN -> BACKTEST;
            case BACKTEST_COMPLETE -> RUN_TESTS;
            case DEV_GATE -> DEV_GATE;
            case DEV_GATE_PASSED -> CRV_VERIFY;
            case PRODUCT_GATE -> PRODUCT_GATE;
            case PRODUCT_GATE_PASSED -> COMMIT;
            case REFLEXION, COMMITTED, ERROR, CANCELLED -> END;
        };
    }

    private Map<String, Object> step(GoalGuardState state, Function<GoalRun, GoalState> operation) {
        GoalRun run = registry.require(state.runId());
        try {
            GoalState reached = operation.apply(run);
            return Map.of("status", reached.name());
        } catch (InvalidSequenceException e) {
            log.warn("Run {} stopped: {}", run.runId(), e.getMessage());
            return Map.of("status", run.state().name(), "errors", List.of(e.getMessage()));
        }
    }

    public CompiledGraph<GoalGuardState> getCompiledGraph() {
        return compiledGraph;
    }
}
