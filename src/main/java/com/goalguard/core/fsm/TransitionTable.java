package com.goalguard.core.fsm;

import com.goalguard.core.model.FailureLocus;
import com.goalguard.core.model.GoalEvent;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.TransitionRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.goalguard.core.model.GoalEvent.*;
import static com.goalguard.core.model.GoalState.*;

/**
 * The complete, enumerable map from (state, event) to guarded target states. Any pair not
 * listed here is a rejection.
 */
public final class TransitionTable {

    private final Map<GoalState, Map<GoalEvent, List<Transition>>> edges = new EnumMap<>(GoalState.class);
    private final List<Transition> all = new ArrayList<>();

    private TransitionTable() {}

    public static TransitionTable standard() {
        TransitionTable table = new TransitionTable();
        table.add(Transition.of(INIT, GENERATE_STRATEGY, STRATEGY_DESIGN));
        table.add(Transition.of(STRATEGY_DESIGN, BACKTEST, BACKTEST_COMPLETE));
        table.add(Transition.of(BACKTEST_COMPLETE, RUN_TESTS, DEV_GATE));
        table.add(Transition.of(DEV_GATE, PASS, DEV_GATE_PASSED));
        table.add(Transition.of(DEV_GATE, FAIL, REFLEXION));
        table.add(Transition.of(DEV_GATE_PASSED, CRV_VERIFY, PRODUCT_GATE));
        table.add(Transition.of(PRODUCT_GATE, PASS, PRODUCT_GATE_PASSED));
        table.add(Transition.of(PRODUCT_GATE, FAIL, REFLEXION));
        table.add(Transition.of(PRODUCT_GATE_PASSED, COMMIT, COMMITTED));
        table.add(Transition.of(PRODUCT_GATE_PASSED, FAIL, REFLEXION));
        table.add(Transition.guarded(REFLEXION, RETRY_AVAILABLE, STRATEGY_DESIGN, "locus=DESIGN",
                run -> locusOf(run) == FailureLocus.DESIGN));
        table.add(Transition.guarded(REFLEXION, RETRY_AVAILABLE, BACKTEST_COMPLETE, "locus=VERIFICATION",
                run -> locusOf(run) == FailureLocus.VERIFICATION));
        table.add(Transition.of(REFLEXION, RETRIES_EXHAUSTED, ERROR));

        for (GoalState state : List.of(INIT, STRATEGY_DESIGN, PRODUCT_GATE_PASSED)) {
            table.add(Transition.of(state, TOOL_FAILURE, REFLEXION));
        }
        for (GoalState state : GoalState.values()) {
            if (!state.isTerminal()) {
                table.add(Transition.of(state, CANCEL, CANCELLED));
            }
        }
        return table;
    }

    private static FailureLocus locusOf(GoalRun run) {
        return run.lastReflexion()
                .map(record -> record.repairPlan().locus())
                .orElse(null);
    }

    private void add(Transition transition) {
        edges.computeIfAbsent(transition.from(), s -> new EnumMap<>(GoalEvent.class))
                .computeIfAbsent(transition.event(), e -> new ArrayList<>())
                .add(transition);
        all.add(transition);
    }

    /**
     * Returns the first edge for the run's current state and this event whose guard holds.
     */
    public Optional<Transition> resolve(GoalRun run, GoalEvent event) {
        return candidates(run.state(), event).stream()
                .filter(t -> t.allows(run))
                .findFirst();
    }

    /** Whether any edge, guarded or not, leaves {@code state} on {@code event}. */
    public boolean permits(GoalState state, GoalEvent event) {
        return !candidates(state, event).isEmpty();
    }

    public List<Transition> candidates(GoalState state, GoalEvent event) {
        return edges.getOrDefault(state, Map.of()).getOrDefault(event, List.of());
    }

    public Set<GoalEvent> allowedEvents(GoalState state) {
        Map<GoalEvent, List<Transition>> byEvent = edges.get(state);
        return byEvent == null ? EnumSet.noneOf(GoalEvent.class) : EnumSet.copyOf(byEvent.keySet());
    }

    public List<Transition> all() {
        return Collections.unmodifiableList(all);
    }

    /**
     * Replays a transition history from INIT and returns the state it ends in.
     *
     * @throws IllegalStateException if a record does not follow from the previous state
     *                               or names an edge absent from the table
     */
    public GoalState replay(List<TransitionRecord> history) {
        GoalState current = INIT;
        for (TransitionRecord record : history) {
            if (record.from() != current) {
                throw new IllegalStateException("Record %d starts from %s but replay is at %s"
                        .formatted(record.sequence(), record.from(), current));
            }
            boolean known = candidates(record.from(), record.event()).stream()
                    .anyMatch(t -> t.to() == record.to());
            if (!known) {
                throw new IllegalStateException("Record %d uses unknown edge %s --%s--> %s"
                        .formatted(record.sequence(), record.from(), record.event(), record.to()));
            }
            current = record.to();
        }
        return current;
    }
}
