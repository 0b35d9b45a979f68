package com.goalguard.core.engine;

import com.goalguard.core.model.GoalRun;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory lookup of live and finished goal runs by id.
 */
@Component
public class GoalRunRegistry {

    private final Map<String, GoalRun> runs = new ConcurrentHashMap<>();

    public void register(GoalRun run) {
        if (runs.putIfAbsent(run.runId(), run) != null) {
            throw new IllegalArgumentException("Run already registered: " + run.runId());
        }
    }

    public Optional<GoalRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public GoalRun require(String runId) {
        GoalRun run = runs.get(runId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        return run;
    }

    public Collection<GoalRun> all() {
        return List.copyOf(runs.values());
    }

    public void remove(String runId) {
        runs.remove(runId);
    }
}
