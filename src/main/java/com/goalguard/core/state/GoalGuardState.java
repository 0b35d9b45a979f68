package com.goalguard.core.state;

import com.goalguard.core.model.GoalState;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Graph state for one attempt of a goal run.
 * <p>
 * The run itself lives in the {@link com.goalguard.core.engine.GoalRunRegistry}; the graph
 * only carries its id, the lifecycle state last reached and any errors collected by nodes.
 */
public class GoalGuardState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",  Channels.base(() -> "")),
        Map.entry("status", Channels.base(() -> GoalState.INIT.name())),
        Map.entry("errors", Channels.appender(ArrayList::new))
    );

    public GoalGuardState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public GoalState status() {
        String raw = this.<String>value("status").orElse(GoalState.INIT.name());
        return GoalState.valueOf(raw);
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
