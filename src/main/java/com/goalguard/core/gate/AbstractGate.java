package com.goalguard.core.gate;

import com.goalguard.core.logging.MdcContext;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.tools.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a fixed, ordered battery of checks. Every check runs even after an earlier one
 * failed, so the result is always complete.
 */
public abstract class AbstractGate implements Gate {

    private static final Logger log = LoggerFactory.getLogger(AbstractGate.class);

    private final String name;
    private final Map<String, GateCheck> checks = new LinkedHashMap<>();

    protected AbstractGate(String name) {
        this.name = name;
    }

    protected final void addCheck(String checkName, GateCheck check) {
        checks.put(checkName, check);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> checkNames() {
        return List.copyOf(checks.keySet());
    }

    @Override
    public GateResult evaluate(GateArtifact artifact, GateContext context) {
        MdcContext.setGate(context.runId(), name);
        try {
            Map<String, Boolean> outcomes = new LinkedHashMap<>();
            Map<String, Object> details = new LinkedHashMap<>();
            List<String> errors = new ArrayList<>();

            for (Map.Entry<String, GateCheck> entry : checks.entrySet()) {
                String checkName = entry.getKey();
                try {
                    CheckOutcome outcome = entry.getValue().run(artifact, context);
                    outcomes.put(checkName, true);
                    if (outcome != null && outcome.detail() != null) {
                        details.put(checkName, outcome.detail());
                    }
                    log.debug("Check {} passed", checkName);
                } catch (GateCheckException e) {
                    fail(checkName, e.getMessage(), e.getDetail(), outcomes, details, errors);
                } catch (ToolInvocationException e) {
                    String prefix = e.isTimedOut() ? "tool timed out: " : "tool failed: ";
                    fail(checkName, prefix + e.getMessage(), null, outcomes, details, errors);
                } catch (RuntimeException e) {
                    log.error("Check {} threw unexpectedly", checkName, e);
                    fail(checkName, e.getClass().getSimpleName() + ": " + e.getMessage(), null,
                            outcomes, details, errors);
                }
            }

            boolean passed = errors.isEmpty();
            log.info("Gate {} {} ({} checks, {} failed)", name, passed ? "passed" : "failed",
                    outcomes.size(), errors.size());
            return new GateResult(name, outcomes, details, errors, passed);
        } finally {
            MdcContext.clearGate();
        }
    }

    private static void fail(String checkName, String message, Object detail, Map<String, Boolean> outcomes,
                             Map<String, Object> details, List<String> errors) {
        outcomes.put(checkName, false);
        if (detail != null) {
            details.put(checkName, detail);
        }
        errors.add(checkName + ": " + message);
        log.warn("Check {} failed: {}", checkName, message);
    }

    protected static StrategyArtifactRef requireStrategy(GateArtifact artifact) throws GateCheckException {
        if (artifact.strategy() == null) {
            throw new GateCheckException("no strategy artifact to evaluate");
        }
        return artifact.strategy();
    }

    protected static BacktestStatsRef requireBacktest(GateArtifact artifact) throws GateCheckException {
        if (artifact.backtestStats() == null) {
            throw new GateCheckException("no backtest statistics to evaluate");
        }
        return artifact.backtestStats();
    }
}
