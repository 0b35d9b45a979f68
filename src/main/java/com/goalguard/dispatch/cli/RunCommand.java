package com.goalguard.dispatch.cli;

import com.goalguard.core.data.CsvTimestampReader;
import com.goalguard.core.engine.GoalEngine;
import com.goalguard.core.events.EventBus;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.RiskPreference;
import com.goalguard.core.model.TimeSeriesDataset;
import com.goalguard.core.strict.StrictMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: goalguard run "&lt;goal&gt;" --data &lt;csv-or-uri&gt;
 * <p>
 * Runs one goal through the gated lifecycle and prints the transition history, the gate
 * results and the readiness scorecard. Exits 0 only when the strategy was committed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a strategy goal through the gates")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language strategy goal")
    private String goal;

    @Option(names = {"--data", "-d"}, required = true,
            description = "CSV file whose first column holds timestamps, or a dataset URI the tools understand")
    private String data;

    @Option(names = {"--risk", "-r"}, defaultValue = "MODERATE",
            description = "Risk preference: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private RiskPreference risk;

    @Option(names = {"--param", "-p"}, description = "Initial strategy parameter, e.g. -p lookback=20")
    private Map<String, Double> parameters = new LinkedHashMap<>();

    @Option(names = "--feedback", description = "Free-text feedback folded into reflexion suggestions")
    private String feedback;

    @Option(names = "--strict", description = "Print artifact ids only")
    private boolean strict;

    @Option(names = {"--watch", "-w"}, description = "Print run events as they happen")
    private boolean watch;

    private final GoalEngine goalEngine;
    private final StrictMode strictMode;
    private final EventBus eventBus;

    public RunCommand(GoalEngine goalEngine, StrictMode strictMode, EventBus eventBus) {
        this.goalEngine = goalEngine;
        this.strictMode = strictMode;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        StrictMode output = strict ? new StrictMode(true) : strictMode;
        if (!output.isEnabled()) {
            ConsoleOutput.printBanner();
        }

        DataRef dataRef;
        TimeSeriesDataset dataset = null;
        try {
            Path path = Path.of(data);
            if (Files.isRegularFile(path)) {
                dataset = new CsvTimestampReader().read(path);
                dataRef = dataset.ref();
            } else {
                dataRef = DataRef.of(data);
            }
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cannot load dataset " + data + ": " + rootCauseMessage(e));
            return 2;
        }

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        GoalRun run;
        try {
            run = goalEngine.runGoal(goal, risk, dataRef, dataset, parameters, feedback);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (output.isEnabled()) {
            String response = output.formatArtifactResponse(artifactIds(run, output), run.state().name());
            System.out.println(response);
            return run.state() == GoalState.COMMITTED && output.validateResponse(response) ? 0 : 1;
        }

        System.out.println();
        System.out.println("RUN " + run.runId());
        System.out.println("Goal: " + run.goal());
        System.out.println("Risk: " + run.riskPreference() + " | Retries: " + run.reflexionCount());
        System.out.println();
        System.out.println("TRANSITIONS:");
        run.transitions().forEach(ConsoleOutput::transition);

        System.out.println();
        run.gateResult("dev_gate").ifPresent(ConsoleOutput::gate);
        run.gateResult("product_gate").ifPresent(ConsoleOutput::gate);
        run.walkForwardAnalysis().ifPresent(ConsoleOutput::walkForward);
        run.scorecard().ifPresent(ConsoleOutput::scorecard);

        System.out.println();
        String reason = run.terminalReason().orElse("");
        switch (run.state()) {
            case COMMITTED -> ConsoleOutput.success("Committed. " + reason);
            case CANCELLED -> ConsoleOutput.info("Cancelled. " + reason);
            default -> ConsoleOutput.error("Run ended in " + run.state() + ". " + reason);
        }
        return run.state() == GoalState.COMMITTED ? 0 : 1;
    }

    private static List<String> artifactIds(GoalRun run, StrictMode output) {
        List<String> candidates = new ArrayList<>();
        run.strategy().ifPresent(s -> candidates.add(s.digest()));
        run.backtestStats().ifPresent(b -> candidates.add(b.digest()));
        run.committedId().ifPresent(c -> candidates.add(c.value()));
        return output.extractArtifactIds(String.join(" ", candidates));
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
