package com.goalguard.dispatch.cli;

import com.goalguard.core.GoalGuardFixture;
import com.goalguard.core.engine.GoalEngine;
import com.goalguard.core.events.EventBus;
import com.goalguard.core.fsm.GoalGuardStateMachine;
import com.goalguard.core.fsm.TransitionTable;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.GoalRun;
import com.goalguard.core.model.GoalState;
import com.goalguard.core.model.RiskPreference;
import com.goalguard.core.model.TimeSeriesDataset;
import com.goalguard.core.strict.StrictMode;
import com.goalguard.core.tools.FakeToolInvoker;
import com.goalguard.core.walkforward.WalkForwardConfig;
import com.goalguard.core.walkforward.WalkForwardValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the GoalGuard CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(GoalEngine engine, StrictMode strictMode) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine, strictMode, new EventBus());
                }
                if (cls == TransitionsCommand.class) {
                    return (K) new TransitionsCommand(TransitionTable.standard());
                }
                if (cls == WindowsCommand.class) {
                    return (K) new WindowsCommand(new WalkForwardValidator(WalkForwardConfig.defaults()));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(GoalEngine.class), new StrictMode(false), args);
    }

    private CliResult execute(GoalEngine engine, StrictMode strictMode, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
        try {
            CommandLine commandLine = new CommandLine(new GoalGuardCommand(), createFactory(engine, strictMode));
            int exitCode = commandLine.execute(args);
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    /** A run driven to COMMITTED by the real state machine over the fake tools. */
    private static GoalRun committedRun() {
        GoalGuardStateMachine sm = new GoalGuardFixture().stateMachine;
        GoalRun run = GoalGuardFixture.newRun("GGRD-2026-0001");
        sm.generateStrategy(run);
        sm.backtest(run);
        sm.runTests(run);
        sm.evaluateDevGate(run);
        sm.crvVerify(run);
        sm.evaluateProductGate(run);
        sm.commit(run);
        return run;
    }

    private static GoalEngine engineReturning(GoalRun run) {
        GoalEngine engine = mock(GoalEngine.class);
        when(engine.runGoal(anyString(), any(RiskPreference.class), any(DataRef.class), any(), anyMap(), any()))
                .thenReturn(run);
        return engine;
    }

    @Nested
    @DisplayName("top-level command")
    class TopLevel {

        @Test
        @DisplayName("--help lists the subcommands")
        void help() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("transitions"));
            assertTrue(result.output().contains("windows"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noArgs() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("GOALGUARD"));
            assertTrue(result.output().contains("Usage: goalguard"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("GoalGuard 0.1.0"));
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("prints history, gates and scorecard and exits 0 when committed")
        void committed() {
            GoalRun run = committedRun();
            CliResult result = execute(engineReturning(run), new StrictMode(false),
                    "run", "Momentum on daily closes", "--data", "memory://prices", "-p", "lookback=20");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("RUN GGRD-2026-0001"));
            assertTrue(result.output().contains("PRODUCT_GATE_PASSED"));
            assertTrue(result.output().contains("dev_gate"));
            assertTrue(result.output().contains("Committed."));
        }

        @Test
        @DisplayName("passes the parsed goal, risk and parameters to the engine")
        void arguments() {
            GoalEngine engine = engineReturning(committedRun());
            execute(engine, new StrictMode(false), "run", "Mean reversion", "--data", "memory://prices",
                    "--risk", "CONSERVATIVE", "-p", "lookback=10", "-p", "position_size=0.5", "--feedback", "too volatile");

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Double>> params = ArgumentCaptor.forClass(Map.class);
            verify(engine).runGoal(eq("Mean reversion"), eq(RiskPreference.CONSERVATIVE),
                    eq(DataRef.of("memory://prices")), isNull(), params.capture(), eq("too volatile"));
            assertEquals(Map.of("lookback", 10.0, "position_size", 0.5), params.getValue());
        }

        @Test
        @DisplayName("a CSV file is loaded as the walk-forward dataset")
        void csvDataset(@TempDir Path dir) throws IOException {
            Path csv = dir.resolve("prices.csv");
            Files.writeString(csv, "date,close\n2024-01-02,1\n2024-01-03,2\n2024-01-04,3\n");
            GoalEngine engine = engineReturning(committedRun());

            execute(engine, new StrictMode(false), "run", "Breakout", "--data", csv.toString());

            ArgumentCaptor<TimeSeriesDataset> dataset = ArgumentCaptor.forClass(TimeSeriesDataset.class);
            verify(engine).runGoal(anyString(), any(RiskPreference.class), any(DataRef.class), dataset.capture(),
                    anyMap(), any());
            assertEquals(3, dataset.getValue().rowCount());
        }

        @Test
        @DisplayName("strict mode prints only artifact ids")
        void strict() {
            CliResult result = execute(engineReturning(committedRun()), new StrictMode(false),
                    "run", "Momentum", "--data", "memory://prices", "--strict");

            assertEquals(0, result.exitCode());
            String expected = "COMMITTED\nArtifacts:\n  " + FakeToolInvoker.STRATEGY_DIGEST + "\n  "
                    + FakeToolInvoker.BACKTEST_DIGEST + "\n  " + FakeToolInvoker.COMMITTED_ID;
            assertEquals(expected, result.output().strip().replace("\r\n", "\n"));
        }

        @Test
        @DisplayName("exits 1 when the run did not commit")
        void notCommitted() {
            GoalRun run = GoalGuardFixture.newRun("GGRD-2026-0002");
            new GoalGuardFixture().stateMachine.cancel(run);
            assertEquals(GoalState.CANCELLED, run.state());

            CliResult result = execute(engineReturning(run), new StrictMode(false),
                    "run", "Momentum", "--data", "memory://prices");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Cancelled."));
        }

        @Test
        @DisplayName("--data is required")
        void dataRequired() {
            assertEquals(2, execute("run", "Momentum").exitCode());
        }
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("prints every edge with its guard")
        void printsTable() {
            CliResult result = execute("transitions");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("locus=DESIGN"));
            assertTrue(result.output().contains("RETRIES_EXHAUSTED"));
            assertTrue(result.output().contains("CANCELLED"));
        }
    }

    @Nested
    @DisplayName("windows")
    class Windows {

        @Test
        @DisplayName("previews windows for a synthetic dataset")
        void synthetic() {
            CliResult result = execute("windows", "--rows", "30");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("3 rolling windows"));
            assertTrue(result.output().contains("Window 0: Train [0, 7) (7 rows) | Test [7, 10) (3 rows)"));
        }

        @Test
        @DisplayName("applies mode and window overrides")
        void overrides() {
            CliResult result = execute("windows", "--rows", "40", "--windows", "4", "--mode", "ANCHORED");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("4 anchored windows"));
            assertTrue(result.output().contains("Window 3: Train [0, 37)"));
        }

        @Test
        @DisplayName("too few rows exits 1")
        void insufficient() {
            assertEquals(1, execute("windows", "--rows", "10").exitCode());
        }

        @Test
        @DisplayName("--rows and --file are mutually exclusive")
        void exclusive() {
            assertEquals(2, execute("windows", "--rows", "30", "--file", "prices.csv").exitCode());
        }
    }
}
