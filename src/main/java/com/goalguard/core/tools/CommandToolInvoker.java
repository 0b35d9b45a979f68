package com.goalguard.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goalguard.core.model.BacktestStatsRef;
import com.goalguard.core.model.CommittedId;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.LintReport;
import com.goalguard.core.model.RiskPreference;
import com.goalguard.core.model.StrategyArtifactRef;
import com.goalguard.core.model.StressReport;
import com.goalguard.core.model.TestReport;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.model.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one configured external command per tool kind.
 * <p>
 * The request is written to the command's stdin as a JSON object
 * {@code {"tool": "<kind>", "arguments": {...}}}; the command must print the result as a single
 * JSON document on stdout and exit with status 0. Any other exit status, unparseable output or
 * missing command configuration is reported as a {@link ToolInvocationException}.
 */
public class CommandToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(CommandToolInvoker.class);

    private static final int MAX_DIAGNOSTIC_CHARS = 500;

    private final Map<ToolKind, List<String>> commands;
    private final ObjectMapper objectMapper;

    public CommandToolInvoker(Map<ToolKind, List<String>> commands, ObjectMapper objectMapper) {
        this.commands = new EnumMap<>(ToolKind.class);
        if (commands != null) {
            commands.forEach((kind, command) -> this.commands.put(kind, List.copyOf(command)));
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public StrategyArtifactRef generateStrategy(String goal, RiskPreference riskPreference,
                                                Map<String, Double> parameters) throws ToolInvocationException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("goal", goal);
        args.put("riskPreference", riskPreference.name());
        args.put("parameters", parameters);
        return execute(ToolKind.GENERATE_STRATEGY, args, StrategyArtifactRef.class);
    }

    @Override
    public BacktestStatsRef backtest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("strategy", strategy);
        args.put("data", dataRef);
        return execute(ToolKind.BACKTEST, args, BacktestStatsRef.class);
    }

    @Override
    public TestReport runTests(StrategyArtifactRef strategy) throws ToolInvocationException {
        return execute(ToolKind.RUN_TESTS, Map.of("strategy", strategy), TestReport.class);
    }

    @Override
    public VerificationReport crvVerify(BacktestStatsRef backtestStats, double maxDrawdownLimit)
            throws ToolInvocationException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("backtest", backtestStats);
        args.put("maxDrawdownLimit", maxDrawdownLimit);
        return execute(ToolKind.CRV_VERIFY, args, VerificationReport.class);
    }

    @Override
    public CommittedId commit(StrategyArtifactRef strategy) throws ToolInvocationException {
        return execute(ToolKind.COMMIT, Map.of("strategy", strategy), CommittedId.class);
    }

    @Override
    public LintReport lint(StrategyArtifactRef strategy) throws ToolInvocationException {
        return execute(ToolKind.LINT, Map.of("strategy", strategy), LintReport.class);
    }

    @Override
    public StressReport stressTest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("strategy", strategy);
        args.put("data", dataRef);
        return execute(ToolKind.STRESS_TEST, args, StressReport.class);
    }

    <T> T execute(ToolKind kind, Map<String, Object> arguments, Class<T> resultType) throws ToolInvocationException {
        List<String> command = commands.get(kind);
        if (command == null || command.isEmpty()) {
            throw new ToolInvocationException(kind, "no command configured (goalguard.tools.commands." + kind.configKey() + ")");
        }

        byte[] request;
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("tool", kind.key());
            envelope.put("arguments", arguments);
            request = objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException(kind, "could not serialize request: " + e.getOriginalMessage(), e);
        }

        log.debug("Running tool command for {}: {}", kind.key(), command);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            throw new ToolInvocationException(kind, "could not start " + command.get(0) + ": " + e.getMessage(), e);
        }

        try {
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(request);
            }
            // waitFor is interruptible, so a caller enforcing a deadline gets control back here
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new ToolInvocationException(kind, "exited with status %d: %s"
                        .formatted(exitCode, abbreviate(stderr.join())));
            }
            return objectMapper.readValue(stdout.join(), resultType);
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException(kind, "unparseable output: " + e.getOriginalMessage(), e);
        } catch (IOException | UncheckedIOException e) {
            throw new ToolInvocationException(kind, "I/O failure talking to tool: " + e.getMessage(), e);
        } catch (CompletionException e) {
            throw new ToolInvocationException(kind, "I/O failure talking to tool: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(kind, "interrupted", e);
        } finally {
            if (process.isAlive()) {
                terminate(kind, process);
            }
        }
    }

    /** Kills the tool process together with anything it spawned. */
    static void terminate(ToolKind kind, Process process) {
        log.warn("Killing {} tool process {} and its descendants", kind.key(), process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String abbreviate(String text) {
        String trimmed = text == null ? "" : text.strip();
        return trimmed.length() <= MAX_DIAGNOSTIC_CHARS
                ? trimmed
                : trimmed.substring(trimmed.length() - MAX_DIAGNOSTIC_CHARS);
    }
}
