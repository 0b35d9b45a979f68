package com.goalguard.core.tools;

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

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds every delegated tool call by a fixed timeout. A call that does not return in time
 * is interrupted and surfaces as a timed-out {@link ToolInvocationException}.
 */
public class TimeBoundToolInvoker implements ToolInvoker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundToolInvoker.class);

    private final ToolInvoker delegate;
    private final long timeoutMs;
    private final ExecutorService executor;

    public TimeBoundToolInvoker(ToolInvoker delegate, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.delegate = delegate;
        this.timeoutMs = timeout.toMillis();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "goalguard-tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public StrategyArtifactRef generateStrategy(String goal, RiskPreference riskPreference,
                                                Map<String, Double> parameters) throws ToolInvocationException {
        return bounded(ToolKind.GENERATE_STRATEGY, () -> delegate.generateStrategy(goal, riskPreference, parameters));
    }

    @Override
    public BacktestStatsRef backtest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException {
        return bounded(ToolKind.BACKTEST, () -> delegate.backtest(strategy, dataRef));
    }

    @Override
    public TestReport runTests(StrategyArtifactRef strategy) throws ToolInvocationException {
        return bounded(ToolKind.RUN_TESTS, () -> delegate.runTests(strategy));
    }

    @Override
    public VerificationReport crvVerify(BacktestStatsRef backtestStats, double maxDrawdownLimit)
            throws ToolInvocationException {
        return bounded(ToolKind.CRV_VERIFY, () -> delegate.crvVerify(backtestStats, maxDrawdownLimit));
    }

    @Override
    public CommittedId commit(StrategyArtifactRef strategy) throws ToolInvocationException {
        return bounded(ToolKind.COMMIT, () -> delegate.commit(strategy));
    }

    @Override
    public LintReport lint(StrategyArtifactRef strategy) throws ToolInvocationException {
        return bounded(ToolKind.LINT, () -> delegate.lint(strategy));
    }

    @Override
    public StressReport stressTest(StrategyArtifactRef strategy, DataRef dataRef) throws ToolInvocationException {
        return bounded(ToolKind.STRESS_TEST, () -> delegate.stressTest(strategy, dataRef));
    }

    private <T> T bounded(ToolKind kind, ToolCall<T> call) throws ToolInvocationException {
        Callable<T> task = call::call;
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool {} exceeded timeout of {} ms", kind.key(), timeoutMs);
            throw ToolInvocationException.timeout(kind, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ToolInvocationException tie) {
                throw tie;
            }
            throw new ToolInvocationException(kind, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(kind, "interrupted while waiting for tool", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
