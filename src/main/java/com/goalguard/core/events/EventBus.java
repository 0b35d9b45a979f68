package com.goalguard.core.events;

import com.goalguard.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for goal run events.
 * <p>
 * Listeners either follow one run or every run. A run reaches a terminal state exactly once,
 * so its listeners are released after {@link GoalGuardEvent#RUN_TERMINAL} has been delivered.
 * Delivery happens on the publishing thread with the run id in the MDC; a listener that
 * throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<GoalGuardEvent>>> byRun = new ConcurrentHashMap<>();
    private final List<Consumer<GoalGuardEvent>> everyRun = new CopyOnWriteArrayList<>();

    public void publish(GoalGuardEvent event) {
        log.debug("{} {} {}", event.runId(), event.eventType(), event.detail() != null ? event.detail() : "");
        String previousRunId = MDC.get(MdcContext.RUN_ID);
        MdcContext.setRun(event.runId());
        try {
            List<Consumer<GoalGuardEvent>> runListeners = byRun.get(event.runId());
            if (runListeners != null) {
                runListeners.forEach(listener -> deliver(listener, event));
            }
            everyRun.forEach(listener -> deliver(listener, event));
        } finally {
            MdcContext.restoreRun(previousRunId);
        }
        if (GoalGuardEvent.RUN_TERMINAL.equals(event.eventType())) {
            List<Consumer<GoalGuardEvent>> released = byRun.remove(event.runId());
            if (released != null) {
                log.debug("Released {} listener(s) of finished run {}", released.size(), event.runId());
            }
        }
    }

    /**
     * Follows a single run until it ends or the returned handle is used.
     *
     * @param runId    the run to follow
     * @param listener callback invoked for each of the run's events
     */
    public Subscription subscribe(String runId, Consumer<GoalGuardEvent> listener) {
        byRun.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byRun.computeIfPresent(runId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<GoalGuardEvent> listener) {
        everyRun.add(listener);
        return () -> everyRun.remove(listener);
    }

    /** Number of listeners still following the given run. */
    public int listenerCount(String runId) {
        List<Consumer<GoalGuardEvent>> listeners = byRun.get(runId);
        return listeners == null ? 0 : listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<GoalGuardEvent> listener, GoalGuardEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
