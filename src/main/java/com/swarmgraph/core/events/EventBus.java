package com.swarmgraph.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for run progress events.
 * <p>
 * Listeners either follow one run or every run. A run's listeners are released as soon as
 * its terminal event ({@code run.completed} or {@code run.failed}) has been delivered, so a
 * long-lived process does not accumulate listeners for finished runs. A listener that throws
 * is logged and skipped; the run that published the event never sees the failure.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, CopyOnWriteArrayList<Consumer<SwarmEvent>>> runListeners = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<SwarmEvent>> allRunsListeners = new CopyOnWriteArrayList<>();

    public void publish(SwarmEvent event) {
        log.debug("{} [{}]", event.eventType(), event.runId());

        var forRun = event.terminal() ? runListeners.remove(event.runId()) : runListeners.get(event.runId());
        if (forRun != null) {
            forRun.forEach(listener -> deliver(listener, event));
            if (event.terminal()) {
                log.debug("Released {} listener(s) for finished run {}", forRun.size(), event.runId());
            }
        }
        allRunsListeners.forEach(listener -> deliver(listener, event));
    }

    /**
     * Follows a single run until its terminal event.
     *
     * @return a handle that stops delivery early
     */
    public Subscription subscribe(String runId, Consumer<SwarmEvent> listener) {
        runListeners.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> runListeners.computeIfPresent(runId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Follows every run; stays registered until unsubscribed. */
    public Subscription subscribeAll(Consumer<SwarmEvent> listener) {
        allRunsListeners.add(listener);
        return () -> allRunsListeners.remove(listener);
    }

    /** Number of runs that currently have at least one dedicated listener. */
    public int followedRuns() {
        return runListeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<SwarmEvent> listener, SwarmEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
