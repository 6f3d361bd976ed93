package com.swarmgraph.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the phase of one run and rejects transitions the run state machine does not allow.
 * <pre>
 * INIT -> RESOLVING_PROVIDER -> RUNNING -> DECISION -> RUNNING | COMPLETE
 * any non-terminal phase -> FAILED
 * </pre>
 */
public class RunLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RunLifecycle.class);

    private static final Map<RunPhase, Set<RunPhase>> ALLOWED = Map.of(
            RunPhase.INIT, EnumSet.of(RunPhase.RESOLVING_PROVIDER, RunPhase.FAILED),
            RunPhase.RESOLVING_PROVIDER, EnumSet.of(RunPhase.RUNNING, RunPhase.FAILED),
            RunPhase.RUNNING, EnumSet.of(RunPhase.DECISION, RunPhase.FAILED),
            RunPhase.DECISION, EnumSet.of(RunPhase.RUNNING, RunPhase.COMPLETE, RunPhase.FAILED),
            RunPhase.COMPLETE, EnumSet.noneOf(RunPhase.class),
            RunPhase.FAILED, EnumSet.noneOf(RunPhase.class)
    );

    private final List<RunPhase> history = new ArrayList<>(List.of(RunPhase.INIT));
    private RunPhase current = RunPhase.INIT;

    public synchronized void transitionTo(RunPhase next) {
        if (!ALLOWED.get(current).contains(next)) {
            throw new IllegalStateException("Illegal run transition " + current + " -> " + next);
        }
        log.debug("Run phase {} -> {}", current, next);
        current = next;
        history.add(next);
    }

    /**
     * Moves to {@link RunPhase#FAILED} unless the run already reached a terminal phase.
     */
    public synchronized void failIfActive() {
        if (!current.isTerminal()) {
            transitionTo(RunPhase.FAILED);
        }
    }

    public synchronized RunPhase current() {
        return current;
    }

    public synchronized List<RunPhase> history() {
        return List.copyOf(history);
    }
}
