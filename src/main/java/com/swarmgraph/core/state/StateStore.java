package com.swarmgraph.core.state;

import java.util.HashMap;
import java.util.Map;

/**
 * Holds the live state of a run and applies partial updates to it.
 * <p>
 * {@link #merge} is a pure function; the store itself serializes every
 * {@link #apply} so that each node's update lands as a single atomic step and a
 * reader never observes a half-merged state.
 */
public class StateStore {

    private SwarmState current;

    public StateStore(SwarmState initial) {
        this.current = initial;
    }

    public synchronized SwarmState snapshot() {
        return current;
    }

    public synchronized SwarmState apply(Map<String, Object> partial) {
        current = merge(current, partial);
        return current;
    }

    public synchronized SwarmState resetForNextPass() {
        current = resetForNextPass(current);
        return current;
    }

    /**
     * Folds {@code partial} into {@code current} field by field using each field's
     * declared {@link MergePolicy}.
     *
     * @throws IllegalArgumentException if {@code partial} names a field outside the schema
     * @throws IllegalStateException    if the update changes a {@link MergePolicy#FIXED} field
     *                                  or would move {@code iteration} backwards or past the
     *                                  ceiling the run started with
     */
    public static SwarmState merge(SwarmState current, Map<String, Object> partial) {
        if (partial == null || partial.isEmpty()) {
            return current;
        }
        var next = new HashMap<>(current.data());
        for (var entry : partial.entrySet()) {
            var field = SwarmState.SCHEMA.get(entry.getKey());
            if (field == null) {
                throw new IllegalArgumentException("Unknown state field: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                continue;
            }
            try {
                next.put(field.name(), field.policy().apply(next.get(field.name()), entry.getValue()));
            } catch (IllegalStateException e) {
                throw new IllegalStateException(field.name() + ": " + e.getMessage(), e);
            }
        }
        checkIteration(current, next);
        return new SwarmState(next);
    }

    /**
     * Keeps only the fields declared as retained across passes and restores every other
     * field to its schema default.
     */
    public static SwarmState resetForNextPass(SwarmState state) {
        var next = SwarmState.defaults();
        for (var field : SwarmState.FIELDS) {
            if (field.retainedAcrossPasses()) {
                state.value(field.name()).ifPresent(v -> next.put(field.name(), v));
            }
        }
        return new SwarmState(next);
    }

    private static void checkIteration(SwarmState before, Map<String, Object> after) {
        int previous = before.iteration();
        int next = after.get(SwarmState.ITERATION) instanceof Integer i ? i : previous;
        int max = before.maxIterations();
        if (next < previous) {
            throw new IllegalStateException("iteration may not decrease (" + previous + " -> " + next + ")");
        }
        if (next > max) {
            throw new IllegalStateException("iteration " + next + " exceeds maxIterations " + max);
        }
    }
}
