package com.swarmgraph.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How a partial update to a single state field is combined with the current value.
 * <p>
 * Every policy is pure: the current value is never mutated and a fresh immutable
 * value is returned.
 */
public enum MergePolicy {

    /** Last write wins. */
    REPLACE {
        @Override
        public Object apply(Object current, Object update) {
            return update;
        }
    },

    /**
     * Set once when the run starts. Re-writing the same value is accepted; any other
     * value is rejected.
     */
    FIXED {
        @Override
        public Object apply(Object current, Object update) {
            if (current != null && !current.equals(update)) {
                throw new IllegalStateException("value is fixed for the run (" + current + " -> " + update + ")");
            }
            return update;
        }
    },

    /** Concatenates the update list onto the current sequence. */
    APPEND {
        @Override
        public Object apply(Object current, Object update) {
            if (!(update instanceof List<?> addition)) {
                throw new IllegalArgumentException("APPEND expects a list update but got "
                        + (update == null ? "null" : update.getClass().getSimpleName()));
            }
            var merged = new ArrayList<Object>();
            if (current instanceof List<?> existing) {
                merged.addAll(existing);
            }
            merged.addAll(addition);
            return Collections.unmodifiableList(merged);
        }
    },

    /** Merges two mappings; the right-hand side wins on duplicate keys. */
    MAP_UNION {
        @Override
        public Object apply(Object current, Object update) {
            if (!(update instanceof Map<?, ?> addition)) {
                throw new IllegalArgumentException("MAP_UNION expects a map update but got "
                        + (update == null ? "null" : update.getClass().getSimpleName()));
            }
            var merged = new LinkedHashMap<Object, Object>();
            if (current instanceof Map<?, ?> existing) {
                merged.putAll(existing);
            }
            merged.putAll(addition);
            return Collections.unmodifiableMap(merged);
        }
    };

    public abstract Object apply(Object current, Object update);
}
