package com.swarmgraph.core.state;

import java.util.function.Supplier;

/**
 * Declaration of one field of the swarm state schema.
 *
 * @param name                 key under which the field is stored
 * @param policy               merge policy, fixed for the lifetime of the schema
 * @param defaultValue         supplier of the initial value, or {@code null} when the field starts absent
 * @param retainedAcrossPasses whether the field survives the reset between refinement passes
 */
public record StateField(
    String name,
    MergePolicy policy,
    Supplier<Object> defaultValue,
    boolean retainedAcrossPasses
) {

    public static StateField of(String name, MergePolicy policy, Supplier<Object> defaultValue) {
        return new StateField(name, policy, defaultValue, false);
    }

    public static StateField retained(String name, MergePolicy policy, Supplier<Object> defaultValue) {
        return new StateField(name, policy, defaultValue, true);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
