package com.swarmgraph.core.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SafeContextInjectorTest {

    @Test
    @DisplayName("a failing injector falls back to the base prompt")
    void failureFallsBack() {
        var safe = new SafeContextInjector((base, query) -> {
            throw new IllegalStateException("store offline");
        });

        assertEquals("base", safe.inject("base", "query"));
    }

    @Test
    @DisplayName("a null result falls back to the base prompt")
    void nullFallsBack() {
        var safe = new SafeContextInjector((base, query) -> null);
        assertEquals("base", safe.inject("base", "query"));
    }

    @Test
    @DisplayName("a successful injection passes through")
    void passesThrough() {
        var safe = new SafeContextInjector((base, query) -> base + " + " + query);
        assertEquals("base + query", safe.inject("base", "query"));
    }
}
