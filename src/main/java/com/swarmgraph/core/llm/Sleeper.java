package com.swarmgraph.core.llm;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts; swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
