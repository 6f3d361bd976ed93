package com.swarmgraph.core;

/**
 * Base type for every failure a swarm run can surface to its caller.
 */
public class SwarmException extends RuntimeException {

    public SwarmException(String message) {
        super(message);
    }

    public SwarmException(String message, Throwable cause) {
        super(message, cause);
    }
}
