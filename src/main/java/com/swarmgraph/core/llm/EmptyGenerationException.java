package com.swarmgraph.core.llm;

/**
 * Thrown when a backend answers successfully but with no content.
 */
public class EmptyGenerationException extends RuntimeException {
    public EmptyGenerationException(String message) {
        super(message);
    }
}
