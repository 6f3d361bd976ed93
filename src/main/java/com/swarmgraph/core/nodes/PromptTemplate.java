package com.swarmgraph.core.nodes;

/**
 * Renders a node's user message from the inputs it declared.
 */
@FunctionalInterface
public interface PromptTemplate {

    String render(PromptInputs inputs);

    /** Template that sends the run payload as the user message. */
    static PromptTemplate payloadOnly() {
        return PromptInputs::payload;
    }
}
