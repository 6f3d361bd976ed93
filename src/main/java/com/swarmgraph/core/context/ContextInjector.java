package com.swarmgraph.core.context;

/**
 * Augments a system prompt with context relevant to the run's query.
 */
@FunctionalInterface
public interface ContextInjector {

    ContextInjector NONE = (basePrompt, query) -> basePrompt;

    String inject(String basePrompt, String query);
}
