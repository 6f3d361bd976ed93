package com.swarmgraph.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that never lets context injection fail a node: any exception from the
 * delegate is logged and the base prompt is returned unchanged.
 */
public class SafeContextInjector implements ContextInjector {

    private static final Logger log = LoggerFactory.getLogger(SafeContextInjector.class);

    private final ContextInjector delegate;

    public SafeContextInjector(ContextInjector delegate) {
        this.delegate = delegate;
    }

    @Override
    public String inject(String basePrompt, String query) {
        try {
            String result = delegate.inject(basePrompt, query);
            return result != null ? result : basePrompt;
        } catch (Exception e) {
            log.warn("Context injection failed, using base prompt: {}", e.getMessage());
            return basePrompt;
        }
    }
}
