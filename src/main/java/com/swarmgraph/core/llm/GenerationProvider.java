package com.swarmgraph.core.llm;

/**
 * A named candidate backend.
 *
 * @param name    identifier reported back to callers (e.g. "anthropic")
 * @param model   model id the backend is configured with, informational
 * @param service the backend itself
 */
public record GenerationProvider(String name, String model, GenerationService service) {

    public static GenerationProvider of(String name, GenerationService service) {
        return new GenerationProvider(name, "", service);
    }
}
