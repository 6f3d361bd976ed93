package com.swarmgraph.core.llm;

/**
 * A backend that turns a system prompt and a user message into generated text.
 * <p>
 * Implementations raise on transport or quota errors; callers never invoke this
 * directly but go through {@link RetryingCaller}.
 */
@FunctionalInterface
public interface GenerationService {

    String generate(String systemPrompt, String userMessage, GenerationOptions options);
}
