package com.swarmgraph.core.nodes;

import com.swarmgraph.core.context.ContextInjector;
import com.swarmgraph.core.engine.CancellationToken;
import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.llm.GenerationProvider;
import com.swarmgraph.core.llm.ResultExtractor;
import com.swarmgraph.core.llm.RetryingCaller;
import com.swarmgraph.core.metrics.SwarmMetrics;

/**
 * Collaborators a node may use while executing, fixed for the whole run.
 *
 * @param swarm        name of the running swarm
 * @param provider     backend pinned at run start
 * @param retry        reliability wrapper every generation call goes through
 * @param extractor    tolerant parser for generated text
 * @param injector     context injector, already guarded against failure
 * @param cancellation the run's cancellation token
 * @param metrics      metrics sink, may be {@code null}
 */
public record RunContext(
    String swarm,
    GenerationProvider provider,
    RetryingCaller retry,
    ResultExtractor extractor,
    ContextInjector injector,
    CancellationToken cancellation,
    SwarmMetrics metrics
) {

    public RunContext {
        injector = injector == null ? ContextInjector.NONE : injector;
        cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
    }

    /**
     * Calls the pinned provider through the retry wrapper.
     *
     * @throws com.swarmgraph.core.llm.GenerationFailure once the retry budget is exhausted
     */
    public String generate(String systemPrompt, String userMessage, GenerationOptions options) {
        return retry.callWithRetry(
                () -> provider.service().generate(systemPrompt, userMessage, options),
                retry.getDefaultMaxAttempts(),
                cancellation);
    }

    public Extraction extract(String rawText) {
        return extractor.extract(rawText);
    }

    public void recordParseFailure(String agent) {
        if (metrics != null) {
            metrics.recordParseFailure(agent);
        }
    }
}
