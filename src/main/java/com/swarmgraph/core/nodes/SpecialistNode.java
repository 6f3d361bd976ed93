package com.swarmgraph.core.nodes;

import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.state.AgentMessage;
import com.swarmgraph.core.state.SwarmState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Issues one generation call built from its system prompt and the outputs of its declared
 * upstream nodes, and contributes the raw text to {@code specialistResults}.
 */
public class SpecialistNode implements SwarmNode {

    private static final Logger log = LoggerFactory.getLogger(SpecialistNode.class);

    private final NodeDescriptor descriptor;
    private final String systemPrompt;
    private final PromptTemplate template;
    private final GenerationOptions options;

    public SpecialistNode(String id, String systemPrompt, PromptTemplate template,
                          GenerationOptions options, String... upstream) {
        this.descriptor = NodeDescriptor.of(id, NodeKind.SPECIALIST, upstream);
        this.systemPrompt = systemPrompt;
        this.template = template;
        this.options = options != null ? options : GenerationOptions.defaults();
    }

    @Override
    public NodeDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Map<String, Object> execute(SwarmState state, RunContext context) {
        var inputs = PromptInputs.of(state, descriptor);
        String system = context.injector().inject(systemPrompt, state.payload());
        String user = template.render(inputs);

        String raw = context.generate(system, user, options);
        log.debug("{} raw output: {}", id(), raw);

        var extraction = context.extract(raw);
        AgentMessage message;
        if (extraction.ok()) {
            message = AgentMessage.withPayload(id(), raw, extraction.payload());
        } else {
            log.warn("{} returned unstructured output, downstream will use defaults", id());
            context.recordParseFailure(id());
            message = AgentMessage.of(id(), raw);
        }

        return Map.of(
                SwarmState.AGENT_MESSAGES, List.of(message),
                SwarmState.SPECIALIST_RESULTS, Map.of(id(), raw)
        );
    }

    public GenerationOptions options() {
        return options;
    }
}
