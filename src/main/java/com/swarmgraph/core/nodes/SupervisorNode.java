package com.swarmgraph.core.nodes;

import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.state.AgentMessage;
import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reviews the outputs of its upstream specialists in one generation call and records a
 * {@link Verdict}.
 * <p>
 * The review text is also stored in {@code specialistResults} under the supervisor's id so
 * that nodes downstream of it can read it like any other upstream output. A review that
 * cannot be parsed yields {@link Verdict#unparsed}, which never asks for another pass.
 */
public class SupervisorNode implements SwarmNode {

    private static final Logger log = LoggerFactory.getLogger(SupervisorNode.class);

    private final NodeDescriptor descriptor;
    private final String systemPrompt;
    private final GenerationOptions options;

    public SupervisorNode(String id, String systemPrompt, GenerationOptions options, String... upstream) {
        this.descriptor = NodeDescriptor.of(id, NodeKind.SUPERVISOR, upstream);
        this.systemPrompt = systemPrompt;
        this.options = options != null ? options : GenerationOptions.defaults();
    }

    @Override
    public NodeDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Map<String, Object> execute(SwarmState state, RunContext context) {
        String review = reviewPrompt(PromptInputs.of(state, descriptor));
        String raw = context.generate(systemPrompt, review, options);
        log.debug("{} raw output: {}", id(), raw);

        var extraction = context.extract(raw);
        Verdict verdict;
        AgentMessage message;
        if (extraction.ok()) {
            verdict = toVerdict(extraction);
            message = AgentMessage.withPayload(id(), raw, extraction.payload());
        } else {
            log.warn("{} returned an unparseable verdict, finalizing without another pass", id());
            context.recordParseFailure(id());
            verdict = Verdict.unparsed(extraction.payload());
            message = AgentMessage.of(id(), raw);
        }
        log.info("Supervisor verdict: needsIteration={}, {} issue(s)", verdict.needsIteration(), verdict.issues().size());

        return Map.of(
                SwarmState.MERGED_VERDICT, verdict,
                SwarmState.AGENT_MESSAGES, List.of(message),
                SwarmState.SPECIALIST_RESULTS, Map.of(id(), raw)
        );
    }

    /**
     * Request followed by one {@code === ID ===} section per upstream node, in declaration order.
     */
    String reviewPrompt(PromptInputs inputs) {
        var sb = new StringBuilder();
        sb.append("Request: ").append(inputs.payload()).append("\n\n");
        for (String upstreamId : descriptor.upstream()) {
            String output = inputs.result(upstreamId);
            sb.append("=== ").append(upstreamId.toUpperCase(Locale.ROOT)).append(" ===\n")
                    .append(output.isBlank() ? "(no output)" : output)
                    .append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    static Verdict toVerdict(Extraction extraction) {
        boolean needsIteration = extraction.bool("needs_iteration", extraction.bool("needsIteration", false));
        return new Verdict(
                needsIteration,
                extraction.string("summary", ""),
                extraction.strings("issues"),
                extraction.payload(),
                true);
    }
}
