package com.swarmgraph.core.state;

import org.bsc.langgraph4j.state.AgentState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Shared state of one swarm run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors for every field of the
 * fixed {@link #SCHEMA}. Instances are immutable snapshots: nodes read them and return
 * partial updates, which {@link StateStore} folds into the next snapshot.
 */
public class SwarmState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String PAYLOAD = "payload";
    public static final String SPECIALIST_RESULTS = "specialistResults";
    public static final String AGENT_MESSAGES = "agentMessages";
    public static final String MERGED_VERDICT = "mergedVerdict";
    public static final String REPORT = "report";
    public static final String ITERATION = "iteration";
    public static final String MAX_ITERATIONS = "maxIterations";
    public static final String STATUS = "status";

    public static final List<StateField> FIELDS = List.of(
        // ── Run context (kept between passes) ───────────────────────
        StateField.retained(RUN_ID,          MergePolicy.FIXED,     () -> ""),
        StateField.retained(PAYLOAD,         MergePolicy.FIXED,     () -> ""),
        StateField.retained(ITERATION,       MergePolicy.REPLACE,   () -> 0),
        StateField.retained(MAX_ITERATIONS,  MergePolicy.FIXED,     () -> 2),
        StateField.retained(AGENT_MESSAGES,  MergePolicy.APPEND,    List::of),

        // ── Per-pass fields ─────────────────────────────────────────
        StateField.of(SPECIALIST_RESULTS,    MergePolicy.MAP_UNION, Map::of),
        StateField.of(MERGED_VERDICT,        MergePolicy.REPLACE,   null),
        StateField.of(REPORT,                MergePolicy.REPLACE,   null),
        StateField.of(STATUS,                MergePolicy.REPLACE,   () -> SwarmStatus.RUNNING.name())
    );

    public static final Map<String, StateField> SCHEMA = FIELDS.stream()
            .collect(Collectors.toUnmodifiableMap(StateField::name, Function.identity()));

    public SwarmState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Builds the state a run starts from: schema defaults plus the caller's input.
     */
    public static SwarmState initial(String runId, String payload, int maxIterations) {
        var data = defaults();
        data.put(RUN_ID, runId);
        data.put(PAYLOAD, payload);
        data.put(MAX_ITERATIONS, maxIterations);
        return new SwarmState(data);
    }

    static Map<String, Object> defaults() {
        var data = new HashMap<String, Object>();
        for (var field : FIELDS) {
            if (field.hasDefault()) {
                data.put(field.name(), field.defaultValue().get());
            }
        }
        return data;
    }

    // ── Accessors ───────────────────────────────────────────────────

    public String runId() {
        return this.<String>value(RUN_ID).orElse("");
    }

    public String payload() {
        return this.<String>value(PAYLOAD).orElse("");
    }

    public Map<String, String> specialistResults() {
        return this.<Map<String, String>>value(SPECIALIST_RESULTS).orElse(Map.of());
    }

    public Optional<String> specialistResult(String nodeId) {
        return Optional.ofNullable(specialistResults().get(nodeId));
    }

    public List<AgentMessage> agentMessages() {
        return this.<List<AgentMessage>>value(AGENT_MESSAGES).orElse(List.of());
    }

    public Optional<Verdict> mergedVerdict() {
        return value(MERGED_VERDICT);
    }

    public Optional<Object> report() {
        return value(REPORT);
    }

    public int iteration() {
        return this.<Integer>value(ITERATION).orElse(0);
    }

    public int maxIterations() {
        return this.<Integer>value(MAX_ITERATIONS).orElse(2);
    }

    public SwarmStatus status() {
        String raw = this.<String>value(STATUS).orElse(SwarmStatus.RUNNING.name());
        return SwarmStatus.valueOf(raw);
    }
}
