package com.swarmgraph.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Supervisor's synthesized judgement over the specialist outputs of a pass.
 *
 * @param needsIteration whether the supervisor asks for another refinement pass
 * @param summary        short assessment text
 * @param issues         problems the supervisor flagged
 * @param payload        full extracted payload (or the raw capture when parsing failed)
 * @param parsed         whether the supervisor output was valid structured data
 */
public record Verdict(
    boolean needsIteration,
    String summary,
    List<String> issues,
    Map<String, Object> payload,
    boolean parsed
) {

    public Verdict {
        summary = summary == null ? "" : summary;
        issues = issues == null ? List.of() : List.copyOf(issues);
        // JSON payloads may carry null values, which Map.copyOf rejects
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Verdict used when the supervisor's output could not be parsed: never requests a loop.
     */
    public static Verdict unparsed(Map<String, Object> rawCapture) {
        return new Verdict(false, "", List.of(), rawCapture, false);
    }
}
