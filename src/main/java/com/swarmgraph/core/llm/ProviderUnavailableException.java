package com.swarmgraph.core.llm;

import com.swarmgraph.core.SwarmException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * No candidate backend answered its probe.
 */
public class ProviderUnavailableException extends SwarmException {

    private final Map<String, String> probeFailures;

    public ProviderUnavailableException(Map<String, String> probeFailures) {
        super(buildMessage(probeFailures));
        this.probeFailures = Map.copyOf(probeFailures);
    }

    public Map<String, String> getProbeFailures() {
        return probeFailures;
    }

    private static String buildMessage(Map<String, String> failures) {
        if (failures.isEmpty()) {
            return "No generation provider configured. Set an API key for at least one provider.";
        }
        return "No generation provider responded: " + failures.entrySet().stream()
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
    }
}
