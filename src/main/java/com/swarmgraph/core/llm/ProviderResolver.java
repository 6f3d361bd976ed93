package com.swarmgraph.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Picks the backend a run will use by probing candidates in priority order.
 * <p>
 * The first candidate whose probe succeeds is returned and later candidates are never
 * contacted. Probes are single attempts; retrying is left to the calls made once a
 * provider is pinned.
 */
@Service
public class ProviderResolver {

    private static final Logger log = LoggerFactory.getLogger(ProviderResolver.class);

    static final String PROBE_SYSTEM_PROMPT = "Reply with OK";
    static final String PROBE_USER_MESSAGE = "test";

    /**
     * @throws ProviderUnavailableException if the list is empty or every probe fails
     */
    public GenerationProvider resolve(List<GenerationProvider> candidates) {
        var failures = new LinkedHashMap<String, String>();
        for (var candidate : candidates) {
            try {
                probe(candidate);
                log.info("Resolved generation provider: {}", candidate.name());
                return candidate;
            } catch (Exception e) {
                log.warn("Provider {} failed its probe: {}", candidate.name(), e.getMessage());
                failures.put(candidate.name(), describe(e));
            }
        }
        throw new ProviderUnavailableException(failures);
    }

    /**
     * Probes every candidate, for health reporting. Never throws.
     */
    public List<ProbeResult> probeAll(List<GenerationProvider> candidates) {
        var results = new ArrayList<ProbeResult>();
        for (var candidate : candidates) {
            long start = System.currentTimeMillis();
            try {
                probe(candidate);
                results.add(new ProbeResult(candidate.name(), true,
                        System.currentTimeMillis() - start, "OK"));
            } catch (Exception e) {
                log.warn("Provider {} failed its probe: {}", candidate.name(), e.getMessage());
                results.add(new ProbeResult(candidate.name(), false,
                        System.currentTimeMillis() - start, describe(e)));
            }
        }
        return results;
    }

    private void probe(GenerationProvider candidate) {
        candidate.service().generate(PROBE_SYSTEM_PROMPT, PROBE_USER_MESSAGE, GenerationOptions.probe());
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
