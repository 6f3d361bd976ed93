package com.swarmgraph.dispatch.cli;

import com.swarmgraph.core.llm.ProviderRegistry;
import com.swarmgraph.core.llm.ProviderResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: swarmgraph providers
 * <p>
 * Probes every configured provider in priority order and reports which would be pinned.
 */
@Command(name = "providers", mixinStandardHelpOptions = true, description = "Probe configured generation providers")
@Component
public class ProvidersCommand implements Callable<Integer> {

    private final ProviderRegistry registry;
    private final ProviderResolver resolver;

    public ProvidersCommand(ProviderRegistry registry, ProviderResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var candidates = registry.candidates();
        if (candidates.isEmpty()) {
            ConsoleOutput.error("No provider has an API key configured");
            return 1;
        }

        var results = resolver.probeAll(candidates);
        String pinned = null;
        for (var result : results) {
            String label = result.provider() + ": " + result.detail()
                    + " (" + ConsoleOutput.formatDuration(result.latencyMs()) + ")";
            if (result.reachable()) {
                ConsoleOutput.success(label);
                if (pinned == null) {
                    pinned = result.provider();
                }
            } else {
                ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (pinned == null) {
            ConsoleOutput.error("No provider is reachable; runs will fail");
            return 1;
        }
        ConsoleOutput.success("Runs will use " + pinned);
        return 0;
    }
}
