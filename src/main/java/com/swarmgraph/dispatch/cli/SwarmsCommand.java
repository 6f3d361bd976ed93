package com.swarmgraph.dispatch.cli;

import com.swarmgraph.core.engine.SwarmRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.stream.Collectors;

/**
 * CLI command: swarmgraph swarms
 */
@Command(name = "swarms", mixinStandardHelpOptions = true, description = "List available swarms")
@Component
public class SwarmsCommand implements Runnable {

    private final SwarmRegistry registry;

    public SwarmsCommand(SwarmRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (var swarm : registry.list()) {
            ConsoleOutput.info(swarm.name() + " - " + swarm.description());
            var rounds = swarm.graph().rounds();
            for (int i = 0; i < rounds.size(); i++) {
                System.out.println("    round " + (i + 1) + ": "
                        + rounds.get(i).stream().collect(Collectors.joining(", ")));
            }
        }
    }
}
