package com.swarmgraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "swarmgraph",
        mixinStandardHelpOptions = true,
        version = "SwarmGraph 0.1.0",
        description = "Runs multi-agent specialist swarms against a generation provider",
        subcommands = {
                RunCommand.class,
                SwarmsCommand.class,
                ProvidersCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwarmGraphCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
