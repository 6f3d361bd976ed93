package com.swarmgraph.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.swarmgraph.core.engine.RunOptions;
import com.swarmgraph.core.engine.SwarmEngine;
import com.swarmgraph.core.engine.SwarmResult;
import com.swarmgraph.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: swarmgraph run &lt;swarm&gt; "&lt;payload&gt;"
 * <p>
 * Runs a swarm to completion and prints its report as JSON.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a swarm on a request")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Swarm name (see 'swarmgraph swarms')")
    private String swarm;

    @Parameters(index = "1", description = "Request passed to every node of the swarm")
    private String payload;

    @Option(names = {"--max-iterations", "-n"},
            description = "Maximum refinement passes (default: ${DEFAULT-VALUE})",
            defaultValue = "2")
    private int maxIterations;

    @Option(names = {"--verbose", "-v"}, description = "Print run events as they happen")
    private boolean verbose;

    private final SwarmEngine engine;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(SwarmEngine engine, EventBus eventBus, ObjectMapper objectMapper) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunOptions options;
        try {
            options = RunOptions.withMaxIterations(maxIterations);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Running swarm " + swarm + " (max " + maxIterations + " pass(es))...");
        EventBus.Subscription subscription = verbose ? eventBus.subscribeAll(ConsoleOutput::event) : null;
        long start = System.currentTimeMillis();
        SwarmResult result;
        try {
            result = engine.run(swarm, payload, options);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        result.rounds().forEach(ConsoleOutput::round);
        ConsoleOutput.success(String.format("Run %s complete: %d pass(es), %d message(s), provider %s, %s",
                result.runId(), result.iterations(), result.messages().size(), result.provider(),
                ConsoleOutput.formatDuration(System.currentTimeMillis() - start)));
        System.out.println();
        try {
            System.out.println(objectMapper.writeValueAsString(result.report()));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not render report: " + e.getOriginalMessage());
            return 1;
        }
        return 0;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root == e) {
            return e.getMessage();
        }
        return e.getMessage() + " (cause: " + root.getMessage() + ")";
    }
}
