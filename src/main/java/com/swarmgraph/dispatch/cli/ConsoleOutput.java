package com.swarmgraph.dispatch.cli;

import com.swarmgraph.core.events.SwarmEvent;
import com.swarmgraph.core.scheduler.RoundRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWARMGRAPH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWARM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void round(RoundRecord record) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [PASS " + record.pass() + " ROUND " + record.round() + "]|@ "
                        + String.join(", ", record.nodeIds())));
    }

    public static void event(SwarmEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "provider.resolved" -> "@|fg(magenta) [PROVIDER]|@";
            case "round.started", "pass.completed" -> "@|bold,fg(yellow) [ROUND]|@";
            case "node.completed" -> "@|fg(blue) [NODE " + event.nodeId() + "]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.payload()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
