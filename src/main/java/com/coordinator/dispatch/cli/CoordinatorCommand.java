package com.coordinator.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: serve, status, health.
 */
@Command(
        name = "coordinator",
        mixinStandardHelpOptions = true,
        version = "multi-agent-coordinator 0.1.0",
        description = "Schedules prioritized, dependency-aware tasks onto a pool of worker agents",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CoordinatorCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
