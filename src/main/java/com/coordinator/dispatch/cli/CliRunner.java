package com.coordinator.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CoordinatorCommand coordinatorCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CoordinatorCommand coordinatorCommand, IFactory factory) {
        this.coordinatorCommand = coordinatorCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // The embedded web server keeps the JVM alive in serve mode; picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(coordinatorCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
