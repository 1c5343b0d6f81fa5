package com.keystone.dispatch.cli;

import com.keystone.core.plan.InvalidPlanException;
import com.keystone.core.plan.PlanNotFoundException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final KeystoneCommand keystoneCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(KeystoneCommand keystoneCommand, IFactory factory) {
        this.keystoneCommand = keystoneCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(keystoneCommand, factory).execute(args);
    }

    /**
     * Command line with the CLI's exit-code mapping for invalid input.
     */
    static CommandLine commandLine(Object command, IFactory factory) {
        var cl = factory != null ? new CommandLine(command, factory) : new CommandLine(command);
        cl.setExecutionExceptionHandler((ex, line, parseResult) -> {
            ConsoleOutput.error(ex.getMessage());
            return ex instanceof IllegalArgumentException || ex instanceof IllegalStateException
                    || ex instanceof InvalidPlanException || ex instanceof PlanNotFoundException
                    ? ExitCodes.INVALID : ExitCodes.FAILED;
        });
        return cl;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
