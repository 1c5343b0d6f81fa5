package com.keystone.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Keystone.
 */
@Command(
        name = "keystone",
        mixinStandardHelpOptions = true,
        version = "Keystone 0.1.0",
        description = "Workflow orchestration core: classify, route, plan, gate and hand off",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                ClassifyCommand.class,
                StatusCommand.class,
                GateCommand.class,
                ConflictsCommand.class,
                ResolveCommand.class,
                VerifyCommand.class,
                CancelCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KeystoneCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
