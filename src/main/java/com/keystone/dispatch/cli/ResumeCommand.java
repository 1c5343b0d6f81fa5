package com.keystone.dispatch.cli;

import com.keystone.core.engine.WorkflowEngine;
import com.keystone.core.model.WorkflowOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone resume &lt;workflow-id&gt;
 */
@Command(name = "resume", mixinStandardHelpOptions = true,
        description = "Continue a workflow from its latest handoff package")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    private final WorkflowEngine engine;

    public ResumeCommand(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming " + workflowId + "...");
        WorkflowOutcome outcome = engine.resume(workflowId);
        ConsoleOutput.outcome(outcome);
        return ExitCodes.of(outcome);
    }
}
