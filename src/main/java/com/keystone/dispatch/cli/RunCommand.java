package com.keystone.dispatch.cli;

import com.keystone.core.engine.WorkflowEngine;
import com.keystone.core.model.WorkflowOutcome;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.plan.PlanBlueprint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone run "&lt;request&gt;"
 * <p>
 * Classifies and routes the request, persists its plan and executes it until it completes,
 * blocks, fails or hands off.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start a workflow for a request")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--file", "-f"}, description = "File the request touches (repeatable)")
    private List<String> files = new ArrayList<>();

    @Option(names = {"--blueprint", "-b"}, description = "JSON plan blueprint to use instead of the routed chain")
    private Path blueprint;

    private final WorkflowEngine engine;
    private final JsonDocumentStore documents;

    public RunCommand(WorkflowEngine engine, JsonDocumentStore documents) {
        this.engine = engine;
        this.documents = documents;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        PlanBlueprint layout = null;
        if (blueprint != null) {
            layout = documents.read(blueprint, PlanBlueprint.class)
                    .orElseThrow(() -> new IllegalArgumentException("Blueprint not found: " + blueprint));
            ConsoleOutput.info("Using blueprint " + blueprint + " (" + layout.stepCount() + " steps)");
        }
        ConsoleOutput.info("Classifying request...");
        WorkflowOutcome outcome = engine.start(request, files, layout);
        ConsoleOutput.outcome(outcome);
        return ExitCodes.of(outcome);
    }
}
