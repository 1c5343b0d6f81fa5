package com.keystone.dispatch.cli;

import com.keystone.core.classifier.TaskClassifier;
import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.Task;
import com.keystone.core.routing.AgentRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone classify "&lt;request&gt;"
 * <p>
 * Shows how a request would be classified and routed without creating a workflow.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify and route a request (dry run)")
@Component
public class ClassifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--file", "-f"}, description = "File the request touches (repeatable)")
    private List<String> files = new ArrayList<>();

    private final TaskClassifier classifier;
    private final AgentRouter router;

    public ClassifyCommand(TaskClassifier classifier, AgentRouter router) {
        this.classifier = classifier;
        this.router = router;
    }

    @Override
    public Integer call() {
        Task task = classifier.classify(request, files);
        ExecutionChain chain = router.route(task);

        System.out.println("TASK " + task.id());
        ConsoleOutput.info(String.format("Type: %s | Complexity: %s | Gates: planner=%s impact=%s review=%s",
                task.type(), task.complexity(), task.requiredGates().planner(),
                task.requiredGates().impactAnalysis(), task.requiredGates().review()));
        if (task.ambiguous()) {
            ConsoleOutput.warn("Ambiguous request; safe default applied");
        }
        task.reasons().forEach(r -> System.out.println("  - " + r));
        System.out.println();
        System.out.println("Primary:       " + chain.primaryRole());
        System.out.println("Supporting:    " + chain.supportingRoles());
        System.out.println("Cross-cutting: " + chain.crossCuttingRoles());
        System.out.println("Review:        " + chain.reviewRoles());
        System.out.println("Approval:      " + chain.approvalRoles());
        return ExitCodes.OK;
    }
}
