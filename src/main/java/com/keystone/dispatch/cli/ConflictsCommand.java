package com.keystone.dispatch.cli;

import com.keystone.core.conflict.ConflictResolver;
import com.keystone.core.model.ConflictRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone conflicts &lt;workflow-id&gt; [--escalated]
 */
@Command(name = "conflicts", mixinStandardHelpOptions = true, description = "List detected conflicts")
@Component
public class ConflictsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    @Option(names = "--escalated", description = "Only conflicts awaiting operator review")
    private boolean escalatedOnly;

    private final ConflictResolver resolver;

    public ConflictsCommand(ConflictResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        var records = escalatedOnly ? resolver.escalated(workflowId) : resolver.list(workflowId);
        if (records.isEmpty()) {
            ConsoleOutput.info("No conflicts");
            return ExitCodes.OK;
        }
        for (ConflictRecord r : records) {
            System.out.printf("%s %-9s %-8s %s (agent %s)%n", r.conflictId(), r.status(), r.severity(),
                    r.subject(), r.resolutionAgent());
            r.conflictingOutputs().forEach(o -> System.out.println("    " + o));
            if (r.resolution() != null) {
                System.out.println("    -> " + (r.resolution().accepted()
                        ? "accepted " + r.resolution().acceptedOutputId() : "escalated")
                        + ": " + r.resolution().rationale());
            }
        }
        return ExitCodes.OK;
    }
}
