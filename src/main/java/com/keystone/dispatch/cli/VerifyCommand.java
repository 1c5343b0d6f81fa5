package com.keystone.dispatch.cli;

import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.model.Discrepancy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone verify &lt;workflow-id&gt;
 * <p>
 * Reconciles the artifact registry with its content store, repairing what it can.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Verify and repair the artifact registry")
@Component
public class VerifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    private final ArtifactRegistry registry;

    public VerifyCommand(ArtifactRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        List<Discrepancy> discrepancies = registry.verifyIntegrity(workflowId);
        if (discrepancies.isEmpty()) {
            ConsoleOutput.success("Registry of " + workflowId + " is consistent ("
                    + registry.list(workflowId).size() + " artifacts)");
            return ExitCodes.OK;
        }
        ConsoleOutput.warn(discrepancies.size() + " discrepancies found and repaired:");
        for (Discrepancy d : discrepancies) {
            System.out.printf("  %-24s %s@v%d: %s%n", d.type(), d.artifactName(), d.version(), d.detail());
        }
        return ExitCodes.FAILED;
    }
}
