package com.keystone.dispatch.cli;

import com.keystone.core.engine.OperatorActions;
import com.keystone.core.model.ConflictRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone resolve &lt;workflow-id&gt; &lt;conflict-id&gt; &lt;output-id&gt;
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve an escalated conflict")
@Component
public class ResolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    @Parameters(index = "1", description = "Conflict ID")
    private String conflictId;

    @Parameters(index = "2", description = "Accepted output ID (subject@stepId)")
    private String outputId;

    @Option(names = {"--rationale", "-r"}, defaultValue = "operator decision", description = "Recorded rationale")
    private String rationale;

    private final OperatorActions operator;

    public ResolveCommand(OperatorActions operator) {
        this.operator = operator;
    }

    @Override
    public Integer call() {
        ConflictRecord record = operator.resolveConflict(workflowId, conflictId, outputId, rationale);
        ConsoleOutput.success("Conflict " + record.conflictId() + " resolved: accepted " + outputId);
        ConsoleOutput.info("Continue with: keystone resume " + workflowId);
        return ExitCodes.OK;
    }
}
