package com.keystone.dispatch.cli;

import com.keystone.core.engine.OperatorActions;
import com.keystone.core.model.StepStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone cancel &lt;workflow-id&gt; &lt;step-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a step")
@Component
public class CancelCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    @Parameters(index = "1", description = "Step ID")
    private String stepId;

    @Option(names = {"--reason", "-r"}, description = "Reason recorded with the cancellation")
    private String reason;

    private final OperatorActions operator;

    public CancelCommand(OperatorActions operator) {
        this.operator = operator;
    }

    @Override
    public Integer call() {
        StepStatus status = operator.cancelStep(workflowId, stepId, reason);
        if (status == StepStatus.IN_PROGRESS) {
            ConsoleOutput.info(stepId + " is running; it will stop before its next attempt");
        } else {
            ConsoleOutput.success(stepId + " cancelled");
        }
        return ExitCodes.OK;
    }
}
