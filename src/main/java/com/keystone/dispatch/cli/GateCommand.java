package com.keystone.dispatch.cli;

import com.keystone.core.engine.OperatorActions;
import com.keystone.core.gate.GateLedger;
import com.keystone.core.model.GateRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone gate &lt;workflow-id&gt; &lt;step-id&gt; [--rerun]
 */
@Command(name = "gate", mixinStandardHelpOptions = true, description = "Show or re-run a step's gate")
@Component
public class GateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    @Parameters(index = "1", description = "Step ID")
    private String stepId;

    @Option(names = "--rerun", description = "Re-validate the latest stored output of a failed or blocked step")
    private boolean rerun;

    private final GateLedger ledger;
    private final OperatorActions operator;

    public GateCommand(GateLedger ledger, OperatorActions operator) {
        this.ledger = ledger;
        this.operator = operator;
    }

    @Override
    public Integer call() {
        if (rerun) {
            GateRecord record = operator.rerunGate(workflowId, stepId);
            ConsoleOutput.gate(record);
            if (record.passed()) {
                ConsoleOutput.success(stepId + " completed");
                return ExitCodes.OK;
            }
            ConsoleOutput.error(stepId + " still fails its gate");
            return ExitCodes.FAILED;
        }
        var history = ledger.history(workflowId, stepId);
        if (history.isEmpty()) {
            ConsoleOutput.info("No gate attempts for " + stepId);
        }
        System.out.println("GATE " + workflowId + "/" + stepId);
        history.forEach(ConsoleOutput::gate);
        return ExitCodes.OK;
    }
}
