package com.keystone.dispatch.cli;

import com.keystone.core.model.Phase;
import com.keystone.core.model.Plan;
import com.keystone.core.plan.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone status [&lt;workflow-id&gt;]
 * <p>
 * Without an ID lists every workflow in the workspace; with one shows its plan phase by phase.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show workflow status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Workflow ID")
    private String workflowId;

    private final PlanStore planStore;

    public StatusCommand(PlanStore planStore) {
        this.planStore = planStore;
    }

    @Override
    public Integer call() {
        if (workflowId == null) {
            var ids = planStore.listWorkflows();
            if (ids.isEmpty()) {
                ConsoleOutput.info("No workflows in workspace");
            }
            for (String id : ids) {
                var index = planStore.loadIndex(id);
                System.out.printf("  %-12s %-10s %-14s %s%n", id, index.status(), index.task().type(),
                        truncate(index.task().description(), 50));
            }
            return ExitCodes.OK;
        }

        Plan plan = planStore.loadPlan(workflowId);
        System.out.println("WORKFLOW " + plan.workflowId() + " [" + plan.status() + "]");
        System.out.println("Task: " + plan.task().description());
        ConsoleOutput.info(String.format("Type: %s | Complexity: %s", plan.task().type(), plan.task().complexity()));
        for (Phase phase : plan.phases()) {
            System.out.println();
            System.out.println(phase.phaseId() + " " + phase.name() + " [" + phase.status() + "]");
            ConsoleOutput.stepTable(phase.steps());
        }
        return ExitCodes.OK;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
