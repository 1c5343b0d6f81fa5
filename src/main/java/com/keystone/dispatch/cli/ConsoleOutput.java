package com.keystone.dispatch.cli;

import com.keystone.core.model.GateRecord;
import com.keystone.core.model.OrchestrationIssue;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.WorkflowOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Keystone CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) KEYSTONE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KEYSTONE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stepTable(Iterable<Step> steps) {
        System.out.printf("  %-10s %-22s %-12s %-14s %s%n", "STEP", "ROLE", "STATUS", "DEPENDS", "ARTIFACTS");
        System.out.println("  " + "-".repeat(78));
        for (Step s : steps) {
            String status = switch (s.status()) {
                case COMPLETED -> "@|fg(green) " + pad(s.status()) + "|@";
                case FAILED -> "@|fg(red) " + pad(s.status()) + "|@";
                case BLOCKED -> "@|fg(yellow) " + pad(s.status()) + "|@";
                default -> pad(s.status());
            };
            String role = s.fallbackFrom() != null ? s.assignedRole() + " (<" + s.fallbackFrom() + ")" : s.assignedRole();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-10s %-22s %s %-14s %s",
                    s.stepId(), role, status, String.join(",", s.dependencies()),
                    String.join(", ", s.producedArtifacts()))));
        }
    }

    public static void gate(GateRecord r) {
        String verdict = switch (r.verdict()) {
            case PASS -> "@|fg(green) PASS|@";
            case PASS_WITH_WARNINGS -> "@|fg(yellow) PASS_WITH_WARNINGS|@";
            case FAIL -> "@|fg(red) FAIL|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  #%d %-20s schema=%s score=%.2f %s", r.attempt(), r.role(), r.schemaCheck(),
                r.qualityScore(), verdict)));
        for (String e : r.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(red) -|@ " + e));
        }
        for (String w : r.warnings()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(yellow) -|@ " + w));
        }
    }

    public static void issue(OrchestrationIssue issue) {
        String color = issue.kind().blocking() ? "fg(red)" : "fg(yellow)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|" + color + " [" + issue.kind() + "]|@ "
                + (issue.stepId() != null ? issue.stepId() + ": " : "") + issue.message()));
    }

    public static void outcome(WorkflowOutcome outcome) {
        System.out.println();
        System.out.println("WORKFLOW " + outcome.workflowId());
        stepTable(outcome.plan().steps());
        if (!outcome.issues().isEmpty()) {
            System.out.println();
            System.out.println("Issues (" + outcome.issues().size() + "):");
            outcome.issues().forEach(ConsoleOutput::issue);
        }
        System.out.println();
        String summary = outcome.status() + " after " + outcome.wavesExecuted() + " wave(s)";
        switch (outcome.status()) {
            case COMPLETED -> success(summary);
            case HANDOFF_TRIGGERED -> warn(summary + "; continue with: keystone resume " + outcome.workflowId());
            case BLOCKED -> warn(summary + "; see: keystone conflicts " + outcome.workflowId());
            case FAILED -> error(summary);
        }
    }

    private static String pad(StepStatus status) {
        return String.format("%-12s", status);
    }
}
