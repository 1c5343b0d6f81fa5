package com.keystone.core.engine;

import com.keystone.core.budget.ContextBudgetMonitor;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.IssueKind;
import com.keystone.core.model.OrchestrationIssue;
import com.keystone.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * State of one orchestration instance run. Everything durable lives in the plan store and the
 * registry; this holds only what the instance accumulates while it runs.
 */
public final class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String workflowId;
    private final Task task;
    private final int generation;
    private final ContextBudgetMonitor budget;
    private final EventBus eventBus;
    private final KeystoneMetrics metrics;
    private final List<OrchestrationIssue> issues = new ArrayList<>();

    RunContext(String workflowId, Task task, int generation, ContextBudgetMonitor budget,
               EventBus eventBus, KeystoneMetrics metrics) {
        this.workflowId = workflowId;
        this.task = task;
        this.generation = generation;
        this.budget = budget;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public String workflowId() { return workflowId; }
    public Task task() { return task; }
    public int generation() { return generation; }
    public ContextBudgetMonitor budget() { return budget; }

    public OrchestrationIssue raise(IssueKind kind, String stepId, String message, Map<String, String> details) {
        var issue = OrchestrationIssue.of(kind, workflowId, stepId, message, details);
        synchronized (issues) {
            issues.add(issue);
        }
        log.warn("{}{}: {} {}", kind, stepId != null ? " on " + stepId : "", message, issue.details());
        metrics.recordIssue(kind.name());
        eventBus.publish(KeystoneEvent.of("issue.raised", workflowId, stepId,
                Map.of("kind", kind.name(), "message", message, "details", issue.details())));
        return issue;
    }

    public void publish(String eventType, String stepId, Map<String, Object> payload) {
        eventBus.publish(KeystoneEvent.of(eventType, workflowId, stepId, payload));
    }

    public List<OrchestrationIssue> issues() {
        synchronized (issues) {
            return List.copyOf(issues);
        }
    }
}
