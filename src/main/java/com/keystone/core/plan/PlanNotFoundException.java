package com.keystone.core.plan;

public class PlanNotFoundException extends RuntimeException {

    public PlanNotFoundException(String workflowId) {
        super("No plan found for workflow " + workflowId);
    }
}
