package com.keystone.core.gate;

/**
 * A role has used every gate attempt it is allowed for a step.
 */
public class RetryBudgetExhaustedException extends RuntimeException {

    public RetryBudgetExhaustedException(String stepId, String role, int maxAttempts) {
        super("Role " + role + " exhausted " + maxAttempts + " gate attempt(s) for " + stepId);
    }
}
