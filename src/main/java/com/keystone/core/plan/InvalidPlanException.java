package com.keystone.core.plan;

/**
 * Thrown when a plan cannot be created or mutated: duplicate step IDs, unknown dependencies,
 * illegal status transitions or writes to an archived plan.
 */
public class InvalidPlanException extends RuntimeException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
