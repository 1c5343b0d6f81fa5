package com.keystone.core.worker;

public class WorkerUnavailableException extends RuntimeException {

    public WorkerUnavailableException(String role, String detail) {
        super("Worker for role " + role + " unavailable: " + detail);
    }

    public WorkerUnavailableException(String role, String detail, Throwable cause) {
        super("Worker for role " + role + " unavailable: " + detail, cause);
    }
}
