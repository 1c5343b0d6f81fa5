package com.keystone.core.worker;

/**
 * An external collaborator that performs the work of one role.
 */
public interface Worker {

    String role();

    /**
     * Executes one attempt.
     *
     * @throws WorkerUnavailableException if the worker cannot be reached at all
     */
    WorkerResponse execute(WorkerRequest request);
}
