package com.saga.core.exception;

/**
 * Thrown when another orchestrator holds the lease of a saga.
 */
public class SagaAlreadyRunningException extends SagaException {

    public static final String ERROR_CODE = "SAGA_ALREADY_RUNNING";

    public SagaAlreadyRunningException(String sagaId) {
        super(ERROR_CODE, "Saga " + sagaId + " is being driven by another orchestrator");
    }
}
