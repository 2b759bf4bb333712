package com.saga.core.exception;

/**
 * Thrown when a saga is submitted to an orchestrator that is shutting down.
 */
public class SagaRejectedException extends SagaException {

    public static final String ERROR_CODE = "SAGA_REJECTED";

    public SagaRejectedException(String sagaType) {
        super(ERROR_CODE, "Orchestrator is shutting down, saga " + sagaType + " rejected");
    }
}
