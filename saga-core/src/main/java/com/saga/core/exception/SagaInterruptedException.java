package com.saga.core.exception;

/**
 * Thrown when a saga run is aborted by shutdown or thread interruption.
 * The record is left RUNNING for recovery.
 */
public class SagaInterruptedException extends SagaException {

    public static final String ERROR_CODE = "SAGA_INTERRUPTED";

    public SagaInterruptedException(String sagaId, Throwable cause) {
        super(ERROR_CODE, "Saga " + sagaId + " interrupted", cause);
    }
}
