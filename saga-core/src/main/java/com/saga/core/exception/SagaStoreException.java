package com.saga.core.exception;

/**
 * Thrown when the saga store cannot complete a read or write.
 * Aborts the current run; never treated as a step failure.
 */
public class SagaStoreException extends SagaException {

    public static final String ERROR_CODE = "SAGA_STORE_FAILURE";

    public SagaStoreException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected SagaStoreException(String errorCode, String message) {
        super(errorCode, message);
    }
}
