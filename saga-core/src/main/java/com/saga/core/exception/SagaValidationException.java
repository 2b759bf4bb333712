package com.saga.core.exception;

/**
 * Thrown when a saga registration fails validation.
 */
public class SagaValidationException extends SagaException {

    public static final String ERROR_CODE = "SAGA_VALIDATION_FAILED";

    public SagaValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public SagaValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid saga registration: %s - %s", field, reason));
    }
}
