package com.saga.core.exception;

/**
 * Thrown when a saga or one of its steps is not found.
 */
public class SagaNotFoundException extends SagaException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public SagaNotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
