package com.saga.core.exception;

import com.saga.core.model.SagaStatus;

/**
 * Thrown when an invalid state transition is attempted,
 * or an operation is requested on a saga in the wrong state.
 */
public class InvalidSagaStateException extends SagaException {

    public static final String ERROR_CODE = "INVALID_SAGA_STATE";

    public InvalidSagaStateException(SagaStatus currentStatus, SagaStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidSagaStateException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }

    public InvalidSagaStateException(String message) {
        super(ERROR_CODE, message);
    }
}
