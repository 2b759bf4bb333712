package com.saga.core.exception;

/**
 * Thrown when a saga is started for a type that was never registered.
 */
public class UnregisteredSagaTypeException extends SagaException {

    public static final String ERROR_CODE = "UNREGISTERED_SAGA_TYPE";

    private final String sagaType;

    public UnregisteredSagaTypeException(String sagaType) {
        super(ERROR_CODE, "Saga type " + sagaType + " not registered");
        this.sagaType = sagaType;
    }

    public String getSagaType() {
        return sagaType;
    }
}
